package de.caluga.pipeline.aggregation;

import de.caluga.pipeline.PipelineConfig;

import java.util.List;
import java.util.Map;

/**
 * Assembles an aggregation pipeline. Stages are kept in the order they were added:
 * $project
 * $addFields
 * $group
 * $match
 * $limit
 * $skip
 * $sort
 * $unwind
 * $count
 * and any other stage through {@link #genericStage(String, Object)}
 */
public interface Aggregator {

    PipelineConfig getConfig();

    /**
     * @return a new, empty expression builder using this aggregator's configuration
     */
    Expr expr();

    Project project();

    AddFields addFields();

    Group group();

    Aggregator match(Map<String, ?> query);

    /**
     * adds <code>{"$match": {"$expr": q}}</code>
     */
    Aggregator match(Expr q);

    Aggregator limit(int num);

    Aggregator skip(int num);

    /**
     * @param prefixed field names, prefixed with <code>-</code> for descending order
     */
    Aggregator sort(String... prefixed);

    Aggregator sort(Map<String, Integer> sort);

    Aggregator unwind(String listField);

    Aggregator count(String fld);

    Aggregator genericStage(String stageName, Object param);

    Aggregator addStage(Stage stage);

    List<Stage> getStages();

    List<Map<String, Object>> getPipeline();

    /**
     * @return the pipeline as extended json array
     */
    String toJson();
}
