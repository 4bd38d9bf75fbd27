package de.caluga.pipeline.aggregation;

import de.caluga.pipeline.FieldNameMapper;
import de.caluga.pipeline.PipelineConfig;
import de.caluga.pipeline.UtilsMap;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class AggregatorImpl implements Aggregator {
    private final Logger log = LoggerFactory.getLogger(AggregatorImpl.class);
    private final List<Stage> stages = new ArrayList<>();
    private final PipelineConfig config;
    private final FieldNameMapper nameMapper;

    public AggregatorImpl() {
        this(new PipelineConfig());
    }

    public AggregatorImpl(PipelineConfig config) {
        this.config = config;
        this.nameMapper = config.getFieldNameMapper();
    }

    @Override
    public PipelineConfig getConfig() {
        return config;
    }

    @Override
    public Expr expr() {
        return new Expr(config);
    }

    @Override
    public Project project() {
        Project p = new Project(this);
        addStage(p);
        return p;
    }

    @Override
    public AddFields addFields() {
        AddFields a = new AddFields(this);
        addStage(a);
        return a;
    }

    @Override
    public Group group() {
        Group g = new Group(this);
        addStage(g);
        return g;
    }

    @Override
    public Aggregator match(Map<String, ?> query) {
        return genericStage("$match", query);
    }

    @Override
    public Aggregator match(Expr q) {
        return genericStage("$match", UtilsMap.of("$expr", q.getExpression()));
    }

    @Override
    public Aggregator limit(int num) {
        return genericStage("$limit", num);
    }

    @Override
    public Aggregator skip(int num) {
        return genericStage("$skip", num);
    }

    @Override
    public Aggregator sort(String... prefixed) {
        Map<String, Integer> m = new LinkedHashMap<>();

        for (String i : prefixed) {
            String fld = i;
            int val = 1;

            if (i.startsWith("-")) {
                fld = i.substring(1);
                val = -1;
            } else if (i.startsWith("+")) {
                fld = i.substring(1);
            }

            m.put(nameMapper.getMongoFieldName(fld), val);
        }

        return sort(m);
    }

    @Override
    public Aggregator sort(Map<String, Integer> sort) {
        return genericStage("$sort", sort);
    }

    @Override
    public Aggregator unwind(String listField) {
        if (listField.startsWith("$")) {
            listField = listField.substring(1);
        }

        return genericStage("$unwind", "$" + nameMapper.getMongoFieldName(listField));
    }

    @Override
    public Aggregator count(String fld) {
        return genericStage("$count", fld);
    }

    @Override
    public Aggregator genericStage(String stageName, Object param) {
        if (param instanceof Expr) {
            param = ((Expr) param).getExpression();
        }

        return addStage(new GenericStage(this, stageName, param));
    }

    @Override
    public Aggregator addStage(Stage stage) {
        if (log.isDebugEnabled()) {
            log.debug("adding stage #{}: {}", stages.size(), stage.getClass().getSimpleName());
        }

        stages.add(stage);
        return this;
    }

    @Override
    public List<Stage> getStages() {
        return Collections.unmodifiableList(stages);
    }

    @Override
    public List<Map<String, Object>> getPipeline() {
        List<Map<String, Object>> ret = new ArrayList<>();

        for (Stage s : stages) {
            ret.add(s.getExpression());
        }

        return ret;
    }

    @Override
    public String toJson() {
        return getPipeline().stream().map(m -> new Document(m).toJson()).collect(Collectors.joining(", ", "[", "]"));
    }
}
