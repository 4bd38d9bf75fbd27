package de.caluga.pipeline.aggregation;

import java.util.Map;

/**
 * One stage of an aggregation pipeline. The stage document is rendered when the pipeline is
 * requested, so stages can be filled after they were added.
 */
public abstract class Stage {
    protected final Aggregator aggregator;

    protected Stage(Aggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * @return the stage document, e.g. <code>{"$project": {...}}</code>
     */
    public abstract Map<String, Object> getExpression();

    /**
     * @return the aggregator this stage belongs to, for adding further stages
     */
    public Aggregator end() {
        return aggregator;
    }
}
