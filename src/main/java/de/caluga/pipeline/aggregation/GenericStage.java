package de.caluga.pipeline.aggregation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * stage with a fixed value, like <code>{"$limit": 10}</code>
 */
public class GenericStage extends Stage {
    private final String stageName;
    private final Object value;

    public GenericStage(Aggregator aggregator, String stageName, Object value) {
        super(aggregator);

        if (stageName == null || stageName.isEmpty()) {
            throw new IllegalArgumentException("stage name must not be empty");
        }

        if (!stageName.startsWith("$")) {
            stageName = "$" + stageName;
        }

        this.stageName = stageName;
        this.value = value;
    }

    public String getStageName() {
        return stageName;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Map<String, Object> getExpression() {
        Map<String, Object> ret = new LinkedHashMap<>();
        ret.put(stageName, value);
        return ret;
    }
}
