package de.caluga.pipeline.aggregation;

import de.caluga.pipeline.UtilsMap;

import java.util.Map;

/**
 * <code>$project</code> stage
 */
public class Project extends Operator<Project> {

    public Project(Aggregator aggregator) {
        super(aggregator);
    }

    public Project(Aggregator aggregator, Expr expr) {
        super(aggregator, expr);
    }

    /**
     * field: 1
     */
    public Project includeFields(String... fields) {
        return projectFields(1, fields);
    }

    /**
     * field: 0
     */
    public Project excludeFields(String... fields) {
        return projectFields(0, fields);
    }

    private Project projectFields(int value, String... fields) {
        for (String f : fields) {
            field(f).expression(value);
        }

        return this;
    }

    @Override
    public Map<String, Object> getExpression() {
        return UtilsMap.of("$project", expr.getExpression());
    }
}
