package de.caluga.pipeline.aggregation;

import de.caluga.pipeline.UtilsMap;

import java.util.Map;

/**
 * <code>$addFields</code> stage
 */
public class AddFields extends Operator<AddFields> {

    public AddFields(Aggregator aggregator) {
        super(aggregator);
    }

    public AddFields(Aggregator aggregator, Expr expr) {
        super(aggregator, expr);
    }

    @Override
    public Map<String, Object> getExpression() {
        return UtilsMap.of("$addFields", expr.getExpression());
    }
}
