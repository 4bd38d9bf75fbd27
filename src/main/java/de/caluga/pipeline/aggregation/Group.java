package de.caluga.pipeline.aggregation;

import de.caluga.pipeline.UtilsMap;

import java.util.Map;

/**
 * <code>$group</code> stage. Set the group key with <code>field("_id").expression(...)</code>,
 * then add accumulated fields:
 * <pre>
 *     aggregator.group()
 *         .field("_id").expression("$customer")
 *         .field("total").sum("$amount")
 *         .field("orders").sum(1);
 * </pre>
 */
public class Group extends Operator<Group> {

    public Group(Aggregator aggregator) {
        super(aggregator);
    }

    public Group(Aggregator aggregator, Expr expr) {
        super(aggregator, expr);
    }

    /**
     * shortcut for <code>field("_id").expression(id)</code>
     */
    public Group id(Object id) {
        return field("_id").expression(id);
    }

    public Group addToSet(Object expression) {
        expr.addToSet(expression);
        return this;
    }

    public Group avg(Object expression) {
        expr.avg(expression);
        return this;
    }

    public Group first(Object expression) {
        expr.first(expression);
        return this;
    }

    public Group last(Object expression) {
        expr.last(expression);
        return this;
    }

    public Group max(Object expression) {
        expr.max(expression);
        return this;
    }

    public Group min(Object expression) {
        expr.min(expression);
        return this;
    }

    public Group push(Object expression) {
        expr.push(expression);
        return this;
    }

    public Group stdDevPop(Object expression) {
        expr.stdDevPop(expression);
        return this;
    }

    public Group stdDevSamp(Object expression) {
        expr.stdDevSamp(expression);
        return this;
    }

    public Group sum(Object expression) {
        expr.sum(expression);
        return this;
    }

    @Override
    public Map<String, Object> getExpression() {
        return UtilsMap.of("$group", expr.getExpression());
    }
}
