package de.caluga.pipeline.aggregation;

/**
 * Fluent interface for adding operators to aggregation stages.
 * <p>
 * Every method hands its arguments unchanged to the same named method of the stage's {@link Expr}
 * and returns this stage, so calls can be chained:
 * <pre>
 *     aggregator.project()
 *         .field("total").add("$price", "$fee")
 *         .field("year").year("$createdAt")
 *         .end()
 *         .limit(10);
 * </pre>
 * Operators without a method of their own can be added through {@link #call(String, Object...)}.
 * Argument checks and errors are left to {@link Expr}.
 *
 * @param <O> the concrete stage type returned for chaining
 */
public abstract class Operator<O extends Operator<O>> extends Stage {
    protected final Expr expr;

    protected Operator(Aggregator aggregator) {
        this(aggregator, aggregator.expr());
    }

    protected Operator(Aggregator aggregator, Expr expr) {
        super(aggregator);
        this.expr = expr;
    }

    @SuppressWarnings("unchecked")
    protected O self() {
        return (O) this;
    }

    public Expr getExpr() {
        return expr;
    }

    /**
     * forwards any operator by name
     *
     * @see Expr#call(String, Object...)
     */
    public O call(String operatorName, Object... args) {
        expr.call(operatorName, args);
        return self();
    }

    /**
     * @see Expr#field(String)
     */
    public O field(String fieldName) {
        expr.field(fieldName);
        return self();
    }

    /**
     * @see Expr#expression(Object)
     */
    public O expression(Object value) {
        expr.expression(value);
        return self();
    }

    /**
     * Returns the absolute value of a number.
     *
     * @see <a href="https://docs.mongodb.com/manual/reference/operator/aggregation/abs/">$abs</a>
     */
    public O abs(Object number) {
        expr.abs(number);
        return self();
    }

    /**
     * Adds numbers together or adds numbers and a date. If one of the arguments is a date, the
     * other arguments are treated as milliseconds to add to the date.
     *
     * @see <a href="https://docs.mongodb.com/manual/reference/operator/aggregation/add/">$add</a>
     */
    public O add(Object expression1, Object expression2, Object... expressions) {
        expr.add(expression1, expression2, expressions);
        return self();
    }

    public O addAnd(Object expression, Object... expressions) {
        expr.addAnd(expression, expressions);
        return self();
    }

    public O addOr(Object expression, Object... expressions) {
        expr.addOr(expression, expressions);
        return self();
    }

    public O allElementsTrue(Object expression) {
        expr.allElementsTrue(expression);
        return self();
    }

    public O anyElementTrue(Object expression) {
        expr.anyElementTrue(expression);
        return self();
    }

    /**
     * Returns the element at the specified array index. Negative indexes count from the end.
     */
    public O arrayElemAt(Object array, Object index) {
        expr.arrayElemAt(array, index);
        return self();
    }

    public O ceil(Object number) {
        expr.ceil(number);
        return self();
    }

    /**
     * Compares two values, resulting in -1, 0 or 1.
     */
    public O cmp(Object expression1, Object expression2) {
        expr.cmp(expression1, expression2);
        return self();
    }

    public O concat(Object expression1, Object expression2, Object... expressions) {
        expr.concat(expression1, expression2, expressions);
        return self();
    }

    public O concatArrays(Object array1, Object array2, Object... arrays) {
        expr.concatArrays(array1, array2, arrays);
        return self();
    }

    /**
     * Evaluates a boolean expression to return one of the two specified return expressions.
     *
     * @see <a href="https://docs.mongodb.com/manual/reference/operator/aggregation/cond/">$cond</a>
     */
    public O cond(Object ifExpression, Object thenExpression, Object elseExpression) {
        expr.cond(ifExpression, thenExpression, elseExpression);
        return self();
    }

    /**
     * Converts a date object to a string according to a user-specified format.
     *
     * @see <a href="https://docs.mongodb.com/manual/reference/operator/aggregation/dateToString/">$dateToString</a>
     */
    public O dateToString(String format, Object expression) {
        expr.dateToString(format, expression);
        return self();
    }

    public O dayOfMonth(Object expression) {
        expr.dayOfMonth(expression);
        return self();
    }

    public O dayOfWeek(Object expression) {
        expr.dayOfWeek(expression);
        return self();
    }

    public O dayOfYear(Object expression) {
        expr.dayOfYear(expression);
        return self();
    }

    public O divide(Object expression1, Object expression2) {
        expr.divide(expression1, expression2);
        return self();
    }

    public O eq(Object expression1, Object expression2) {
        expr.eq(expression1, expression2);
        return self();
    }

    public O exp(Object exponent) {
        expr.exp(exponent);
        return self();
    }

    /**
     * Selects a subset of the array to return an array with only the elements that match the
     * condition. <code>as</code> names the variable holding the current element.
     */
    public O filter(Object input, String as, Object cond) {
        expr.filter(input, as, cond);
        return self();
    }

    public O floor(Object number) {
        expr.floor(number);
        return self();
    }

    public O gt(Object expression1, Object expression2) {
        expr.gt(expression1, expression2);
        return self();
    }

    public O gte(Object expression1, Object expression2) {
        expr.gte(expression1, expression2);
        return self();
    }

    public O hour(Object expression) {
        expr.hour(expression);
        return self();
    }

    public O in(Object expression, Object arrayExpression) {
        expr.in(expression, arrayExpression);
        return self();
    }

    public O indexOfArray(Object arrayExpression, Object searchExpression) {
        expr.indexOfArray(arrayExpression, searchExpression);
        return self();
    }

    public O indexOfArray(Object arrayExpression, Object searchExpression, Object start) {
        expr.indexOfArray(arrayExpression, searchExpression, start);
        return self();
    }

    /**
     * Searches an array for an occurrence of a specified value and returns the array index of the
     * first occurrence.
     */
    public O indexOfArray(Object arrayExpression, Object searchExpression, Object start, Object end) {
        expr.indexOfArray(arrayExpression, searchExpression, start, end);
        return self();
    }

    public O indexOfBytes(Object stringExpression, Object substringExpression) {
        expr.indexOfBytes(stringExpression, substringExpression);
        return self();
    }

    public O indexOfBytes(Object stringExpression, Object substringExpression, Object start) {
        expr.indexOfBytes(stringExpression, substringExpression, start);
        return self();
    }

    public O indexOfBytes(Object stringExpression, Object substringExpression, Object start, Object end) {
        expr.indexOfBytes(stringExpression, substringExpression, start, end);
        return self();
    }

    public O indexOfCP(Object stringExpression, Object substringExpression) {
        expr.indexOfCP(stringExpression, substringExpression);
        return self();
    }

    public O indexOfCP(Object stringExpression, Object substringExpression, Object start) {
        expr.indexOfCP(stringExpression, substringExpression, start);
        return self();
    }

    public O indexOfCP(Object stringExpression, Object substringExpression, Object start, Object end) {
        expr.indexOfCP(stringExpression, substringExpression, start, end);
        return self();
    }

    /**
     * Evaluates an expression and returns the value of the expression if it evaluates to a
     * non-null value, otherwise the replacement.
     */
    public O ifNull(Object expression, Object replacementExpression) {
        expr.ifNull(expression, replacementExpression);
        return self();
    }

    public O isArray(Object expression) {
        expr.isArray(expression);
        return self();
    }

    public O isoDayOfWeek(Object expression) {
        expr.isoDayOfWeek(expression);
        return self();
    }

    public O isoWeek(Object expression) {
        expr.isoWeek(expression);
        return self();
    }

    public O isoWeekYear(Object expression) {
        expr.isoWeekYear(expression);
        return self();
    }

    /**
     * Binds variables for use in the specified expression, and returns the result of the
     * expression.
     */
    public O let(Object vars, Object in) {
        expr.let(vars, in);
        return self();
    }

    public O literal(Object value) {
        expr.literal(value);
        return self();
    }

    public O ln(Object number) {
        expr.ln(number);
        return self();
    }

    public O log(Object number, Object base) {
        expr.log(number, base);
        return self();
    }

    public O log10(Object number) {
        expr.log10(number);
        return self();
    }

    public O lt(Object expression1, Object expression2) {
        expr.lt(expression1, expression2);
        return self();
    }

    public O lte(Object expression1, Object expression2) {
        expr.lte(expression1, expression2);
        return self();
    }

    /**
     * Applies an expression to each item in an array and returns an array with the applied
     * results.
     *
     * @see <a href="https://docs.mongodb.com/manual/reference/operator/aggregation/map/">$map</a>
     */
    public O map(Object input, String as, Object in) {
        expr.map(input, as, in);
        return self();
    }

    public O meta(String metaDataKeyword) {
        expr.meta(metaDataKeyword);
        return self();
    }

    public O millisecond(Object expression) {
        expr.millisecond(expression);
        return self();
    }

    public O minute(Object expression) {
        expr.minute(expression);
        return self();
    }

    public O mod(Object expression1, Object expression2) {
        expr.mod(expression1, expression2);
        return self();
    }

    public O month(Object expression) {
        expr.month(expression);
        return self();
    }

    public O multiply(Object expression1, Object expression2, Object... expressions) {
        expr.multiply(expression1, expression2, expressions);
        return self();
    }

    public O ne(Object expression1, Object expression2) {
        expr.ne(expression1, expression2);
        return self();
    }

    public O not(Object expression) {
        expr.not(expression);
        return self();
    }

    public O pow(Object number, Object exponent) {
        expr.pow(number, exponent);
        return self();
    }

    public O range(Object start, Object end) {
        expr.range(start, end);
        return self();
    }

    public O range(Object start, Object end, Object step) {
        expr.range(start, end, step);
        return self();
    }

    /**
     * Applies an expression to each element in an array and combines them into a single value.
     *
     * @see <a href="https://docs.mongodb.com/manual/reference/operator/aggregation/reduce/">$reduce</a>
     */
    public O reduce(Object input, Object initialValue, Object in) {
        expr.reduce(input, initialValue, in);
        return self();
    }

    public O reverseArray(Object expression) {
        expr.reverseArray(expression);
        return self();
    }

    public O second(Object expression) {
        expr.second(expression);
        return self();
    }

    public O setDifference(Object expression1, Object expression2) {
        expr.setDifference(expression1, expression2);
        return self();
    }

    public O setEquals(Object expression1, Object expression2, Object... expressions) {
        expr.setEquals(expression1, expression2, expressions);
        return self();
    }

    public O setIntersection(Object expression1, Object expression2, Object... expressions) {
        expr.setIntersection(expression1, expression2, expressions);
        return self();
    }

    public O setIsSubset(Object expression1, Object expression2) {
        expr.setIsSubset(expression1, expression2);
        return self();
    }

    public O setUnion(Object expression1, Object expression2, Object... expressions) {
        expr.setUnion(expression1, expression2, expressions);
        return self();
    }

    public O size(Object expression) {
        expr.size(expression);
        return self();
    }

    public O slice(Object array, Object n) {
        expr.slice(array, n);
        return self();
    }

    public O slice(Object array, Object n, Object position) {
        expr.slice(array, n, position);
        return self();
    }

    public O split(Object string, Object delimiter) {
        expr.split(string, delimiter);
        return self();
    }

    public O sqrt(Object expression) {
        expr.sqrt(expression);
        return self();
    }

    public O strcasecmp(Object expression1, Object expression2) {
        expr.strcasecmp(expression1, expression2);
        return self();
    }

    public O strLenBytes(Object string) {
        expr.strLenBytes(string);
        return self();
    }

    public O strLenCP(Object string) {
        expr.strLenCP(string);
        return self();
    }

    public O substr(Object string, Object start, Object length) {
        expr.substr(string, start, length);
        return self();
    }

    public O substrBytes(Object string, Object start, Object count) {
        expr.substrBytes(string, start, count);
        return self();
    }

    public O substrCP(Object string, Object start, Object count) {
        expr.substrCP(string, start, count);
        return self();
    }

    public O subtract(Object expression1, Object expression2) {
        expr.subtract(expression1, expression2);
        return self();
    }

    public O toLower(Object expression) {
        expr.toLower(expression);
        return self();
    }

    public O toUpper(Object expression) {
        expr.toUpper(expression);
        return self();
    }

    public O trunc(Object number) {
        expr.trunc(number);
        return self();
    }

    public O type(Object expression) {
        expr.type(expression);
        return self();
    }

    public O week(Object expression) {
        expr.week(expression);
        return self();
    }

    public O year(Object expression) {
        expr.year(expression);
        return self();
    }

    public O zip(Object inputs) {
        expr.zip(inputs);
        return self();
    }

    public O zip(Object inputs, Boolean useLongestLength) {
        expr.zip(inputs, useLongestLength);
        return self();
    }

    /**
     * Transposes an array of input arrays.
     *
     * @see <a href="https://docs.mongodb.com/manual/reference/operator/aggregation/zip/">$zip</a>
     */
    public O zip(Object inputs, Boolean useLongestLength, Object defaults) {
        expr.zip(inputs, useLongestLength, defaults);
        return self();
    }

    public O switchExpr() {
        expr.switchExpr();
        return self();
    }

    public O caseExpr(Object expression) {
        expr.caseExpr(expression);
        return self();
    }

    public O then(Object expression) {
        expr.then(expression);
        return self();
    }

    public O defaultExpr(Object expression) {
        expr.defaultExpr(expression);
        return self();
    }
}
