package de.caluga.pipeline.aggregation;

import de.caluga.pipeline.UtilsMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregation operators known to {@link Expr}: mongo name, number of accepted arguments and how
 * the arguments are laid out in the resulting document.
 * <p>
 * {@link Expr} and {@link Operator} expose one method per entry. The generic
 * {@link Expr#call(String, Object...)} resolves names through this table, so both paths render the
 * same document.
 */
public enum ExprOperator {
    ABS("abs", Shape.SINGLE, 1, 1),
    ADD("add", Shape.LIST, 2, -1),
    ALL_ELEMENTS_TRUE("allElementsTrue", Shape.SINGLE, 1, 1),
    ANY_ELEMENT_TRUE("anyElementTrue", Shape.SINGLE, 1, 1),
    ARRAY_ELEM_AT("arrayElemAt", Shape.LIST, 2, 2),
    CEIL("ceil", Shape.SINGLE, 1, 1),
    CMP("cmp", Shape.LIST, 2, 2),
    CONCAT("concat", Shape.LIST, 2, -1),
    CONCAT_ARRAYS("concatArrays", Shape.LIST, 2, -1),
    COND("cond", Shape.NAMED, 3, 3, "if", "then", "else"),
    DATE_TO_STRING("dateToString", Shape.NAMED, 2, 2, "format", "date"),
    DAY_OF_MONTH("dayOfMonth", Shape.SINGLE, 1, 1),
    DAY_OF_WEEK("dayOfWeek", Shape.SINGLE, 1, 1),
    DAY_OF_YEAR("dayOfYear", Shape.SINGLE, 1, 1),
    DIVIDE("divide", Shape.LIST, 2, 2),
    EQ("eq", Shape.LIST, 2, 2),
    EXP("exp", Shape.SINGLE, 1, 1),
    FILTER("filter", Shape.NAMED, 3, 3, "input", "as", "cond"),
    FLOOR("floor", Shape.SINGLE, 1, 1),
    GT("gt", Shape.LIST, 2, 2),
    GTE("gte", Shape.LIST, 2, 2),
    HOUR("hour", Shape.SINGLE, 1, 1),
    IN("in", Shape.LIST, 2, 2),
    INDEX_OF_ARRAY("indexOfArray", Shape.OPTIONAL_TAIL, 2, 4),
    INDEX_OF_BYTES("indexOfBytes", Shape.OPTIONAL_TAIL, 2, 4),
    INDEX_OF_CP("indexOfCP", Shape.OPTIONAL_TAIL, 2, 4),
    IF_NULL("ifNull", Shape.LIST, 2, 2),
    IS_ARRAY("isArray", Shape.SINGLE, 1, 1),
    ISO_DAY_OF_WEEK("isoDayOfWeek", Shape.SINGLE, 1, 1),
    ISO_WEEK("isoWeek", Shape.SINGLE, 1, 1),
    ISO_WEEK_YEAR("isoWeekYear", Shape.SINGLE, 1, 1),
    LET("let", Shape.NAMED, 2, 2, "vars", "in"),
    LITERAL("literal", Shape.SINGLE, 1, 1),
    LN("ln", Shape.SINGLE, 1, 1),
    LOG("log", Shape.LIST, 2, 2),
    LOG10("log10", Shape.SINGLE, 1, 1),
    LT("lt", Shape.LIST, 2, 2),
    LTE("lte", Shape.LIST, 2, 2),
    MAP("map", Shape.NAMED, 3, 3, "input", "as", "in"),
    META("meta", Shape.SINGLE, 1, 1),
    MILLISECOND("millisecond", Shape.SINGLE, 1, 1),
    MINUTE("minute", Shape.SINGLE, 1, 1),
    MOD("mod", Shape.LIST, 2, 2),
    MONTH("month", Shape.SINGLE, 1, 1),
    MULTIPLY("multiply", Shape.LIST, 2, -1),
    NE("ne", Shape.LIST, 2, 2),
    NOT("not", Shape.SINGLE, 1, 1),
    POW("pow", Shape.LIST, 2, 2),
    RANGE("range", Shape.LIST, 2, 3),
    REDUCE("reduce", Shape.NAMED, 3, 3, "input", "initialValue", "in"),
    REVERSE_ARRAY("reverseArray", Shape.SINGLE, 1, 1),
    SECOND("second", Shape.SINGLE, 1, 1),
    SET_DIFFERENCE("setDifference", Shape.LIST, 2, 2),
    SET_EQUALS("setEquals", Shape.LIST, 2, -1),
    SET_INTERSECTION("setIntersection", Shape.LIST, 2, -1),
    SET_IS_SUBSET("setIsSubset", Shape.LIST, 2, 2),
    SET_UNION("setUnion", Shape.LIST, 2, -1),
    SIZE("size", Shape.SINGLE, 1, 1),
    SLICE("slice", Shape.SLICE, 2, 3),
    SPLIT("split", Shape.LIST, 2, 2),
    SQRT("sqrt", Shape.SINGLE, 1, 1),
    STRCASECMP("strcasecmp", Shape.LIST, 2, 2),
    STR_LEN_BYTES("strLenBytes", Shape.SINGLE, 1, 1),
    STR_LEN_CP("strLenCP", Shape.SINGLE, 1, 1),
    SUBSTR("substr", Shape.LIST, 3, 3),
    SUBSTR_BYTES("substrBytes", Shape.LIST, 3, 3),
    SUBSTR_CP("substrCP", Shape.LIST, 3, 3),
    SUBTRACT("subtract", Shape.LIST, 2, 2),
    TO_LOWER("toLower", Shape.SINGLE, 1, 1),
    TO_UPPER("toUpper", Shape.SINGLE, 1, 1),
    TRUNC("trunc", Shape.SINGLE, 1, 1),
    TYPE("type", Shape.SINGLE, 1, 1),
    WEEK("week", Shape.SINGLE, 1, 1),
    YEAR("year", Shape.SINGLE, 1, 1),
    ZIP("zip", Shape.NAMED_OPTIONAL, 1, 3, "inputs", "useLongestLength", "defaults"),

    // accumulators, only valid in $group
    ADD_TO_SET("addToSet", Shape.SINGLE, 1, 1),
    AVG("avg", Shape.SINGLE, 1, 1),
    FIRST("first", Shape.SINGLE, 1, 1),
    LAST("last", Shape.SINGLE, 1, 1),
    MAX("max", Shape.SINGLE, 1, 1),
    MIN("min", Shape.SINGLE, 1, 1),
    PUSH("push", Shape.SINGLE, 1, 1),
    STD_DEV_POP("stdDevPop", Shape.SINGLE, 1, 1),
    STD_DEV_SAMP("stdDevSamp", Shape.SINGLE, 1, 1),
    SUM("sum", Shape.SINGLE, 1, 1);

    /**
     * layout of the operator arguments
     */
    public enum Shape {
        /** <code>{$op: arg}</code> */
        SINGLE,
        /** <code>{$op: [arg1, arg2, ...]}</code> */
        LIST,
        /** <code>{$op: [arg1, arg2, ...]}</code>, trailing optional arguments dropped from the first null on */
        OPTIONAL_TAIL,
        /** <code>{$op: {key1: arg1, ...}}</code> */
        NAMED,
        /** like NAMED, null arguments are left out */
        NAMED_OPTIONAL,
        /** <code>{$slice: [array, n]}</code> or <code>{$slice: [array, position, n]}</code> */
        SLICE
    }

    private static final Map<String, ExprOperator> byName = new HashMap<>();

    static {
        for (ExprOperator op : values()) {
            byName.put(op.operatorName, op);
        }
    }

    private final String operatorName;
    private final Shape shape;
    private final int minArgs;
    private final int maxArgs;
    private final List<String> keys;

    ExprOperator(String operatorName, Shape shape, int minArgs, int maxArgs, String... keys) {
        this.operatorName = operatorName;
        this.shape = shape;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.keys = Collections.unmodifiableList(Arrays.asList(keys));
    }

    /**
     * @param name operator name, with or without leading <code>$</code>
     * @return the operator or null, if unknown
     */
    public static ExprOperator forName(String name) {
        if (name == null) {
            return null;
        }

        if (name.startsWith("$")) {
            name = name.substring(1);
        }

        return byName.get(name);
    }

    /**
     * name without leading <code>$</code>, also the name of the builder method
     */
    public String getOperatorName() {
        return operatorName;
    }

    public String getMongoOperator() {
        return "$" + operatorName;
    }

    public Shape getShape() {
        return shape;
    }

    public int getMinArgs() {
        return minArgs;
    }

    /**
     * @return maximum number of arguments, -1 for variadic operators
     */
    public int getMaxArgs() {
        return maxArgs;
    }

    public boolean isVariadic() {
        return maxArgs < 0;
    }

    public List<String> getKeys() {
        return keys;
    }

    public void checkArity(int count) {
        if (count < minArgs || (maxArgs >= 0 && count > maxArgs)) {
            String expected;

            if (maxArgs < 0) {
                expected = "at least " + minArgs;
            } else if (minArgs == maxArgs) {
                expected = String.valueOf(minArgs);
            } else {
                expected = minArgs + " to " + maxArgs;
            }

            throw new IllegalArgumentException(getMongoOperator() + " expects " + expected + " argument(s), got " + count);
        }
    }

    /**
     * lays out already converted arguments
     */
    public Object shape(List<Object> args) {
        switch (shape) {
            case SINGLE:
                return args.get(0);

            case LIST:
                return new ArrayList<>(args);

            case OPTIONAL_TAIL: {
                List<Object> ret = new ArrayList<>();

                for (int i = 0; i < args.size(); i++) {
                    if (i >= minArgs && args.get(i) == null) {
                        break;
                    }

                    ret.add(args.get(i));
                }

                return ret;
            }

            case NAMED: {
                Map<String, Object> ret = new UtilsMap<>();

                for (int i = 0; i < args.size(); i++) {
                    ret.put(keys.get(i), args.get(i));
                }

                return ret;
            }

            case NAMED_OPTIONAL: {
                UtilsMap<String, Object> ret = new UtilsMap<>();

                for (int i = 0; i < args.size(); i++) {
                    ret.add(keys.get(i), args.get(i));
                }

                return ret;
            }

            case SLICE:
                if (args.size() < 3 || args.get(2) == null) {
                    return new ArrayList<>(args.subList(0, 2));
                }

                return new ArrayList<>(Arrays.asList(args.get(0), args.get(2), args.get(1)));

            default:
                throw new IllegalStateException("unhandled shape " + shape);
        }
    }
}
