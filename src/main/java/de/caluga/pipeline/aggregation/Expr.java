package de.caluga.pipeline.aggregation;

import de.caluga.pipeline.FieldNameMapper;
import de.caluga.pipeline.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builder for aggregation expressions.
 * <p>
 * Every operator method stores <code>{"$op": args}</code> either on the field selected with
 * {@link #field(String)} or, if no field is selected, on the root of the expression. Arguments may
 * be plain values, maps, lists, arrays or other <code>Expr</code> instances, which are rendered
 * with {@link #getExpression()}. Strings starting with a single <code>$</code> are field references
 * and run through the configured {@link FieldNameMapper}.
 * <pre>
 *     Expr e = new Expr().field("total").add("$price", "$fee").field("label").toUpper("$name");
 *     // {total: {$add: ["$price", "$fee"]}, label: {$toUpper: "$name"}}
 * </pre>
 * Instances are not thread safe.
 */
@SuppressWarnings("unchecked")
public class Expr {
    private final Logger log = LoggerFactory.getLogger(Expr.class);
    private final PipelineConfig config;
    private final FieldNameMapper nameMapper;
    private final Map<String, Object> expr = new LinkedHashMap<>();
    private String currentField;
    private Map<String, Object> switchBranch;

    public Expr() {
        this(new PipelineConfig());
    }

    public Expr(PipelineConfig config) {
        this.config = config;
        this.nameMapper = config.getFieldNameMapper();
    }

    public PipelineConfig getConfig() {
        return config;
    }

    /**
     * @return the expression built so far
     */
    public Map<String, Object> getExpression() {
        return expr;
    }

    public String getCurrentField() {
        return currentField;
    }

    /**
     * Selects the field following operators are stored on. <code>null</code> switches back to the
     * root of the expression.
     */
    public Expr field(String fieldName) {
        currentField = fieldName == null ? null : nameMapper.getMongoFieldName(fieldName);
        return this;
    }

    /**
     * sets the current field to a plain value or a nested expression
     */
    public Expr expression(Object value) {
        requiresCurrentField("expression()");
        expr.put(currentField, convertExpression(value));
        return this;
    }

    /**
     * Generic entry point: resolves the name in {@link ExprOperator} or as one of the builder
     * methods (<code>field</code>, <code>expression</code>, <code>switch</code>, <code>case</code>,
     * <code>then</code>, <code>default</code>, <code>and</code>, <code>or</code>). Unknown names are
     * rendered as <code>{"$name": args}</code>, unless strict operators are configured.
     *
     * @param name operator name, with or without leading <code>$</code>
     * @throws IllegalArgumentException for unknown names in strict mode or a wrong argument count
     */
    public Expr call(String name, Object... args) {
        String n = name == null ? "" : name.trim();

        if (n.startsWith("$")) {
            n = n.substring(1);
        }

        if (n.isEmpty()) {
            throw new IllegalArgumentException("operator name must not be empty");
        }

        if (args == null) {
            args = new Object[0];
        }

        switch (n) {
            case "field":
                requireArgs(n, args, 1);
                return field(args[0] == null ? null : args[0].toString());

            case "expression":
                requireArgs(n, args, 1);
                return expression(args[0]);

            case "switch":
            case "switchExpr":
                requireArgs(n, args, 0);
                return switchExpr();

            case "case":
            case "caseExpr":
                requireArgs(n, args, 1);
                return caseExpr(args[0]);

            case "then":
                requireArgs(n, args, 1);
                return then(args[0]);

            case "default":
            case "defaultExpr":
                requireArgs(n, args, 1);
                return defaultExpr(args[0]);

            case "and":
            case "addAnd":
                if (args.length == 0) {
                    return appendToList("$and", args);
                }

                return addAnd(args[0], Arrays.copyOfRange(args, 1, args.length));

            case "or":
            case "addOr":
                if (args.length == 0) {
                    return appendToList("$or", args);
                }

                return addOr(args[0], Arrays.copyOfRange(args, 1, args.length));

            case "range":
                // step defaults to 1
                if (args.length == 2) {
                    return range(args[0], args[1]);
                }

                break;

            default:
                break;
        }

        ExprOperator op = ExprOperator.forName(n);

        if (op != null) {
            return operator(op, Arrays.asList(args));
        }

        if (config.isStrictOperators()) {
            throw new IllegalArgumentException("unknown aggregation operator $" + n);
        }

        log.debug("unknown operator ${} - rendering {} argument(s) as is", n, args.length);
        List<Object> converted = new ArrayList<>();

        for (Object a : args) {
            converted.add(convertExpression(a));
        }

        return setOperator("$" + n, converted.size() == 1 ? converted.get(0) : converted);
    }

    /**
     * stores <code>op</code> with the given arguments on the current field
     */
    protected Expr operator(ExprOperator op, List<Object> args) {
        op.checkArity(args.size());
        List<Object> converted = new ArrayList<>(args.size());

        for (Object a : args) {
            if (op == ExprOperator.LITERAL) {
                converted.add(copyOf(a));
            } else {
                converted.add(convertExpression(a));
            }
        }

        return setOperator(op.getMongoOperator(), op.shape(converted));
    }

    private Expr setOperator(String mongoOperator, Object value) {
        currentExpression().put(mongoOperator, value);
        return this;
    }

    private Map<String, Object> currentExpression() {
        if (currentField == null) {
            return expr;
        }

        Object cur = expr.get(currentField);

        if (!(cur instanceof Map)) {
            cur = new LinkedHashMap<String, Object>();
            expr.put(currentField, cur);
        }

        return (Map<String, Object>) cur;
    }

    private Map<String, Object> currentExpressionOrNull() {
        if (currentField == null) {
            return expr;
        }

        Object cur = expr.get(currentField);
        return cur instanceof Map ? (Map<String, Object>) cur : null;
    }

    private Expr appendToList(String mongoOperator, Object[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException(mongoOperator + " expects at least 1 argument(s), got 0");
        }

        Map<String, Object> cur = currentExpression();
        Object existing = cur.get(mongoOperator);
        List<Object> lst;

        if (existing instanceof List) {
            lst = (List<Object>) existing;
        } else {
            lst = new ArrayList<>();
            cur.put(mongoOperator, lst);
        }

        for (Object a : args) {
            lst.add(convertExpression(a));
        }

        return this;
    }

    private void requiresCurrentField(String method) {
        if (currentField == null) {
            throw new IllegalStateException(method + " requires setting a current field using field()");
        }
    }

    private Map<String, Object> requiresSwitchStatement(String method) {
        Map<String, Object> cur = currentExpressionOrNull();

        if (cur == null || !(cur.get("$switch") instanceof Map)) {
            throw new IllegalStateException(method + " requires a valid switch statement (call switchExpr() first)");
        }

        return (Map<String, Object>) cur.get("$switch");
    }

    private static void requireArgs(String method, Object[] args, int count) {
        if (args.length != count) {
            throw new IllegalArgumentException(method + "() expects " + count + " argument(s), got " + args.length);
        }
    }

    /**
     * Converts an argument into its document form: nested expressions are rendered, maps, lists and
     * arrays are copied recursively, field references are mapped.
     */
    public Object convertExpression(Object o) {
        if (o == null) {
            return null;
        }

        if (o instanceof Expr) {
            return copyOf(((Expr) o).getExpression());
        }

        if (o instanceof Map) {
            Map<String, Object> ret = new LinkedHashMap<>();

            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                ret.put(String.valueOf(e.getKey()), convertExpression(e.getValue()));
            }

            return ret;
        }

        if (o instanceof Collection) {
            List<Object> ret = new ArrayList<>();

            for (Object e : (Collection<?>) o) {
                ret.add(convertExpression(e));
            }

            return ret;
        }

        if (o instanceof Object[]) {
            return convertExpression(Arrays.asList((Object[]) o));
        }

        if (o instanceof String) {
            String s = (String) o;

            if (s.startsWith("$$")) {
                // variable name stays, the path below it is a field path
                int dot = s.indexOf('.');

                if (dot > 2 && dot < s.length() - 1) {
                    return s.substring(0, dot + 1) + nameMapper.getMongoFieldName(s.substring(dot + 1));
                }
            } else if (s.length() > 1 && s.startsWith("$")) {
                return "$" + nameMapper.getMongoFieldName(s.substring(1));
            }
        }

        return o;
    }

    private static Object copyOf(Object o) {
        if (o instanceof Expr) {
            return copyOf(((Expr) o).getExpression());
        }

        if (o instanceof Map) {
            Map<String, Object> ret = new LinkedHashMap<>();

            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                ret.put(String.valueOf(e.getKey()), copyOf(e.getValue()));
            }

            return ret;
        }

        if (o instanceof Collection) {
            List<Object> ret = new ArrayList<>();

            for (Object e : (Collection<?>) o) {
                ret.add(copyOf(e));
            }

            return ret;
        }

        if (o instanceof Object[]) {
            return copyOf(Arrays.asList((Object[]) o));
        }

        return o;
    }

    private static List<Object> argList(Object first, Object second, Object[] more) {
        List<Object> ret = new ArrayList<>();
        ret.add(first);
        ret.add(second);

        if (more != null) {
            ret.addAll(Arrays.asList(more));
        }

        return ret;
    }

    private static List<Object> args(Object... a) {
        return new ArrayList<>(Arrays.asList(a));
    }

    public Expr abs(Object number) {
        return operator(ExprOperator.ABS, args(number));
    }

    /**
     * adds numbers, or numbers as milliseconds to a date
     */
    public Expr add(Object expression1, Object expression2, Object... expressions) {
        return operator(ExprOperator.ADD, argList(expression1, expression2, expressions));
    }

    /**
     * appends one or more clauses to <code>$and</code>
     */
    public Expr addAnd(Object expression, Object... expressions) {
        Object[] all = new Object[1 + (expressions == null ? 0 : expressions.length)];
        all[0] = expression;

        if (expressions != null) {
            System.arraycopy(expressions, 0, all, 1, expressions.length);
        }

        return appendToList("$and", all);
    }

    /**
     * appends one or more clauses to <code>$or</code>
     */
    public Expr addOr(Object expression, Object... expressions) {
        Object[] all = new Object[1 + (expressions == null ? 0 : expressions.length)];
        all[0] = expression;

        if (expressions != null) {
            System.arraycopy(expressions, 0, all, 1, expressions.length);
        }

        return appendToList("$or", all);
    }

    public Expr allElementsTrue(Object expression) {
        return operator(ExprOperator.ALL_ELEMENTS_TRUE, args(expression));
    }

    public Expr anyElementTrue(Object expression) {
        return operator(ExprOperator.ANY_ELEMENT_TRUE, args(expression));
    }

    public Expr arrayElemAt(Object array, Object index) {
        return operator(ExprOperator.ARRAY_ELEM_AT, args(array, index));
    }

    public Expr ceil(Object number) {
        return operator(ExprOperator.CEIL, args(number));
    }

    public Expr cmp(Object expression1, Object expression2) {
        return operator(ExprOperator.CMP, args(expression1, expression2));
    }

    public Expr concat(Object expression1, Object expression2, Object... expressions) {
        return operator(ExprOperator.CONCAT, argList(expression1, expression2, expressions));
    }

    public Expr concatArrays(Object array1, Object array2, Object... arrays) {
        return operator(ExprOperator.CONCAT_ARRAYS, argList(array1, array2, arrays));
    }

    public Expr cond(Object ifExpression, Object thenExpression, Object elseExpression) {
        return operator(ExprOperator.COND, args(ifExpression, thenExpression, elseExpression));
    }

    public Expr dateToString(String format, Object expression) {
        return operator(ExprOperator.DATE_TO_STRING, args(format, expression));
    }

    public Expr dayOfMonth(Object expression) {
        return operator(ExprOperator.DAY_OF_MONTH, args(expression));
    }

    public Expr dayOfWeek(Object expression) {
        return operator(ExprOperator.DAY_OF_WEEK, args(expression));
    }

    public Expr dayOfYear(Object expression) {
        return operator(ExprOperator.DAY_OF_YEAR, args(expression));
    }

    public Expr divide(Object expression1, Object expression2) {
        return operator(ExprOperator.DIVIDE, args(expression1, expression2));
    }

    public Expr eq(Object expression1, Object expression2) {
        return operator(ExprOperator.EQ, args(expression1, expression2));
    }

    public Expr exp(Object exponent) {
        return operator(ExprOperator.EXP, args(exponent));
    }

    public Expr filter(Object input, String as, Object cond) {
        return operator(ExprOperator.FILTER, args(input, as, cond));
    }

    public Expr floor(Object number) {
        return operator(ExprOperator.FLOOR, args(number));
    }

    public Expr gt(Object expression1, Object expression2) {
        return operator(ExprOperator.GT, args(expression1, expression2));
    }

    public Expr gte(Object expression1, Object expression2) {
        return operator(ExprOperator.GTE, args(expression1, expression2));
    }

    public Expr hour(Object expression) {
        return operator(ExprOperator.HOUR, args(expression));
    }

    public Expr in(Object expression, Object arrayExpression) {
        return operator(ExprOperator.IN, args(expression, arrayExpression));
    }

    public Expr indexOfArray(Object arrayExpression, Object searchExpression) {
        return operator(ExprOperator.INDEX_OF_ARRAY, args(arrayExpression, searchExpression));
    }

    public Expr indexOfArray(Object arrayExpression, Object searchExpression, Object start) {
        return operator(ExprOperator.INDEX_OF_ARRAY, args(arrayExpression, searchExpression, start));
    }

    /**
     * <code>start</code> and <code>end</code> are optional, <code>end</code> is only used if
     * <code>start</code> is set
     */
    public Expr indexOfArray(Object arrayExpression, Object searchExpression, Object start, Object end) {
        return operator(ExprOperator.INDEX_OF_ARRAY, args(arrayExpression, searchExpression, start, end));
    }

    public Expr indexOfBytes(Object stringExpression, Object substringExpression) {
        return operator(ExprOperator.INDEX_OF_BYTES, args(stringExpression, substringExpression));
    }

    public Expr indexOfBytes(Object stringExpression, Object substringExpression, Object start) {
        return operator(ExprOperator.INDEX_OF_BYTES, args(stringExpression, substringExpression, start));
    }

    public Expr indexOfBytes(Object stringExpression, Object substringExpression, Object start, Object end) {
        return operator(ExprOperator.INDEX_OF_BYTES, args(stringExpression, substringExpression, start, end));
    }

    public Expr indexOfCP(Object stringExpression, Object substringExpression) {
        return operator(ExprOperator.INDEX_OF_CP, args(stringExpression, substringExpression));
    }

    public Expr indexOfCP(Object stringExpression, Object substringExpression, Object start) {
        return operator(ExprOperator.INDEX_OF_CP, args(stringExpression, substringExpression, start));
    }

    public Expr indexOfCP(Object stringExpression, Object substringExpression, Object start, Object end) {
        return operator(ExprOperator.INDEX_OF_CP, args(stringExpression, substringExpression, start, end));
    }

    public Expr ifNull(Object expression, Object replacementExpression) {
        return operator(ExprOperator.IF_NULL, args(expression, replacementExpression));
    }

    public Expr isArray(Object expression) {
        return operator(ExprOperator.IS_ARRAY, args(expression));
    }

    public Expr isoDayOfWeek(Object expression) {
        return operator(ExprOperator.ISO_DAY_OF_WEEK, args(expression));
    }

    public Expr isoWeek(Object expression) {
        return operator(ExprOperator.ISO_WEEK, args(expression));
    }

    public Expr isoWeekYear(Object expression) {
        return operator(ExprOperator.ISO_WEEK_YEAR, args(expression));
    }

    public Expr let(Object vars, Object in) {
        return operator(ExprOperator.LET, args(vars, in));
    }

    /**
     * value is stored as is, <code>$</code>-strings are not treated as field references
     */
    public Expr literal(Object value) {
        return operator(ExprOperator.LITERAL, args(value));
    }

    public Expr ln(Object number) {
        return operator(ExprOperator.LN, args(number));
    }

    public Expr log(Object number, Object base) {
        return operator(ExprOperator.LOG, args(number, base));
    }

    public Expr log10(Object number) {
        return operator(ExprOperator.LOG10, args(number));
    }

    public Expr lt(Object expression1, Object expression2) {
        return operator(ExprOperator.LT, args(expression1, expression2));
    }

    public Expr lte(Object expression1, Object expression2) {
        return operator(ExprOperator.LTE, args(expression1, expression2));
    }

    public Expr map(Object input, String as, Object in) {
        return operator(ExprOperator.MAP, args(input, as, in));
    }

    public Expr meta(String metaDataKeyword) {
        return operator(ExprOperator.META, args(metaDataKeyword));
    }

    public Expr millisecond(Object expression) {
        return operator(ExprOperator.MILLISECOND, args(expression));
    }

    public Expr minute(Object expression) {
        return operator(ExprOperator.MINUTE, args(expression));
    }

    public Expr mod(Object expression1, Object expression2) {
        return operator(ExprOperator.MOD, args(expression1, expression2));
    }

    public Expr month(Object expression) {
        return operator(ExprOperator.MONTH, args(expression));
    }

    public Expr multiply(Object expression1, Object expression2, Object... expressions) {
        return operator(ExprOperator.MULTIPLY, argList(expression1, expression2, expressions));
    }

    public Expr ne(Object expression1, Object expression2) {
        return operator(ExprOperator.NE, args(expression1, expression2));
    }

    public Expr not(Object expression) {
        return operator(ExprOperator.NOT, args(expression));
    }

    public Expr pow(Object number, Object exponent) {
        return operator(ExprOperator.POW, args(number, exponent));
    }

    /**
     * range with step 1
     */
    public Expr range(Object start, Object end) {
        return range(start, end, 1);
    }

    public Expr range(Object start, Object end, Object step) {
        return operator(ExprOperator.RANGE, args(start, end, step));
    }

    public Expr reduce(Object input, Object initialValue, Object in) {
        return operator(ExprOperator.REDUCE, args(input, initialValue, in));
    }

    public Expr reverseArray(Object expression) {
        return operator(ExprOperator.REVERSE_ARRAY, args(expression));
    }

    public Expr second(Object expression) {
        return operator(ExprOperator.SECOND, args(expression));
    }

    public Expr setDifference(Object expression1, Object expression2) {
        return operator(ExprOperator.SET_DIFFERENCE, args(expression1, expression2));
    }

    public Expr setEquals(Object expression1, Object expression2, Object... expressions) {
        return operator(ExprOperator.SET_EQUALS, argList(expression1, expression2, expressions));
    }

    public Expr setIntersection(Object expression1, Object expression2, Object... expressions) {
        return operator(ExprOperator.SET_INTERSECTION, argList(expression1, expression2, expressions));
    }

    public Expr setIsSubset(Object expression1, Object expression2) {
        return operator(ExprOperator.SET_IS_SUBSET, args(expression1, expression2));
    }

    public Expr setUnion(Object expression1, Object expression2, Object... expressions) {
        return operator(ExprOperator.SET_UNION, argList(expression1, expression2, expressions));
    }

    public Expr size(Object expression) {
        return operator(ExprOperator.SIZE, args(expression));
    }

    public Expr slice(Object array, Object n) {
        return operator(ExprOperator.SLICE, args(array, n));
    }

    /**
     * rendered as <code>[array, position, n]</code>
     */
    public Expr slice(Object array, Object n, Object position) {
        return operator(ExprOperator.SLICE, args(array, n, position));
    }

    public Expr split(Object string, Object delimiter) {
        return operator(ExprOperator.SPLIT, args(string, delimiter));
    }

    public Expr sqrt(Object expression) {
        return operator(ExprOperator.SQRT, args(expression));
    }

    public Expr strcasecmp(Object expression1, Object expression2) {
        return operator(ExprOperator.STRCASECMP, args(expression1, expression2));
    }

    public Expr strLenBytes(Object string) {
        return operator(ExprOperator.STR_LEN_BYTES, args(string));
    }

    public Expr strLenCP(Object string) {
        return operator(ExprOperator.STR_LEN_CP, args(string));
    }

    public Expr substr(Object string, Object start, Object length) {
        return operator(ExprOperator.SUBSTR, args(string, start, length));
    }

    public Expr substrBytes(Object string, Object start, Object count) {
        return operator(ExprOperator.SUBSTR_BYTES, args(string, start, count));
    }

    public Expr substrCP(Object string, Object start, Object count) {
        return operator(ExprOperator.SUBSTR_CP, args(string, start, count));
    }

    public Expr subtract(Object expression1, Object expression2) {
        return operator(ExprOperator.SUBTRACT, args(expression1, expression2));
    }

    public Expr toLower(Object expression) {
        return operator(ExprOperator.TO_LOWER, args(expression));
    }

    public Expr toUpper(Object expression) {
        return operator(ExprOperator.TO_UPPER, args(expression));
    }

    public Expr trunc(Object number) {
        return operator(ExprOperator.TRUNC, args(number));
    }

    public Expr type(Object expression) {
        return operator(ExprOperator.TYPE, args(expression));
    }

    public Expr week(Object expression) {
        return operator(ExprOperator.WEEK, args(expression));
    }

    public Expr year(Object expression) {
        return operator(ExprOperator.YEAR, args(expression));
    }

    public Expr zip(Object inputs) {
        return operator(ExprOperator.ZIP, args(inputs));
    }

    public Expr zip(Object inputs, Boolean useLongestLength) {
        return operator(ExprOperator.ZIP, args(inputs, useLongestLength));
    }

    /**
     * <code>defaults</code> needs <code>useLongestLength</code> to be true, otherwise mongo will
     * reject the expression
     */
    public Expr zip(Object inputs, Boolean useLongestLength, Object defaults) {
        return operator(ExprOperator.ZIP, args(inputs, useLongestLength, defaults));
    }

    // $switch

    public Expr switchExpr() {
        switchBranch = null;
        return setOperator("$switch", new LinkedHashMap<String, Object>());
    }

    public Expr caseExpr(Object expression) {
        requiresSwitchStatement("caseExpr()");

        if (switchBranch != null) {
            throw new IllegalStateException("caseExpr() cannot be called again before then()");
        }

        switchBranch = new LinkedHashMap<>();
        switchBranch.put("case", convertExpression(expression));
        return this;
    }

    public Expr then(Object expression) {
        if (switchBranch == null) {
            throw new IllegalStateException("then() requires caseExpr() to be called first");
        }

        Map<String, Object> sw = requiresSwitchStatement("then()");
        switchBranch.put("then", convertExpression(expression));
        Object branches = sw.get("branches");

        if (!(branches instanceof List)) {
            branches = new ArrayList<>();
            sw.put("branches", branches);
        }

        ((List<Object>) branches).add(switchBranch);
        switchBranch = null;
        return this;
    }

    public Expr defaultExpr(Object expression) {
        Map<String, Object> sw = requiresSwitchStatement("defaultExpr()");

        if (switchBranch != null) {
            throw new IllegalStateException("defaultExpr() cannot be called before then()");
        }

        sw.put("default", convertExpression(expression));
        return this;
    }

    // accumulators

    public Expr addToSet(Object expression) {
        return operator(ExprOperator.ADD_TO_SET, args(expression));
    }

    public Expr avg(Object expression) {
        return operator(ExprOperator.AVG, args(expression));
    }

    public Expr first(Object expression) {
        return operator(ExprOperator.FIRST, args(expression));
    }

    public Expr last(Object expression) {
        return operator(ExprOperator.LAST, args(expression));
    }

    public Expr max(Object expression) {
        return operator(ExprOperator.MAX, args(expression));
    }

    public Expr min(Object expression) {
        return operator(ExprOperator.MIN, args(expression));
    }

    public Expr push(Object expression) {
        return operator(ExprOperator.PUSH, args(expression));
    }

    public Expr stdDevPop(Object expression) {
        return operator(ExprOperator.STD_DEV_POP, args(expression));
    }

    public Expr stdDevSamp(Object expression) {
        return operator(ExprOperator.STD_DEV_SAMP, args(expression));
    }

    public Expr sum(Object expression) {
        return operator(ExprOperator.SUM, args(expression));
    }

    @Override
    public String toString() {
        return "Expr" + expr;
    }
}
