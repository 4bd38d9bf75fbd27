package de.caluga.test.pipeline;

import de.caluga.pipeline.PipelineConfig;
import de.caluga.pipeline.UtilsMap;
import de.caluga.pipeline.aggregation.Expr;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SuppressWarnings("unchecked")
@Tag("core")
public class ExprTest {

    @Test
    public void testFieldAndOperator() {
        Expr e = new Expr().field("total").add("$price", "$fee").field("label").toUpper("$name");

        assertThat(e.getExpression()).isEqualTo(UtilsMap.of(
                    "total", UtilsMap.of("$add", Arrays.asList("$price", "$fee")),
                    "label", UtilsMap.of("$toUpper", "$name")));
    }

    @Test
    public void testRootOperator() {
        Expr e = new Expr().abs(-12);
        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("$abs", -12));
    }

    @Test
    public void testCond() {
        Expr e = new Expr().cond(new Expr().gte("$qty", 250), 30, 20);

        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("$cond", UtilsMap.of(
                    "if", UtilsMap.of("$gte", Arrays.asList("$qty", 250)),
                    "then", 30,
                    "else", 20)));
    }

    @Test
    public void testCondKeepsNullBranch() {
        Map<String, Object> cond = (Map<String, Object>) new Expr().cond("$flag", "$value", null).getExpression().get("$cond");
        assertThat(cond).containsKeys("if", "then", "else");
        assertThat(cond.get("else")).isNull();
    }

    @Test
    public void testDateToString() {
        Expr e = new Expr().dateToString("%Y-%m-%d", "$date");
        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("$dateToString", UtilsMap.of("format", "%Y-%m-%d", "date", "$date")));
    }

    @Test
    public void testFilterMapReduceLet() {
        Expr e = new Expr()
        .field("f").filter("$items", "item", new Expr().gte("$$item.price", 100))
        .field("m").map("$items", "item", new Expr().multiply("$$item.price", 2))
        .field("r").reduce("$items", 0, new Expr().add("$$value", "$$this"))
        .field("l").let(UtilsMap.of("total", "$price"), "$$total");

        Map<String, Object> f = (Map<String, Object>) ((Map<String, Object>) e.getExpression().get("f")).get("$filter");
        assertThat(f).containsOnlyKeys("input", "as", "cond");
        assertThat(f.get("as")).isEqualTo("item");

        Map<String, Object> m = (Map<String, Object>) ((Map<String, Object>) e.getExpression().get("m")).get("$map");
        assertThat(m.get("in")).isEqualTo(UtilsMap.of("$multiply", Arrays.asList("$$item.price", 2)));

        Map<String, Object> r = (Map<String, Object>) ((Map<String, Object>) e.getExpression().get("r")).get("$reduce");
        assertThat(r).containsEntry("initialValue", 0);

        Map<String, Object> l = (Map<String, Object>) ((Map<String, Object>) e.getExpression().get("l")).get("$let");
        assertThat(l).isEqualTo(UtilsMap.of("vars", UtilsMap.of("total", "$price"), "in", "$$total"));
    }

    @Test
    public void testOptionalTail() {
        assertThat(new Expr().indexOfArray("$a", 2, null, 5).getExpression().get("$indexOfArray")).isEqualTo(Arrays.asList("$a", 2));
        assertThat(new Expr().indexOfArray("$a", 2, 1, null).getExpression().get("$indexOfArray")).isEqualTo(Arrays.asList("$a", 2, 1));
        assertThat(new Expr().indexOfCP("$s", "x", 1, 4).getExpression().get("$indexOfCP")).isEqualTo(Arrays.asList("$s", "x", 1, 4));
    }

    @Test
    public void testSlice() {
        assertThat(new Expr().slice("$a", 3).getExpression().get("$slice")).isEqualTo(Arrays.asList("$a", 3));
        assertThat(new Expr().slice("$a", 3, 1).getExpression().get("$slice")).isEqualTo(Arrays.asList("$a", 1, 3));
        assertThat(new Expr().slice("$a", 3, null).getExpression().get("$slice")).isEqualTo(Arrays.asList("$a", 3));
    }

    @Test
    public void testRange() {
        assertThat(new Expr().range(0, 10).getExpression().get("$range")).isEqualTo(Arrays.asList(0, 10, 1));
        assertThat(new Expr().range(0, 10, 2).getExpression().get("$range")).isEqualTo(Arrays.asList(0, 10, 2));
    }

    @Test
    public void testZip() {
        assertThat(new Expr().zip(Arrays.asList("$a", "$b")).getExpression())
        .isEqualTo(UtilsMap.of("$zip", UtilsMap.of("inputs", Arrays.asList("$a", "$b"))));

        assertThat(new Expr().zip(Arrays.asList("$a", "$b"), true, Arrays.asList(0, 0)).getExpression())
        .isEqualTo(UtilsMap.of("$zip", UtilsMap.of("inputs", Arrays.asList("$a", "$b"), "useLongestLength", true, "defaults", Arrays.asList(0, 0))));
    }

    @Test
    public void testSwitch() {
        Expr e = new Expr().field("grade").switchExpr()
        .caseExpr(new Expr().gte("$score", 90)).then("A")
        .caseExpr(new Expr().gte("$score", 80)).then("B")
        .defaultExpr("C");

        Map<String, Object> sw = (Map<String, Object>) ((Map<String, Object>) e.getExpression().get("grade")).get("$switch");
        List<Object> branches = (List<Object>) sw.get("branches");
        assertThat(branches).hasSize(2);
        assertThat(branches.get(0)).isEqualTo(UtilsMap.of("case", UtilsMap.of("$gte", Arrays.asList("$score", 90)), "then", "A"));
        assertThat(sw.get("default")).isEqualTo("C");
    }

    @Test
    public void testSwitchMisuse() {
        assertThatThrownBy(() -> new Expr().caseExpr(true))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("switchExpr()");

        assertThatThrownBy(() -> new Expr().switchExpr().then("x"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("caseExpr()");

        assertThatThrownBy(() -> new Expr().switchExpr().caseExpr(true).defaultExpr("x"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("before then()");

        assertThatThrownBy(() -> new Expr().switchExpr().caseExpr(true).caseExpr(false))
        .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testAddAndAddOr() {
        Expr e = new Expr().addAnd(new Expr().gt("$a", 1)).addAnd(new Expr().lt("$a", 5), new Expr().ne("$b", null)).addOr(true);

        List<Object> and = (List<Object>) e.getExpression().get("$and");
        assertThat(and).hasSize(3);
        assertThat(and.get(2)).isEqualTo(UtilsMap.of("$ne", Arrays.asList("$b", null)));
        assertThat(e.getExpression().get("$or")).isEqualTo(Arrays.asList(true));
    }

    @Test
    public void testNestedExprIsCopied() {
        Expr inner = new Expr().abs("$x");
        Expr outer = new Expr().field("y").expression(inner);
        inner.ceil("$z");

        assertThat(outer.getExpression()).isEqualTo(UtilsMap.of("y", UtilsMap.of("$abs", "$x")));
    }

    @Test
    public void testExpressionRequiresField() {
        assertThatThrownBy(() -> new Expr().expression(1))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("expression() requires setting a current field using field()");
    }

    @Test
    public void testOperatorOnFieldWithPlainValueReplacesIt() {
        Expr e = new Expr().field("a").expression(1).year("$date");
        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("a", UtilsMap.of("$year", "$date")));
    }

    @Test
    public void testFieldNullReturnsToRoot() {
        Expr e = new Expr().field("a").abs(1).field(null).floor(2);
        assertThat(e.getExpression()).containsEntry("$floor", 2).containsKey("a");
    }

    @Test
    public void testCamelCaseConversion() {
        Expr e = new Expr(new PipelineConfig().setCamelCaseConversion(true))
        .field("totalPrice").add("$unitPrice", "$$shippingCost")
        .field("raw").literal("$notAField")
        .field("prices").map("$lineItems", "item", "$$item.unitPrice");

        assertThat(e.getExpression()).isEqualTo(UtilsMap.of(
                    "total_price", UtilsMap.of("$add", Arrays.asList("$unit_price", "$$shippingCost")),
                    "raw", UtilsMap.of("$literal", "$notAField"),
                    "prices", UtilsMap.of("$map", UtilsMap.of("input", "$line_items", "as", "item", "in", "$$item.unit_price"))));
    }

    @Test
    public void testVariablePathWithoutConversion() {
        Expr e = new Expr().filter("$lineItems", "item", new Expr().gt("$$item.unitPrice", 10));
        Map<String, Object> f = (Map<String, Object>) e.getExpression().get("$filter");

        assertThat(f.get("cond")).isEqualTo(UtilsMap.of("$gt", Arrays.asList("$$item.unitPrice", 10)));
    }

    @Test
    public void testArraysAndCollectionsAreConverted() {
        Expr e = new Expr().in("$tag", new Object[] {"a", "$otherTag"});
        assertThat(e.getExpression().get("$in")).isEqualTo(Arrays.asList("$tag", Arrays.asList("a", "$otherTag")));
    }

    @Test
    public void testCallKnownAndUnknown() {
        Expr e = new Expr().call("$toUpper", "$name");
        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("$toUpper", "$name"));

        e = new Expr().call("toBool", "$flag");
        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("$toBool", "$flag"));

        e = new Expr().call("$round", "$value", 2);
        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("$round", Arrays.asList("$value", 2)));

        e = new Expr().call("field", "x").call("switch").call("case", true).call("then", 1).call("default", 0);
        assertThat(((Map<String, Object>) e.getExpression().get("x"))).containsKey("$switch");

        e = new Expr().call("range", 0, 10);
        assertThat(e.getExpression()).isEqualTo(new Expr().range(0, 10).getExpression());
        assertThat(e.getExpression().get("$range")).isEqualTo(Arrays.asList(0, 10, 1));

        e = new Expr().call("and", 1, 2).call("or", 3);
        assertThat(e.getExpression()).isEqualTo(UtilsMap.of("$and", Arrays.asList(1, 2), "$or", Arrays.asList(3)));
    }

    @Test
    public void testCallErrors() {
        assertThatThrownBy(() -> new Expr().call(" "))
        .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> new Expr().call("$"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("operator name must not be empty");

        assertThatThrownBy(() -> new Expr().call("add", 1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("$add expects at least 2 argument(s), got 1");

        assertThatThrownBy(() -> new Expr().call("field"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("field() expects 1 argument(s), got 0");

        assertThatThrownBy(() -> new Expr(new PipelineConfig().setStrictOperators(true)).call("toBool", "$x"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("unknown aggregation operator $toBool");
    }
}
