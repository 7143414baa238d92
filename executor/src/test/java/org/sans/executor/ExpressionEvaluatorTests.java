package org.sans.executor;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.frontend.Dialect;
import org.sans.compiler.frontend.ExpressionParser;
import org.sans.compiler.ir.step.FormatStep;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class ExpressionEvaluatorTests {
    final Map<String, Object> row = new HashMap<>();
    final ExpressionEvaluator evaluator = new ExpressionEvaluator(new HashMap<>());

    Object eval(String text) {
        return this.evaluator.evaluate(
                ExpressionParser.parse(text, Dialect.NATIVE, SourcePositionRange.INVALID),
                ExpressionEvaluator.of(this.row));
    }

    Object legacy(String text) {
        return this.evaluator.evaluate(
                ExpressionParser.parse(text, Dialect.LEGACY, SourcePositionRange.INVALID),
                ExpressionEvaluator.of(this.row));
    }

    @Test
    public void arithmetic() {
        this.row.put("a", 7L);
        this.row.put("b", new BigDecimal("0.5"));
        Assert.assertEquals(10L, this.eval("a + 3"));
        Assert.assertEquals(0, new BigDecimal("7.5").compareTo((BigDecimal) this.eval("a + b")));
        Assert.assertEquals(0, new BigDecimal("3.5").compareTo((BigDecimal) this.eval("a / 2")));
        Assert.assertEquals(-7L, this.eval("-a"));
        // Missing propagates, and so does division by zero
        Assert.assertNull(this.eval("a + missing"));
        Assert.assertNull(this.eval("a / 0"));
    }

    @Test
    public void overflow() {
        this.row.put("big", Long.MAX_VALUE);
        try {
            this.eval("big + 1");
            Assert.fail("Expected an overflow");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_TYPE_MISMATCH, e.code);
        }
    }

    @Test
    public void threeValuedLogic() {
        this.row.put("t", true);
        this.row.put("f", false);
        Assert.assertEquals(true, this.eval("t or m"));
        Assert.assertNull(this.eval("f or m"));
        Assert.assertEquals(false, this.eval("f and m"));
        Assert.assertNull(this.eval("t and m"));
        Assert.assertNull(this.eval("not m"));
        Assert.assertEquals(false, this.eval("not t"));
    }

    @Test
    public void comparisons() {
        this.row.put("x", 1L);
        this.row.put("d", new BigDecimal("1.0"));
        // Missing sorts before every value and equals itself
        Assert.assertEquals(true, this.eval("m < x"));
        Assert.assertEquals(true, this.eval("m == null"));
        Assert.assertEquals(false, this.eval("x == null"));
        Assert.assertEquals(true, this.eval("x == d"));
        Assert.assertEquals(true, this.legacy("x eq 1"));
        Assert.assertEquals(true, this.legacy("x ^= 2"));
        Assert.assertEquals(true, this.legacy("m = ."));
    }

    @Test
    public void mixedComparisonFails() {
        this.row.put("s", "a");
        this.row.put("x", 1L);
        try {
            this.eval("s > x");
            Assert.fail("Expected a type mismatch");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_TYPE_MISMATCH, e.code);
        }
    }

    @Test
    public void conditionals() {
        this.row.put("x", 5L);
        Assert.assertEquals("big", this.eval("if(x > 3, \"big\", \"small\")"));
        // Missing sorts low, so the comparison is false
        Assert.assertEquals("small", this.eval("if(m > 3, \"big\", \"small\")"));
        Assert.assertEquals(5L, this.eval("coalesce(m, x, 0)"));
        Assert.assertNull(this.eval("coalesce(m, null)"));
    }

    @Test
    public void formats() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("M", "Male");
        labels.put("F", "Female");
        this.evaluator.define(new FormatStep(SourcePositionRange.INVALID, "$sexf", labels, null));
        Map<String, String> grades = new LinkedHashMap<>();
        grades.put("1", "Low");
        this.evaluator.define(new FormatStep(SourcePositionRange.INVALID, "grade", grades, "High"));

        this.row.put("sex", "F");
        this.row.put("g", new BigDecimal("1.00"));
        this.row.put("h", 7L);
        Assert.assertEquals("Female", this.legacy("put(sex, $sexf.)"));
        // Decimal keys are matched in canonical form
        Assert.assertEquals("Low", this.legacy("put(g, grade.)"));
        Assert.assertEquals("High", this.legacy("put(h, grade.)"));

        this.row.put("sex", "U");
        try {
            this.legacy("put(sex, $sexf.)");
            Assert.fail("Expected a format miss");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_FORMAT_MISS, e.code);
        }
        try {
            this.legacy("put(sex, $other.)");
            Assert.fail("Expected an undefined format");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_FORMAT_UNDEFINED, e.code);
        }
    }

    @Test
    public void informats() {
        this.row.put("text", " 42 ");
        this.row.put("zero", "007");
        this.row.put("bad", "n/a");
        // Always a decimal, matching the static type of input()
        Assert.assertEquals(new BigDecimal("42"), this.legacy("input(text, best12.)"));
        Assert.assertEquals(0, new BigDecimal("7").compareTo((BigDecimal) this.legacy("input(zero, best.)")));
        this.row.put("n", 5L);
        Assert.assertEquals(0, new BigDecimal("5").compareTo((BigDecimal) this.legacy("input(n, best.)")));
        Assert.assertNull(this.legacy("input(bad, best12.)"));
        try {
            this.legacy("input(text, date9.)");
            Assert.fail("Expected an unsupported informat");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_INFORMAT_UNSUPPORTED, e.code);
        }
    }

    @Test
    public void formatNames() {
        Assert.assertEquals("sexf", ExpressionEvaluator.formatKey("$SEXF."));
        Assert.assertEquals("grade", ExpressionEvaluator.formatKey("grade"));
    }
}
