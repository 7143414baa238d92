package org.sans.compiler.frontend;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.expression.BinaryExpression;
import org.sans.compiler.ir.expression.BoolExpression;
import org.sans.compiler.ir.expression.CallExpression;
import org.sans.compiler.ir.expression.ColumnExpression;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.expression.LiteralExpression;
import org.sans.compiler.ir.expression.LookupExpression;
import org.sans.compiler.ir.type.ScalarType;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;

public class FrontendTests {
    static Expression legacy(String text) {
        return ExpressionParser.parse(text, Dialect.LEGACY, SourcePositionRange.INVALID);
    }

    static Expression nativeExpression(String text) {
        return ExpressionParser.parse(text, Dialect.NATIVE, SourcePositionRange.INVALID);
    }

    @Test
    public void splitStatements() {
        List<Statement> statements = StatementSplitter.split(
                "data a;\n  x = 'a;b';\n  /* skip; this */ y = \"c;\";\nrun;");
        Assert.assertEquals(4, statements.size());
        Assert.assertEquals("data a", statements.get(0).text);
        Assert.assertEquals("x = 'a;b'", statements.get(1).text);
        Assert.assertEquals("y = \"c;\"", statements.get(2).text);
        Assert.assertEquals("run", statements.get(3).keyword());
        Assert.assertEquals(2, statements.get(1).range.start.line);
    }

    @Test
    public void starComments() {
        List<Statement> statements = StatementSplitter.split("* a comment; with words;\nproc sort data=a out=b; by x; run;");
        // The comment ends at the first semicolon; the rest is a statement
        Assert.assertEquals("with words", statements.get(0).text);
        Assert.assertEquals("proc sort data=a out=b", statements.get(1).text);
    }

    @Test
    public void segmentBlocks() {
        List<Block> blocks = BlockSegmenter.segment(StatementSplitter.split(
                "data a; set b; run; proc sort data=a out=c; by x; run; options nodate;"));
        Assert.assertEquals(3, blocks.size());
        Assert.assertEquals(Block.Kind.DATA, blocks.get(0).kind);
        Assert.assertEquals(1, blocks.get(0).body.size());
        Assert.assertEquals(Block.Kind.PROC, blocks.get(1).kind);
        Assert.assertNotNull(blocks.get(1).end);
        Assert.assertEquals(Block.Kind.OTHER, blocks.get(2).kind);
    }

    @Test
    public void macroSubstitution() {
        MacroPreprocessor preprocessor = new MacroPreprocessor(List.of());
        String result = preprocessor.process("%let cutoff = 10;\ndata a; set b; if x > &cutoff.; run;");
        String[] lines = result.split("\n", -1);
        Assert.assertEquals(2, lines.length);
        Assert.assertEquals("", lines[0]);
        Assert.assertEquals("data a; set b; if x > 10; run;", lines[1]);
        Assert.assertEquals("&undefined", preprocessor.substitute("&undefined"));
    }

    @Test
    public void macroConditional() {
        MacroPreprocessor preprocessor = new MacroPreprocessor(List.of());
        String result = preprocessor.process("%let mode = full;\n%if &mode = full %then data a; %else data b;");
        Assert.assertEquals("data a;", result.split("\n")[1].strip());
    }

    @Test
    public void macroControlFlowIsRefused() {
        MacroPreprocessor preprocessor = new MacroPreprocessor(List.of());
        try {
            preprocessor.process("%let n = 3;\n%do i = 1 %to &n;\n%end;");
            Assert.fail("Expected a macro error");
        } catch (CompilationError e) {
            Assert.assertEquals(ErrorCode.MACRO_ERROR, e.code);
            Assert.assertEquals(2, e.range.start.line);
        }
    }

    @Test
    public void includeRequiresRoot() {
        MacroPreprocessor preprocessor = new MacroPreprocessor(List.of());
        try {
            preprocessor.process("%include 'common.sas';");
            Assert.fail("Expected a macro error");
        } catch (CompilationError e) {
            Assert.assertEquals(ErrorCode.MACRO_ERROR, e.code);
        }
    }

    @Test
    public void legacyOperators() {
        BinaryExpression ne = legacy("x ne 1").to(BinaryExpression.class);
        Assert.assertEquals(BinaryExpression.Opcode.NEQ, ne.opcode);
        BinaryExpression eq = legacy("x = 'a'").to(BinaryExpression.class);
        Assert.assertEquals(BinaryExpression.Opcode.EQ, eq.opcode);
        Assert.assertEquals("a", eq.right.to(LiteralExpression.class).value);
        LiteralExpression missing = legacy(".").to(LiteralExpression.class);
        Assert.assertEquals(ScalarType.NULL, missing.type);
        ColumnExpression flag = legacy("first.subjid").to(ColumnExpression.class);
        Assert.assertEquals("first.subjid", flag.name);
    }

    @Test
    public void precedence() {
        BoolExpression or = legacy("a = 1 or b = 2 and c = 3").to(BoolExpression.class);
        Assert.assertEquals(BoolExpression.Opcode.OR, or.opcode);
        Assert.assertEquals(BoolExpression.Opcode.AND, or.args.get(1).to(BoolExpression.class).opcode);
        BinaryExpression sum = nativeExpression("1 + 2 * 3").to(BinaryExpression.class);
        Assert.assertEquals(BinaryExpression.Opcode.ADD, sum.opcode);
        Assert.assertEquals(BinaryExpression.Opcode.MUL, sum.right.to(BinaryExpression.class).opcode);
    }

    @Test
    public void literals() {
        Assert.assertEquals(10L, nativeExpression("10").to(LiteralExpression.class).value);
        Assert.assertEquals(new BigDecimal("2.5"), nativeExpression("2.5").to(LiteralExpression.class).value);
        Assert.assertEquals(true, nativeExpression("true").to(LiteralExpression.class).value);
        // In the legacy dialect true is just a column name
        Assert.assertTrue(legacy("true").is(ColumnExpression.class));
    }

    @Test
    public void calls() {
        LookupExpression put = legacy("put(sex, $sexf.)").to(LookupExpression.class);
        Assert.assertEquals("$sexf", put.format);
        CallExpression input = legacy("input(value, best12.)").to(CallExpression.class);
        Assert.assertEquals(CallExpression.Function.INPUT, input.function);
        Assert.assertEquals("best12", input.args.get(1).to(LiteralExpression.class).value);
        CallExpression coalesce = nativeExpression("coalesce(a, b, 0)").to(CallExpression.class);
        Assert.assertEquals(3, coalesce.args.size());
    }

    @Test
    public void nativeRejectsLegacyEquality() {
        try {
            nativeExpression("x = 1");
            Assert.fail("Expected a parse error");
        } catch (CompilationError e) {
            Assert.assertEquals(ErrorCode.EXPRESSION_ERROR, e.code);
        }
    }

    @Test
    public void unsupportedFunction() {
        try {
            legacy("lag(x)");
            Assert.fail("Expected a parse error");
        } catch (CompilationError e) {
            Assert.assertEquals(ErrorCode.EXPRESSION_ERROR, e.code);
            Assert.assertTrue(e.getMessage().contains("lag"));
        }
    }
}
