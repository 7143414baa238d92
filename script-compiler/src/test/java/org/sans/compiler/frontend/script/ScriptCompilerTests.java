package org.sans.compiler.frontend.script;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.Datasource;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.expression.BinaryExpression;
import org.sans.compiler.ir.expression.LiteralExpression;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.CastStep;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class ScriptCompilerTests {
    static final String PIPELINE = String.join("\n",
            "# sans 0.1",
            "let limit = 18",
            "datasource dm = inline_csv do",
            "  subjid,age,weight,active",
            "  101,34,70.5,true",
            "  102,17,,false",
            "end",
            "table adults = from(dm) do",
            "  filter(age >= limit)",
            "  derive(bmi = weight / 2)",
            "  update!(age = age + 1)",
            "  rename(weight -> wt)",
            "end",
            "sort adults -> adults_s by subjid nodupkey",
            "aggregate adults_s -> stats do",
            "  age: mean, sum",
            "  wt: max",
            "end");

    static Plan compile(String source) {
        return new ScriptCompiler(CompilerOptions.getDefault()).compile(source, Map.of());
    }

    @Test
    public void header() {
        Assert.assertTrue(ScriptCompiler.hasHeader("\n\n# sans 1.0\n"));
        Assert.assertFalse(ScriptCompiler.hasHeader("a\nb\nc\nd\ne\n# sans 1.0\n"));
        Plan plan = compile("table a = from(b)\n");
        RefusedBlock refused = plan.getRefusals().get(0);
        Assert.assertEquals(ErrorCode.SCRIPT_HEADER, refused.code);
    }

    @Test
    public void statementBeforeHeader() {
        Plan plan = compile("table junk = from(zzz)\n# sans 0.1\n" +
                "datasource d = inline_csv do\n  k\n  1\nend\ntable t = from(d)\n");
        Assert.assertTrue(plan.getOpSteps().isEmpty());
        Assert.assertEquals(1, plan.getRefusals().size());
        RefusedBlock refused = plan.getRefusals().get(0);
        Assert.assertEquals(ErrorCode.SCRIPT_HEADER, refused.code);
        Assert.assertEquals(1, refused.range.start.line);

        // Comments and blank lines may precede the header
        plan = compile("# generated\n\n# sans 0.1\ndatasource d = inline_csv do\n  k\n  1\nend\ntable t = from(d)\n");
        Assert.assertTrue(plan.getRefusals().isEmpty());
    }

    @Test
    public void pipeline() {
        Plan plan = compile(PIPELINE);
        Assert.assertTrue(plan.getRefusals().isEmpty());
        Datasource dm = plan.datasources.get("dm");
        Assert.assertEquals(Datasource.Kind.INLINE_CSV, dm.kind);
        Assert.assertEquals(List.of(ScalarType.INT, ScalarType.INT, ScalarType.DECIMAL, ScalarType.BOOL),
                List.of(dm.getSchema().typeOf("subjid"), dm.getSchema().typeOf("age"),
                        dm.getSchema().typeOf("weight"), dm.getSchema().typeOf("active")));

        List<OpStep> steps = plan.getOpSteps();
        Assert.assertEquals(6, steps.size());
        FilterStep filter = steps.get(0).to(FilterStep.class);
        Assert.assertEquals(dm.getInputName(), filter.getInput());
        // Constants are folded into the expression
        BinaryExpression predicate = filter.predicate.to(BinaryExpression.class);
        Assert.assertEquals(18L, predicate.right.to(LiteralExpression.class).value);
        Assert.assertEquals(ComputeStep.Mode.DERIVE, steps.get(1).to(ComputeStep.class).mode);
        Assert.assertEquals(ComputeStep.Mode.UPDATE, steps.get(2).to(ComputeStep.class).mode);
        RenameStep rename = steps.get(3).to(RenameStep.class);
        Assert.assertEquals("adults", rename.getOutput());
        Assert.assertEquals(Map.of("weight", "wt"), rename.map);

        SortStep sort = steps.get(4).to(SortStep.class);
        Assert.assertTrue(sort.nodupkey);
        AggregateStep aggregate = steps.get(5).to(AggregateStep.class);
        Assert.assertTrue(aggregate.groupBy.isEmpty());
        Assert.assertEquals("[age_mean, age_sum, wt_max]", aggregate.metrics.toString());
    }

    @Test
    public void kindIsFixed() {
        Plan plan = compile("# sans 0.1\nlet x = 1\ntable x = from(dm)\n");
        RefusedBlock refused = plan.getRefusals().get(0);
        Assert.assertEquals(ErrorCode.KIND_CONFLICT, refused.code);
        Assert.assertEquals(3, refused.range.start.line);
    }

    @Test
    public void scalarAsTable() {
        Plan plan = compile("# sans 0.1\nlet x = 1\nsort x -> y by a\n");
        Assert.assertEquals(ErrorCode.KIND_CONFLICT, plan.getRefusals().get(0).code);
    }

    @Test
    public void unclosedBlock() {
        Plan plan = compile("# sans 0.1\ntable a = from(b) do\n  filter(x > 1)\n");
        Assert.assertEquals(ErrorCode.SCRIPT_SYNTAX, plan.getRefusals().get(0).code);
    }

    @Test
    public void badOperationRefusesTheWholeTable() {
        Plan plan = compile("# sans 0.1\ntable a = from(b) do\n  filter(x > 1)\n  explode(y)\nend\n");
        Assert.assertTrue(plan.getOpSteps().isEmpty());
        RefusedBlock refused = plan.getRefusals().get(0);
        Assert.assertEquals(ErrorCode.SCRIPT_SYNTAX, refused.code);
        Assert.assertEquals(2, refused.range.start.line);
        Assert.assertEquals(5, refused.range.end.line);
    }

    @Test
    public void cast() {
        Plan plan = compile("# sans 0.1\ntable c = from(raw) do\n" +
                "  cast(age -> int on_error=null trim, visit -> date)\nend\n");
        CastStep cast = plan.getOpSteps().get(0).to(CastStep.class);
        Assert.assertEquals(2, cast.casts.size());
        CastStep.CastSpec age = cast.casts.get(0);
        Assert.assertEquals(CastStep.Target.INT, age.target);
        Assert.assertEquals(CastStep.OnError.NULL, age.onError);
        Assert.assertTrue(age.trim);
        Assert.assertEquals(CastStep.OnError.FAIL, cast.casts.get(1).onError);
    }

    @Test
    public void format() {
        Plan plan = compile("# sans 0.1\nformat $sexf do\n  \"M\" -> \"Male\"\n  \"F\" -> \"Female\"\nend\n" +
                "format grade do\n  1 -> \"Low\"\n  other -> \"High\"\nend\n");
        List<OpStep> steps = plan.getOpSteps();
        FormatStep sex = steps.get(0).to(FormatStep.class);
        Assert.assertEquals("$sexf", sex.name);
        Assert.assertFalse(sex.isTotal());
        FormatStep grade = steps.get(1).to(FormatStep.class);
        Assert.assertEquals("Low", grade.map.get("1"));
        Assert.assertEquals("High", grade.other);
    }

    @Test
    public void csvDatasource() {
        Plan plan = compile("# sans 0.1\ndatasource lb = csv(\"lb.csv\", columns(subjid:int, lbstresn:decimal))\n" +
                "datasource ex = csv(\"ex.csv\")\n");
        Schema lb = plan.datasources.get("lb").getSchema();
        Assert.assertEquals(ScalarType.DECIMAL, lb.typeOf("lbstresn"));
        Assert.assertTrue(plan.datasources.get("ex").getSchema().open);
        Assert.assertEquals("lb.csv", plan.datasources.get("lb").path);
    }

    @Test
    public void inlineSchemaInference() {
        Schema schema = InlineSchemaInference.infer("a,b,c,d\n1,2,x,\n3,4.5,7,\n", SourcePositionRange.INVALID);
        Assert.assertEquals(ScalarType.INT, schema.typeOf("a"));
        Assert.assertEquals(ScalarType.DECIMAL, schema.typeOf("b"));
        Assert.assertEquals(ScalarType.STRING, schema.typeOf("c"));
        // A column without values defaults to string
        Assert.assertEquals(ScalarType.STRING, schema.typeOf("d"));
    }

    @Test
    public void inlineRowTooLong() {
        try {
            InlineSchemaInference.infer("a\n1,2\n", SourcePositionRange.INVALID);
            Assert.fail("Expected an error");
        } catch (CompilationError e) {
            Assert.assertEquals(ErrorCode.DATASOURCE_MALFORMED, e.code);
        }
    }
}
