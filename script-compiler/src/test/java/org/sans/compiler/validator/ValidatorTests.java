package org.sans.compiler.validator;

import org.sans.compiler.SansCompiler;
import org.sans.compiler.ValidatedPlan;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.CompilerMessages;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.ErrorFamily;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.frontend.Dialect;
import org.sans.compiler.frontend.ExpressionParser;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.TableFact;
import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ValidatorTests {
    /** A schema from "name:type" pairs. */
    static Schema schema(String... columns) {
        List<Column> result = new ArrayList<>();
        for (String column: columns) {
            String[] parts = column.split(":");
            result.add(new Column(parts[0], ScalarType.fromText(parts[1])));
        }
        return new Schema(result);
    }

    static Map<String, Schema> tables() {
        Map<String, Schema> result = new LinkedHashMap<>();
        result.put("dm", schema("subjid:int", "sex:string", "age:int"));
        result.put("lb", schema("subjid:int", "lbdtc:string", "lbstresn:decimal"));
        return result;
    }

    static ErrorCode failure(String source) {
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate(source, tables());
        Assert.assertNull(plan);
        Assert.assertTrue(compiler.hasErrors());
        CompilerMessages.Message message = compiler.messages.messages.get(0);
        return message.code;
    }

    static ValidatedPlan success(String source) {
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate(source, tables());
        Assert.assertNotNull(compiler.messages.toString(), plan);
        return plan;
    }

    @Test
    public void facts() {
        ValidatedPlan plan = success("proc sort data=lb out=lb_s; by subjid lbdtc; run;\n" +
                "data lb_f; set lb_s; if lbstresn > 1; run;\n" +
                "data lb_r; set lb_s(rename=(lbdtc=visit)); run;\n" +
                "data lb_c; set lb_s; subjid = subjid + 1; run;");
        Assert.assertEquals(TableFact.NONE, plan.facts.get("lb"));
        Assert.assertEquals(List.of("subjid", "lbdtc"), plan.facts.get("lb_s").sortedBy);
        // Filters keep the order
        Assert.assertEquals(List.of("subjid", "lbdtc"), plan.facts.get("lb_f").sortedBy);
        // Renames and key assignments cannot prove it
        Assert.assertNull(plan.facts.get("lb_r").sortedBy);
        Assert.assertNull(plan.facts.get("lb_c").sortedBy);
    }

    @Test
    public void orderRequired() {
        Assert.assertEquals(ErrorCode.ORDER_REQUIRED,
                failure("data x; set lb; by subjid; if first.subjid; run;"));
        Assert.assertEquals(ErrorCode.ORDER_REQUIRED,
                failure("proc sort data=dm out=dm_s; by subjid; run;\n" +
                        "data x; merge dm_s lb; by subjid; run;"));
        // A prefix of the sort keys is enough
        success("proc sort data=lb out=lb_s; by subjid lbdtc; run;\n" +
                "data x; set lb_s; by subjid; if first.subjid; run;");
    }

    @Test
    public void descendingSortIsRefused() {
        SansCompiler compiler = new SansCompiler();
        Assert.assertNull(compiler.compileAndValidate(
                "proc sort data=lb out=lb_s; by subjid descending lbdtc; run;", tables()));
        Assert.assertEquals(List.of(ErrorCode.SORT_DESCENDING.code), compiler.messages.codes());
        Assert.assertEquals(ErrorFamily.CAPABILITY.exitCode, compiler.messages.exitCode());
    }

    @Test
    public void undefinedTable() {
        Assert.assertEquals(ErrorCode.TABLE_UNDEFINED, failure("proc sort data=ae out=ae_s; by subjid; run;"));
    }

    @Test
    public void outputCollision() {
        Assert.assertEquals(ErrorCode.OUTPUT_TABLE_COLLISION,
                failure("proc sort data=dm out=x; by subjid; run;\nproc sort data=lb out=x; by subjid; run;"));
        Assert.assertEquals(ErrorCode.OUTPUT_TABLE_COLLISION, failure("data dm; set lb; run;"));
    }

    @Test
    public void columnNotFound() {
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, failure("data x; set dm; y = weight * 2; run;"));
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, failure("proc sort data=dm out=x; by weight; run;"));
    }

    @Test
    public void deriveAndUpdate() {
        String header = "# sans 0.1\n";
        Assert.assertEquals(ErrorCode.COLUMN_EXISTS,
                failure(header + "table x = from(dm) do\n  derive(age = 1)\nend\n"));
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND,
                failure(header + "table x = from(dm) do\n  update!(weight = 1)\nend\n"));
        ValidatedPlan plan = success(header + "table x = from(dm) do\n" +
                "  derive(age2 = age * 2, half = age2 / 2)\n  update!(age = age + 1)\nend\n");
        Schema schema = plan.schemas.get("x");
        Assert.assertEquals(List.of("subjid", "sex", "age", "age2", "half"), schema.names());
        Assert.assertEquals(ScalarType.INT, schema.typeOf("age2"));
        Assert.assertEquals(ScalarType.DECIMAL, schema.typeOf("half"));
    }

    @Test
    public void typeRules() {
        String prefix = "# sans 0.1\ntable x = from(dm) do\n";
        Assert.assertEquals(ErrorCode.TYPE, failure(prefix + "  derive(y = age + null)\nend\n"));
        Assert.assertEquals(ErrorCode.TYPE, failure(prefix + "  filter(age < null)\nend\n"));
        Assert.assertEquals(ErrorCode.TYPE, failure(prefix + "  filter(age)\nend\n"));
        Assert.assertEquals(ErrorCode.TYPE, failure(prefix + "  derive(y = if(age > 1, \"a\", 1))\nend\n"));
        Assert.assertEquals(ErrorCode.TYPE, failure(prefix + "  filter(sex > 1)\nend\n"));
        ValidatedPlan plan = success(prefix + "  derive(y = if(age > 1, null, 2.5), z = sex == null)\nend\n");
        Assert.assertEquals(ScalarType.DECIMAL, plan.schemas.get("x").typeOf("y"));
        Assert.assertEquals(ScalarType.BOOL, plan.schemas.get("x").typeOf("z"));
    }

    @Test
    public void unknownTypes() {
        Schema open = schema("a:unknown", "b:int");
        Assert.assertEquals(ScalarType.BOOL, ExpressionTypeChecker.typeOf(
                ExpressionParser.parse("a == null", Dialect.NATIVE,
                        SourcePositionRange.INVALID), open));
        try {
            ExpressionTypeChecker.typeOf(ExpressionParser.parse(
                    "a + b", Dialect.NATIVE, SourcePositionRange.INVALID), open);
            Assert.fail("Expected a type error");
        } catch (CompilationError e) {
            Assert.assertEquals(ErrorCode.TYPE_UNKNOWN, e.code);
            Assert.assertEquals(ErrorFamily.TYPE, e.code.family);
        }
    }

    @Test
    public void aggregateNaming() {
        ValidatedPlan plan = success("proc sort data=lb out=lb_s; by subjid; run;\n" +
                "proc summary data=lb_s nway; class subjid; var lbstresn; output out=stats mean= n= max= / autoname; run;");
        Schema stats = plan.schemas.get("stats");
        Assert.assertEquals(List.of("subjid", "lbstresn_mean", "lbstresn_n", "lbstresn_max"), stats.names());
        Assert.assertEquals(ScalarType.DECIMAL, stats.typeOf("lbstresn_mean"));
        Assert.assertEquals(ScalarType.INT, stats.typeOf("lbstresn_n"));
        Assert.assertEquals(List.of("subjid"), plan.facts.get("stats").sortedBy);
    }

    @Test
    public void openPredeclaredTables() {
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate(
                "proc sort data=raw out=raw_s; by id; run;", Set.of("raw"));
        Assert.assertNotNull(plan);
        Assert.assertTrue(plan.schemas.get("raw_s").open);
        Assert.assertEquals(List.of("id"), plan.facts.get("raw_s").sortedBy);
    }

    @Test
    public void warningsDoNotStopValidation() {
        ValidatedPlan plan = success("proc summary data=lb; var lbstresn; output out=stats mean= / autoname; run;");
        Assert.assertEquals(1, plan.warnings.size());
        Assert.assertEquals(ErrorCode.SUMMARY_MALFORMED, plan.warnings.get(0).code);
    }

    @Test
    public void validationIsIdempotent() {
        String source = "proc sort data=lb out=lb_s; by subjid lbdtc; run;\n" +
                "data lb_last; set lb_s; by subjid; if last.subjid; run;";
        SansCompiler compiler = new SansCompiler();
        Plan plan = compiler.compile(source, tables());
        ValidatedPlan first = new PlanValidator().validate(plan);
        ValidatedPlan second = new PlanValidator().validate(plan);
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.toJson(), second.toJson());
        Assert.assertSame(plan, first.plan);
    }

    @Test
    public void stepIdentityIgnoresTableNames() {
        OpStep left = new SortStep(SourcePositionRange.INVALID, "a", "b",
                List.of(new SortStep.SortKey("x", false)), false);
        OpStep right = new SortStep(SourcePositionRange.lines(3, 4), "c", "d",
                List.of(new SortStep.SortKey("x", false)), false);
        OpStep other = new SortStep(SourcePositionRange.INVALID, "a", "b",
                List.of(new SortStep.SortKey("x", false)), true);
        Assert.assertEquals(left.getStepId(), right.getStepId());
        Assert.assertNotEquals(left.getStepId(), other.getStepId());
        Assert.assertNotEquals(left.getStepId(),
                new IdentityStep(SourcePositionRange.INVALID, "a", "b").getStepId());
    }

    @Test
    public void fingerprintIsDeterministic() {
        String source = "proc sort data=lb out=lb_s; by subjid; run;\ndata x; set lb_s; y = lbstresn * 2; run;";
        Plan first = new SansCompiler().compile(source, tables());
        Plan second = new SansCompiler().compile(source, tables());
        Assert.assertEquals(first.fingerprint(), second.fingerprint());
        Assert.assertEquals(64, first.fingerprint().value().length());
        Plan changed = new SansCompiler().compile(source.replace("* 2", "* 3"), tables());
        Assert.assertNotEquals(first.fingerprint(), changed.fingerprint());
    }

    @Test
    public void refusalsHaltBeforeValidation() {
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate(
                "proc sort data=dm out=dm_s; by subjid; run;\nproc means data=dm; run;", tables());
        Assert.assertNull(plan);
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertEquals(ErrorFamily.PARSE, compiler.messages.messages.get(0).code.family);
    }
}
