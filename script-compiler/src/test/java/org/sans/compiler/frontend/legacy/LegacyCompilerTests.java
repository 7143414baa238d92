package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.DataStatement;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.step.SelectStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.step.SqlSelectStep;
import org.sans.compiler.ir.step.TransposeStep;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class LegacyCompilerTests {
    static Plan compile(String source) {
        return new LegacyCompiler(CompilerOptions.getDefault()).compile(source, Map.of());
    }

    static <T extends IRStep> T single(Plan plan, Class<T> clazz) {
        Assert.assertEquals(plan.steps.toString(), 1, plan.steps.size());
        return plan.steps.get(0).to(clazz);
    }

    @Test
    public void sort() {
        SortStep sort = single(compile("proc sort data=dm out=dm_s nodupkey; by subjid; run;"), SortStep.class);
        Assert.assertEquals("dm", sort.getInput());
        Assert.assertEquals("dm_s", sort.getOutput());
        Assert.assertEquals(List.of("subjid"), sort.keyNames());
        Assert.assertTrue(sort.nodupkey);
    }

    @Test
    public void sortWithoutBy() {
        RefusedBlock refused = single(compile("proc sort data=dm out=dm_s; run;"), RefusedBlock.class);
        Assert.assertEquals(ErrorCode.SORT_MISSING_BY, refused.code);
        Assert.assertTrue(refused.isFatal());
    }

    @Test
    public void sortNeedsOut() {
        RefusedBlock refused = single(compile("proc sort data=dm; by subjid; run;"), RefusedBlock.class);
        Assert.assertEquals(ErrorCode.SORT_UNSUPPORTED_OPTION, refused.code);
    }

    @Test
    public void simpleDataStep() {
        Plan plan = compile("data adsl;\n  set dm;\n  age2 = age * 2;\n  if age2 > 40;\n  keep subjid age2;\nrun;");
        List<OpStep> steps = plan.getOpSteps();
        Assert.assertEquals(3, steps.size());
        Assert.assertTrue(steps.get(0).is(ComputeStep.class));
        Assert.assertTrue(steps.get(1).is(FilterStep.class));
        SelectStep keep = steps.get(2).to(SelectStep.class);
        Assert.assertEquals(List.of("subjid", "age2"), keep.keep);
        // Intermediate tables are chained and the last one carries the block's name
        Assert.assertEquals("dm", steps.get(0).getInput());
        Assert.assertEquals(steps.get(0).getOutput(), steps.get(1).getInput());
        Assert.assertEquals("adsl", steps.get(2).getOutput());
    }

    @Test
    public void mergeDataStep() {
        Plan plan = compile("data both;\n  merge dm(in=ina) ex(in=inb keep=subjid exstdtc);\n  by subjid;\n" +
                "  if ina and inb;\nrun;");
        DataStep step = single(plan, DataStep.class);
        Assert.assertEquals(DataStep.Mode.MERGE, step.mode);
        Assert.assertEquals(2, step.specs.size());
        Assert.assertEquals("ina", step.specs.get(0).inFlag);
        Assert.assertEquals(List.of("subjid", "exstdtc"), step.specs.get(1).keep);
        Assert.assertEquals(List.of("subjid"), step.by);
        Assert.assertTrue(step.statements.get(0).is(DataStatement.Filter.class));
        Assert.assertFalse(step.explicitOutput);
    }

    @Test
    public void retainAndOutput() {
        Plan plan = compile("data last;\n  set lb;\n  by subjid;\n  retain total;\n" +
                "  if first.subjid then total = 0;\n  total = total + value;\n  if last.subjid then output;\nrun;");
        DataStep step = single(plan, DataStep.class);
        Assert.assertEquals(DataStep.Mode.SET, step.mode);
        Assert.assertEquals(List.of("total"), step.retain);
        Assert.assertTrue(step.explicitOutput);
        Assert.assertEquals(3, step.statements.size());
        DataStatement.IfThen first = step.statements.get(0).to(DataStatement.IfThen.class);
        Assert.assertTrue(first.then.is(DataStatement.Assign.class));
    }

    @Test
    public void elseBranch() {
        Plan plan = compile("data flagged;\n  set lb;\n  if value > 10 then high = 1;\n  else high = 0;\nrun;");
        DataStep step = single(plan, DataStep.class);
        DataStatement.IfThen ifThen = step.statements.get(0).to(DataStatement.IfThen.class);
        Assert.assertNotNull(ifThen.otherwise);
    }

    @Test
    public void mergeRequiresBy() {
        RefusedBlock refused = single(compile("data both; merge dm ex; run;"), RefusedBlock.class);
        Assert.assertEquals(ErrorCode.DATASTEP_MISSING_BY, refused.code);
    }

    @Test
    public void doBlocksAreRefusedWhole() {
        Plan plan = compile("data a;\n  set b;\n  by x;\n  if first.x then do;\n  y = 1;\n  end;\nrun;\n" +
                "proc sort data=b out=c; by x; run;");
        Assert.assertEquals(2, plan.steps.size());
        RefusedBlock refused = plan.steps.get(0).to(RefusedBlock.class);
        Assert.assertEquals(ErrorCode.STATEFUL_TOKEN, refused.code);
        // The refusal spans the whole block, and the following block still compiles
        Assert.assertEquals(1, refused.range.start.line);
        Assert.assertEquals(7, refused.range.end.line);
        Assert.assertTrue(plan.steps.get(1).is(SortStep.class));
    }

    @Test
    public void unsupportedProc() {
        RefusedBlock refused = single(compile("proc means data=a; var x; run;"), RefusedBlock.class);
        Assert.assertEquals(ErrorCode.UNSUPPORTED_PROC, refused.code);
    }

    @Test
    public void transpose() {
        TransposeStep step = single(compile(
                "proc transpose data=lb_s out=wide; by subjid; id lbtestcd; var lbstresn; run;"), TransposeStep.class);
        Assert.assertEquals(List.of("subjid"), step.by);
        Assert.assertEquals("lbtestcd", step.id);
        Assert.assertEquals("lbstresn", step.var);
    }

    @Test
    public void summary() {
        Plan plan = compile("proc summary data=lb nway; class subjid; var x y; output out=stats mean= sum= / autoname; run;");
        AggregateStep step = single(plan, AggregateStep.class);
        Assert.assertEquals(List.of("subjid"), step.groupBy);
        Assert.assertEquals("[x_mean, x_sum, y_mean, y_sum]", step.metrics.toString());
    }

    @Test
    public void summaryWithoutNwayWarns() {
        Plan plan = compile("proc summary data=lb; var x; output out=stats n= / autoname; run;");
        Assert.assertEquals(2, plan.steps.size());
        RefusedBlock warning = plan.steps.get(0).to(RefusedBlock.class);
        Assert.assertFalse(warning.isFatal());
        Assert.assertTrue(plan.steps.get(1).is(AggregateStep.class));
    }

    @Test
    public void format() {
        FormatStep format = single(compile(
                "proc format;\n  value $sexf 'M' = 'Male' 'F' = 'Female' other = 'Unknown';\nrun;"), FormatStep.class);
        Assert.assertEquals("$sexf", format.name);
        Assert.assertEquals(Map.of("M", "Male", "F", "Female"), format.map);
        Assert.assertEquals("Unknown", format.other);
        Assert.assertTrue(format.isTotal());
    }

    @Test
    public void numericFormatKeys() {
        FormatStep format = single(compile("proc format; value grade 1 = 'Low' 2.0 = 'High'; run;"), FormatStep.class);
        Assert.assertEquals("Low", format.map.get("1"));
        Assert.assertEquals("High", format.map.get("2"));
        Assert.assertFalse(format.isTotal());
    }

    @Test
    public void sqlJoin() {
        SqlSelectStep step = single(compile("proc sql;\n  create table both as\n" +
                "    select a.subjid, b.exstdtc, count(*) as n from dm as a\n" +
                "    left join ex b on a.subjid = b.subjid\n    where a.sex = 'F'\n    group by a.subjid, b.exstdtc;\nquit;"),
                SqlSelectStep.class);
        Assert.assertEquals("dm", step.from.table);
        Assert.assertEquals("a", step.from.alias);
        Assert.assertEquals(1, step.joins.size());
        Assert.assertEquals(SqlSelectStep.JoinType.LEFT, step.joins.get(0).type);
        Assert.assertEquals(List.of("dm", "ex"), step.inputs);
        Assert.assertNotNull(step.where);
        Assert.assertEquals(List.of("a.subjid", "b.exstdtc"), step.groupBy);
        Assert.assertEquals("n", step.select.get(2).alias);
    }

    @Test
    public void sqlUnsupportedClause() {
        RefusedBlock refused = single(compile(
                "proc sql; create table x as select * from dm order by subjid; quit;"), RefusedBlock.class);
        Assert.assertEquals(ErrorCode.SQL_UNSUPPORTED, refused.code);
    }

    @Test
    public void macroErrorRefusesEverything() {
        Plan plan = compile("%macro m;\n%do i = 1 %to 3;\n%end;\n%mend;");
        RefusedBlock refused = single(plan, RefusedBlock.class);
        Assert.assertEquals(ErrorCode.MACRO_ERROR, refused.code);
    }
}
