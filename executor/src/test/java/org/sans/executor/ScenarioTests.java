package org.sans.executor;

import org.sans.compiler.SansCompiler;
import org.sans.compiler.ValidatedPlan;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.io.CsvTableLoader;
import org.junit.Assert;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Change from baseline of a lab value, from unsorted inputs to the final table. */
public class ScenarioTests {
    static final String SCRIPT = String.join("\n",
            "proc sort data=dm out=dm_s; by subjid; run;",
            "proc sort data=ex out=ex_s; by subjid exstdtc; run;",
            "proc sort data=lb out=lb_s; by subjid lbdtc; run;",
            "",
            "/* first dose per subject */",
            "data ex_first;",
            "  set ex_s;",
            "  by subjid;",
            "  if first.subjid;",
            "run;",
            "",
            "data dm_ex;",
            "  merge dm_s(in=ina) ex_first(in=inb);",
            "  by subjid;",
            "  if ina and inb;",
            "run;",
            "",
            "data lb_ex;",
            "  merge lb_s(in=inlb) dm_ex(in=indm);",
            "  by subjid;",
            "  if inlb and indm;",
            "run;",
            "",
            "data result;",
            "  set lb_ex;",
            "  by subjid;",
            "  retain base;",
            "  if first.subjid then base = .;",
            "  if lbdtc <= exstdtc then base = lbstresn;",
            "  if lbdtc > exstdtc then chg = lbstresn - base;",
            "  if lbdtc > exstdtc and base ne 0 then pchg = chg / base * 100;",
            "  if lbdtc > exstdtc then output;",
            "run;");

    static final String DM = "subjid,siteid,sex,race\n101,S1,F,WHITE\n102,S1,M,ASIAN\n103,S2,F,WHITE\n";
    static final String EX = "subjid,exstdtc\n101,2024-02-10\n101,2024-01-10\n102,2024-01-05\n";
    static final String LB = String.join("\n",
            "subjid,lbdtc,lbtestcd,lbstresn",
            "103,2024-01-20,ALT,35",
            "101,2024-01-20,ALT,60",
            "102,2024-01-15,ALT,12",
            "101,2024-01-01,ALT,40",
            "103,2024-01-02,ALT,30",
            "101,2024-02-01,ALT,45",
            "102,2024-01-05,ALT,0",
            "101,2024-01-08,ALT,50",
            "");

    static Schema schema(String... columns) {
        Schema result = Schema.EMPTY;
        for (String column: columns) {
            String[] parts = column.split(":");
            result = result.add(new Column(parts[0], ScalarType.fromText(parts[1])));
        }
        return result;
    }

    static Map<String, Schema> schemas() {
        Map<String, Schema> result = new LinkedHashMap<>();
        result.put("dm", schema("subjid:int", "siteid:string", "sex:string", "race:string"));
        result.put("ex", schema("subjid:int", "exstdtc:string"));
        result.put("lb", schema("subjid:int", "lbdtc:string", "lbtestcd:string", "lbstresn:decimal"));
        return result;
    }

    static Map<String, Table> bindings(Map<String, Schema> schemas) {
        Map<String, Table> result = new LinkedHashMap<>();
        result.put("dm", CsvTableLoader.load(DM, schemas.get("dm")));
        result.put("ex", CsvTableLoader.load(EX, schemas.get("ex")));
        result.put("lb", CsvTableLoader.load(LB, schemas.get("lb")));
        return result;
    }

    static void assertClose(double expected, Object actual) {
        Assert.assertNotNull(actual);
        Assert.assertEquals(expected, Values.toDecimal(actual).doubleValue(), 1e-6);
    }

    @Test
    public void changeFromBaseline() {
        Map<String, Schema> schemas = schemas();
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate(SCRIPT, schemas);
        Assert.assertNotNull(compiler.messages.toString(), plan);
        Assert.assertTrue(plan.warnings.isEmpty());
        Assert.assertEquals(List.of("subjid"), plan.facts.get("result").sortedBy);
        Assert.assertEquals(ScalarType.DECIMAL, plan.schemas.get("result").typeOf("pchg"));

        ExecutionResult execution = new Executor().execute(plan, bindings(schemas));
        Table result = execution.getOutput("result");
        Assert.assertEquals(3, result.size());

        Assert.assertEquals(101L, result.get(0, "subjid"));
        Assert.assertEquals("2024-01-20", result.get(0, "lbdtc"));
        assertClose(50, result.get(0, "base"));
        assertClose(10, result.get(0, "chg"));
        assertClose(20, result.get(0, "pchg"));

        Assert.assertEquals(101L, result.get(1, "subjid"));
        Assert.assertEquals("2024-02-01", result.get(1, "lbdtc"));
        assertClose(-5, result.get(1, "chg"));
        assertClose(-10, result.get(1, "pchg"));

        // A zero baseline leaves the percentage missing
        Assert.assertEquals(102L, result.get(2, "subjid"));
        assertClose(12, result.get(2, "chg"));
        Assert.assertNull(result.get(2, "pchg"));

        // Subject 103 was never dosed
        Assert.assertEquals(2, execution.getOutput("dm_ex").size());
        Assert.assertEquals("2024-01-10", execution.getOutput("ex_first").get(0, "exstdtc"));
        Assert.assertEquals(7, plan.plan.getOpSteps().size());
        Assert.assertEquals(7, execution.evidence.size());
    }

    @Test
    public void reportsAreStable() {
        Map<String, Schema> schemas = schemas();
        ValidatedPlan plan = new SansCompiler().compileAndValidate(SCRIPT, schemas);
        Assert.assertNotNull(plan);
        ExecutionResult first = new Executor().execute(plan, bindings(schemas));
        ExecutionResult second = new Executor().execute(plan, bindings(schemas));
        Assert.assertEquals(first.evidenceToJson().toString(), second.evidenceToJson().toString());
        Assert.assertEquals(plan.toJson(), new SansCompiler().compileAndValidate(SCRIPT, schemas).toJson());
    }
}
