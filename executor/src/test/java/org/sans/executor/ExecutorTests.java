package org.sans.executor;

import org.sans.compiler.SansCompiler;
import org.sans.compiler.ValidatedPlan;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.OpKind;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.TransposeStep;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.io.CsvTableLoader;
import org.sans.executor.operators.DataStepOperator;
import org.sans.executor.operators.TransposeOperator;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ExecutorTests {
    /** A schema from "name:type" pairs. */
    static Schema schema(String... columns) {
        List<Column> result = new ArrayList<>();
        for (String column: columns) {
            String[] parts = column.split(":");
            result.add(new Column(parts[0], ScalarType.fromText(parts[1])));
        }
        return new Schema(result);
    }

    static Table table(String csv, String... columns) {
        return CsvTableLoader.load(csv, schema(columns));
    }

    static Map<String, Table> bind(Object... nameAndTable) {
        Map<String, Table> result = new LinkedHashMap<>();
        for (int i = 0; i < nameAndTable.length; i += 2)
            result.put((String) nameAndTable[i], (Table) nameAndTable[i + 1]);
        return result;
    }

    static ValidatedPlan validate(String source, Map<String, Table> bindings) {
        Map<String, Schema> schemas = new LinkedHashMap<>();
        for (Map.Entry<String, Table> entry: bindings.entrySet())
            schemas.put(entry.getKey(), entry.getValue().schema);
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate(source, schemas);
        Assert.assertNotNull(compiler.messages.toString(), plan);
        return plan;
    }

    static ExecutionResult run(String source, Map<String, Table> bindings) {
        return new Executor().execute(validate(source, bindings), bindings);
    }

    static ErrorCode failure(String source, Map<String, Table> bindings) {
        ValidatedPlan plan = validate(source, bindings);
        try {
            new Executor().execute(plan, bindings);
            Assert.fail("Expected an execution error");
            return null;
        } catch (ExecutionError e) {
            return e.code;
        }
    }

    static List<Object> column(Table table, String column) {
        List<Object> result = new ArrayList<>();
        for (int i = 0; i < table.size(); i++)
            result.add(table.get(i, column));
        return result;
    }

    static void assertDecimal(String expected, Object actual) {
        Assert.assertNotNull(actual);
        Assert.assertEquals(0, new BigDecimal(expected).compareTo(Values.toDecimal(actual)));
    }

    @Test
    public void sortIsStableWithMissingFirst() {
        Map<String, Table> bindings = bind("t", table("k,v\n2,c\n1,a\n,z\n1,b\n", "k:int", "v:string"));
        ExecutionResult result = run("proc sort data=t out=s; by k; run;\n" +
                "proc sort data=t out=u nodupkey; by k; run;", bindings);
        Assert.assertEquals(Arrays.asList("z", "a", "b", "c"), column(result.getOutput("s"), "v"));
        Assert.assertEquals(Arrays.asList("z", "a", "c"), column(result.getOutput("u"), "v"));
        StepEvidence evidence = result.evidence.get(1);
        Assert.assertEquals(OpKind.SORT, evidence.op);
        Assert.assertEquals(1, evidence.counters.get("duplicates_dropped").asInt());
        Assert.assertEquals(3, evidence.getRowCount("u"));
    }

    @Test
    public void filterComputeSelect() {
        Map<String, Table> bindings = bind("dm", table("subjid,age\n1,30\n2,15\n3,\n", "subjid:int", "age:int"));
        ExecutionResult result = run("data adults; set dm; age2 = age * 2; if age >= 18; keep subjid age2; run;",
                bindings);
        Table adults = result.getOutput("adults");
        Assert.assertEquals(List.of("subjid", "age2"), adults.schema.names());
        Assert.assertEquals(1, adults.size());
        Assert.assertEquals(60L, adults.get(0, "age2"));
        // The intermediate steps are reported as well
        Assert.assertEquals(3, result.evidence.size());
        Assert.assertEquals(2, result.evidence.get(1).counters.get("rows_dropped").asInt());
    }

    @Test
    public void intermediateTablesAreNotOutputs() {
        Map<String, Table> bindings = bind("dm", table("subjid,age\n1,30\n2,15\n", "subjid:int", "age:int"));
        ExecutionResult result = run("data adults; set dm(where=(age > 1)); if age >= 18; run;\n" +
                "proc format; value $sexf 'M' = 'Male'; run;", bindings);
        Assert.assertEquals(List.of("adults"), new ArrayList<>(result.outputs.keySet()));
        // Every step, intermediate or not, is in the evidence
        Assert.assertEquals(3, result.evidence.size());
        Assert.assertEquals(2, result.evidence.get(0).getRowCount(result.evidence.get(0).outputs.get(0)));
    }

    @Test
    public void operatorsCheckTheOrderOfTheirInput() {
        Map<String, Table> bindings = bind("t", table("k,code,v\n2,a,1\n1,a,2\n",
                "k:int", "code:string", "v:int"));
        ValidatedPlan plan = validate("proc sort data=t out=s; by k; run;\n" +
                "data o; set s; by k; run;\n" +
                "proc transpose data=s out=w; by k; id code; var v; run;", bindings);
        DataStep data = null;
        TransposeStep transpose = null;
        for (OpStep op: plan.plan.getOpSteps()) {
            if (op.is(DataStep.class))
                data = op.to(DataStep.class);
            if (op.is(TransposeStep.class))
                transpose = op.to(TransposeStep.class);
        }
        Assert.assertNotNull(data);
        Assert.assertNotNull(transpose);

        // The table handed over is not the sorted one
        Table unsorted = bindings.get("t");
        ExpressionEvaluator evaluator = new ExpressionEvaluator(new HashMap<>());
        try {
            new DataStepOperator(data, evaluator).apply(List.of(unsorted), plan.schemas.get("o"));
            Assert.fail("Expected an order error");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_ORDER_REQUIRED, e.code);
        }
        try {
            new TransposeOperator(transpose, evaluator).apply(List.of(unsorted), null);
            Assert.fail("Expected an order error");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_ORDER_REQUIRED, e.code);
        }
    }

    @Test
    public void aggregate() {
        Map<String, Table> bindings = bind("t", table("g,x\nb,4\na,1\na,\n", "g:string", "x:int"));
        ExecutionResult result = run("# sans 0.1\naggregate t -> st by g do\n  x: mean, n, count, sum\nend\n",
                bindings);
        Table stats = result.getOutput("st");
        Assert.assertEquals(List.of("g", "x_mean", "x_n", "x_count", "x_sum"), stats.schema.names());
        Assert.assertEquals(List.of("a", "b"), column(stats, "g"));
        assertDecimal("1", stats.get(0, "x_mean"));
        // n counts values, count counts rows
        Assert.assertEquals(1L, stats.get(0, "x_n"));
        Assert.assertEquals(2L, stats.get(0, "x_count"));
        Assert.assertEquals(4L, stats.get(1, "x_sum"));
        Assert.assertEquals(2, result.evidence.get(0).counters.get("groups").asInt());
    }

    @Test
    public void aggregateOfNothing() {
        Map<String, Table> bindings = bind("t", table("x\n", "x:decimal"));
        ExecutionResult result = run("# sans 0.1\naggregate t -> st do\n  x: mean\nend\n", bindings);
        Assert.assertEquals(0, result.getOutput("st").size());
    }

    @Test
    public void groupFlagsAndRetain() {
        Map<String, Table> bindings = bind("t", table("g,x\na,1\na,2\nb,4\n", "g:string", "x:int"));
        ExecutionResult result = run("proc sort data=t out=t_s; by g; run;\n" +
                "data totals; set t_s; by g; retain total;\n" +
                "  if first.g then total = 0;\n  total = total + x;\n  if last.g then output;\nrun;", bindings);
        Table totals = result.getOutput("totals");
        Assert.assertEquals(List.of("g", "x", "total"), totals.schema.names());
        Assert.assertEquals(List.of("a", "b"), column(totals, "g"));
        Assert.assertEquals(List.of(3L, 4L), column(totals, "total"));
    }

    @Test
    public void mergeRepeatsTheShorterSide() {
        Map<String, Table> bindings = bind(
                "dm", table("subjid,sex\n1,F\n2,M\n", "subjid:int", "sex:string"),
                "lb", table("subjid,val\n1,10\n1,11\n3,30\n", "subjid:int", "val:int"));
        ExecutionResult result = run("proc sort data=dm out=dm_s; by subjid; run;\n" +
                "proc sort data=lb out=lb_s; by subjid; run;\n" +
                "data both; merge dm_s(in=a) lb_s(in=b); by subjid; run;", bindings);
        Table both = result.getOutput("both");
        Assert.assertEquals(List.of("subjid", "sex", "val"), both.schema.names());
        Assert.assertEquals(List.of(1L, 1L, 2L, 3L), column(both, "subjid"));
        Assert.assertEquals(Arrays.asList("F", "F", "M", null), column(both, "sex"));
        Assert.assertEquals(Arrays.asList(10L, 11L, null, 30L), column(both, "val"));
    }

    @Test
    public void mergeManyToMany() {
        Map<String, Table> bindings = bind(
                "a", table("k,x\n1,1\n1,2\n", "k:int", "x:int"),
                "b", table("k,y\n1,3\n1,4\n", "k:int", "y:int"));
        Assert.assertEquals(ErrorCode.RUNTIME_MERGE_MANY_MANY,
                failure("proc sort data=a out=a_s; by k; run;\nproc sort data=b out=b_s; by k; run;\n" +
                        "data ab; merge a_s b_s; by k; run;", bindings));
    }

    @Test
    public void transpose() {
        Map<String, Table> bindings = bind("lb", table("subjid,code,val\n1,ALT,10\n1,AST-2,20\n2,ALT,30\n",
                "subjid:int", "code:string", "val:decimal"));
        ExecutionResult result = run("proc sort data=lb out=lb_s; by subjid; run;\n" +
                "proc transpose data=lb_s out=wide; by subjid; id code; var val; run;", bindings);
        Table wide = result.getOutput("wide");
        Assert.assertEquals(List.of("subjid", "ALT", "AST_2"), wide.schema.names());
        Assert.assertEquals(ScalarType.DECIMAL, wide.schema.typeOf("ALT"));
        assertDecimal("30", wide.get(1, "ALT"));
        Assert.assertNull(wide.get(1, "AST_2"));
        Assert.assertEquals(2, result.evidence.get(1).counters.get("id_columns").asInt());
    }

    @Test
    public void transposeCollision() {
        Map<String, Table> bindings = bind("lb", table("subjid,code,val\n1,subjid,10\n",
                "subjid:int", "code:string", "val:int"));
        Assert.assertEquals(ErrorCode.RUNTIME_TRANSPOSE_ID_COLLISION,
                failure("proc sort data=lb out=lb_s; by subjid; run;\n" +
                        "proc transpose data=lb_s out=wide; by subjid; id code; var val; run;", bindings));
        Map<String, Table> twice = bind("lb", table("subjid,code,val\n1,a b,10\n1,a-b,20\n",
                "subjid:int", "code:string", "val:int"));
        Assert.assertEquals(ErrorCode.RUNTIME_TRANSPOSE_ID_COLLISION,
                failure("proc sort data=lb out=lb_s; by subjid; run;\n" +
                        "proc transpose data=lb_s out=wide; by subjid; id code; var val; run;", twice));
    }

    @Test
    public void sanitize() {
        Assert.assertEquals("a_b", TransposeOperator.sanitize("a..b"));
        Assert.assertEquals("COL", TransposeOperator.sanitize("--"));
        Assert.assertEquals("COL_1_st", TransposeOperator.sanitize(" 1 st"));
        Assert.assertEquals("ALT", TransposeOperator.sanitize("ALT"));
    }

    @Test
    public void sqlJoinAndGroup() {
        Map<String, Table> bindings = bind(
                "dm", table("subjid,sex\n2,M\n1,F\n", "subjid:int", "sex:string"),
                "ae", table("subjid,term\n1,HEADACHE\n1,NAUSEA\n", "subjid:int", "term:string"));
        ExecutionResult result = run("proc sql;\n  create table counts as\n" +
                "  select a.subjid, count(*) as n_rows, count(b.term) as terms\n" +
                "  from dm a left join ae b on a.subjid = b.subjid\n  group by a.subjid;\nquit;", bindings);
        Table counts = result.getOutput("counts");
        Assert.assertEquals(List.of("subjid", "n_rows", "terms"), counts.schema.names());
        Assert.assertEquals(List.of(1L, 2L), column(counts, "subjid"));
        Assert.assertEquals(List.of(2L, 1L), column(counts, "n_rows"));
        Assert.assertEquals(List.of(2L, 0L), column(counts, "terms"));
    }

    @Test
    public void sqlInnerJoinWhere() {
        Map<String, Table> bindings = bind(
                "dm", table("subjid,sex\n1,F\n2,M\n", "subjid:int", "sex:string"),
                "ae", table("subjid,term\n1,HEADACHE\n2,NAUSEA\n3,RASH\n", "subjid:int", "term:string"));
        ExecutionResult result = run("proc sql; create table f as select b.term from dm a " +
                "inner join ae b on a.subjid = b.subjid where a.sex = 'F'; quit;", bindings);
        Assert.assertEquals(List.of("HEADACHE"), column(result.getOutput("f"), "term"));
    }

    @Test
    public void sqlAmbiguousColumn() {
        Map<String, Table> bindings = bind(
                "dm", table("subjid,sex\n1,F\n", "subjid:int", "sex:string"),
                "ae", table("subjid,term\n1,HEADACHE\n", "subjid:int", "term:string"));
        SansCompiler compiler = new SansCompiler();
        // Without declared columns the ambiguity is only found once the tables are bound
        ValidatedPlan plan = compiler.compileAndValidate("proc sql; create table f as select subjid from dm a " +
                "inner join ae b on a.subjid = b.subjid; quit;", bindings.keySet());
        Assert.assertNotNull(plan);
        try {
            new Executor().execute(plan, bindings);
            Assert.fail("Expected an ambiguous column");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_SQL_AMBIGUOUS_COLUMN, e.code);
            Assert.assertTrue(e.range.isValid());
        }
    }

    @Test
    public void castToNull() {
        Map<String, Table> bindings = bind("raw", table("age,visit\n 12 ,2024-01-05\nabc,\n", "age:string", "visit:string"));
        ExecutionResult result = run("# sans 0.1\ntable c = from(raw) do\n" +
                "  cast(age -> int on_error=null trim, visit -> date)\nend\n", bindings);
        Table cast = result.getOutput("c");
        Assert.assertEquals(ScalarType.INT, cast.schema.typeOf("age"));
        Assert.assertEquals(Arrays.asList(12L, null), column(cast, "age"));
        Assert.assertEquals(Arrays.asList("2024-01-05", null), column(cast, "visit"));
        StepEvidence evidence = result.evidence.get(0);
        Assert.assertEquals(1, evidence.counters.get("cast_failures").asInt());
        Assert.assertEquals(1, evidence.warnings.size());
    }

    @Test
    public void castFails() {
        Map<String, Table> bindings = bind("raw", table("age\nabc\n", "age:string"));
        Assert.assertEquals(ErrorCode.RUNTIME_CAST_FAILED, failure(
                "# sans 0.1\ntable c = from(raw) do\n  cast(age -> int)\nend\n", bindings));
    }

    @Test
    public void formatsAreUsedByLaterSteps() {
        Map<String, Table> bindings = bind("dm", table("subjid,sex\n1,F\n2,M\n", "subjid:int", "sex:string"));
        ExecutionResult result = run("proc format; value $sexf 'M' = 'Male' 'F' = 'Female'; run;\n" +
                "data labeled; set dm; sexl = put(sex, $sexf.); run;", bindings);
        Assert.assertEquals(List.of("Female", "Male"), column(result.getOutput("labeled"), "sexl"));
    }

    @Test
    public void inlineDatasourceBindsItself() {
        ExecutionResult result = run("# sans 0.1\ndatasource dm = inline_csv do\n" +
                "  subjid,age\n  2,40\n  1,17\nend\n" +
                "table adults = from(dm) do\n  filter(age >= 18)\nend\n", Map.of());
        Table adults = result.getOutput("adults");
        Assert.assertEquals(1, adults.size());
        Assert.assertEquals(2L, adults.get(0, "subjid"));
    }

    @Test
    public void missingBinding() {
        Map<String, Table> bindings = bind("dm", table("subjid\n1\n", "subjid:int"));
        ValidatedPlan plan = validate("proc sort data=dm out=s; by subjid; run;", bindings);
        try {
            new Executor().execute(plan, Map.of());
            Assert.fail("Expected an unbound table");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_TABLE_UNDEFINED, e.code);
        }
    }

    @Test
    public void bindingMustMatchDeclaration() {
        Map<String, Table> declared = bind("dm", table("subjid\n1\n", "subjid:int"));
        ValidatedPlan plan = validate("proc sort data=dm out=s; by subjid; run;", declared);
        try {
            new Executor().execute(plan, bind("dm", table("subjid\n1\n", "subjid:string")));
            Assert.fail("Expected a schema mismatch");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_SCHEMA_MISMATCH, e.code);
        }
    }

    @Test
    public void untypedBinding() {
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate("proc sort data=dm out=s; by subjid; run;",
                Set.of("dm"));
        Table untyped = new Table(schema("subjid:unknown"), List.of(new Row(1L)));
        try {
            new Executor().execute(plan, bind("dm", untyped));
            Assert.fail("Expected an untyped input");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_UNTYPED_INPUT, e.code);
        }
    }

    @Test
    public void openSchemasAreCheckedWhenBound() {
        SansCompiler compiler = new SansCompiler();
        ValidatedPlan plan = compiler.compileAndValidate("data x; set dm; y = weight * 2; run;",
                Set.of("dm"));
        Assert.assertNotNull(plan);
        try {
            new Executor().execute(plan, bind("dm", table("subjid\n1\n", "subjid:int")));
            Assert.fail("Expected a schema mismatch");
        } catch (ExecutionError e) {
            Assert.assertEquals(ErrorCode.RUNTIME_SCHEMA_MISMATCH, e.code);
        }
    }

    @Test
    public void executionIsDeterministic() {
        Map<String, Table> bindings = bind("t", table("g,x\nb,4\na,1\na,2\n", "g:string", "x:int"));
        String source = "proc sort data=t out=t_s; by g x; run;\n" +
                "proc summary data=t_s nway; class g; var x; output out=st mean= / autoname; run;";
        ValidatedPlan plan = validate(source, bindings);
        ExecutionResult first = new Executor().execute(plan, bindings);
        ExecutionResult second = new Executor().execute(plan, bindings);
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.evidenceToJson(), second.evidenceToJson());
        Assert.assertEquals(plan.plan.getOpSteps().get(0).getStepId(), first.evidence.get(0).stepId);
    }
}
