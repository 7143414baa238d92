package org.sans.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import org.sans.compiler.errors.CompilerMessages;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.ErrorFamily;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.compiler.validator.PlanValidator;
import org.sans.util.Logger;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class SansCompilerTests {
    static final Map<String, Schema> DM = Map.of("dm", Schema.of(
            new Column("subjid", ScalarType.INT), new Column("sex", ScalarType.STRING)));

    @Test
    public void options() {
        CompilerOptions options = CompilerOptions.parse(
                "-I", "/data/macros", "--je", "--maxControlDepth", "3", "--Werror");
        Assert.assertEquals(List.of("/data/macros"), options.ioOptions.includeRoots);
        Assert.assertTrue(options.ioOptions.emitJsonErrors);
        Assert.assertEquals(3, options.languageOptions.maxControlDepth);
        Assert.assertFalse(options.same(CompilerOptions.getDefault()));
        Assert.assertTrue(options.diff(CompilerOptions.getDefault()).contains("maxControlDepth=3!=16"));
        Assert.assertTrue(options.validate(new SansCompiler()));
    }

    @Test
    public void invalidOptions() {
        CompilerOptions options = CompilerOptions.parse("--maxControlDepth", "0");
        SansCompiler compiler = new SansCompiler();
        Assert.assertFalse(options.validate(compiler));
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals(ErrorFamily.INTERNAL.exitCode, compiler.messages.exitCode());
    }

    @Test
    public void controlDepth() {
        CompilerOptions options = CompilerOptions.parse("--maxControlDepth", "1");
        SansCompiler compiler = new SansCompiler(options);
        Assert.assertNull(compiler.compileAndValidate("data x; set dm;\n" +
                "  if subjid > 1 then if subjid > 2 then flag = 1;\nrun;", DM));
        Assert.assertTrue(compiler.hasErrors());
    }

    @Test
    public void messages() {
        SansCompiler compiler = new SansCompiler();
        Assert.assertNull(compiler.compileAndValidate(
                "proc sort data=dm out=s; by subjid; run;\nproc means data=dm; run;", DM));
        CompilerMessages messages = compiler.messages;
        Assert.assertEquals(List.of(ErrorCode.UNSUPPORTED_PROC.code), messages.codes());
        Assert.assertEquals(ErrorFamily.PARSE.exitCode, messages.exitCode());
        String text = messages.toString();
        Assert.assertTrue(text, text.contains("error: Parse error SANS_PARSE_UNSUPPORTED_PROC"));
        Assert.assertTrue(text, text.contains("proc means"));

        JsonNode json = messages.toJson();
        Assert.assertEquals(1, json.size());
        Assert.assertEquals(ErrorCode.UNSUPPORTED_PROC.code, json.get(0).get("code").asText());
        Assert.assertFalse(json.get(0).get("warning").asBoolean());
    }

    @Test
    public void warnings() {
        String source = "proc summary data=dm; var subjid; output out=st n= / autoname; run;";
        SansCompiler compiler = new SansCompiler();
        Assert.assertNotNull(compiler.compileAndValidate(source, DM));
        Assert.assertEquals(1, compiler.messages.warningCount());
        Assert.assertEquals(ErrorFamily.OK_WITH_WARNINGS, compiler.messages.exitCode());

        SansCompiler strict = new SansCompiler(CompilerOptions.parse("--Werror"));
        Assert.assertNull(strict.compileAndValidate(source, DM));
        Assert.assertEquals(ErrorFamily.PARSE.exitCode, strict.messages.exitCode());
    }

    @Test
    public void dialectSelection() {
        SansCompiler compiler = new SansCompiler();
        Assert.assertNotNull(compiler.compileAndValidate("\n# sans 0.1\nsort dm -> s by subjid\n", DM));
        Assert.assertNotNull(compiler.compileAndValidate("proc sort data=dm out=s; by subjid; run;", DM));
        Assert.assertTrue(compiler.messages.isEmpty());
    }

    @Test
    public void logging() {
        StringBuilder log = new StringBuilder();
        Appendable previous = Logger.INSTANCE.setDebugStream(log);
        int level = Logger.INSTANCE.setLoggingLevel("PlanValidator", 1);
        try {
            Assert.assertNotNull(new SansCompiler().compileAndValidate(
                    "proc sort data=dm out=s; by subjid; run;", DM));
            Assert.assertTrue(log.toString(), log.toString().contains("sort -> s"));
        } finally {
            Logger.INSTANCE.setLoggingLevel(PlanValidator.class, level);
            Logger.INSTANCE.setDebugStream(previous);
        }
    }
}
