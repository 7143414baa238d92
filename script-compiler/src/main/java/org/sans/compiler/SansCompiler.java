package org.sans.compiler;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.CompilerMessages;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourceFileContents;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.frontend.IFrontend;
import org.sans.compiler.frontend.legacy.LegacyCompiler;
import org.sans.compiler.frontend.script.ScriptCompiler;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.type.Schema;
import org.sans.compiler.validator.PlanValidator;
import org.sans.util.IWritesLogs;
import org.sans.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compiles a script to a validated plan.
 * The dialect is chosen by the source: a native script starts with a
 * "# sans VERSION" header, anything else is compiled as the legacy dialect.
 * All problems are reported to {@link #messages}; on error the result is null.
 */
public class SansCompiler implements IWritesLogs, IErrorReporter {
    public final CompilerOptions options;
    public final CompilerMessages messages;
    public final SourceFileContents sources;
    /** File the current source was read from, if any. */
    @Nullable
    Path sourceFile;

    public SansCompiler(CompilerOptions options) {
        this.options = options;
        this.sources = new SourceFileContents();
        this.messages = new CompilerMessages(this.sources, options);
        options.applyLoggingLevels();
    }

    public SansCompiler() {
        this(CompilerOptions.getDefault());
    }

    /** Read the script from a file; relative includes are resolved against its directory. */
    public String readInput(String fileName) throws IOException {
        this.sourceFile = Paths.get(fileName);
        this.sources.sourceFileName = fileName;
        return Utilities.readFile(this.sourceFile);
    }

    @Override
    public void reportProblem(SourcePositionRange range, boolean warning, ErrorCode code, String message) {
        if (warning && this.options.languageOptions.warningsAreErrors)
            warning = false;
        this.messages.reportProblem(range, warning, code, message);
        if (!warning && this.options.languageOptions.throwOnError)
            throw new CompilationError(code, message, range);
    }

    @Override
    public boolean hasErrors() {
        return this.messages.hasErrors();
    }

    IFrontend frontend(String source) {
        if (ScriptCompiler.hasHeader(source))
            return new ScriptCompiler(this.options);
        return new LegacyCompiler(this.options, this.sourceFile);
    }

    /** Run the frontend only.  Refused blocks are part of the returned plan. */
    public Plan compile(String source, Map<String, Schema> predeclared) {
        this.sources.append(source);
        IFrontend frontend = this.frontend(source);
        this.getDebugStream(1)
                .append("Compiling with ")
                .append(frontend.getClass().getSimpleName())
                .newline();
        return frontend.compile(source, predeclared);
    }

    /**
     * Compile and validate a script.
     * @param source       Script text.
     * @param predeclared  Tables that exist before the script runs, with their schemas.
     * @return The validated plan, or null if any error was reported.
     */
    @Nullable
    public ValidatedPlan compileAndValidate(String source, Map<String, Schema> predeclared) {
        Plan plan = this.compile(source, predeclared);
        for (RefusedBlock refused: plan.getRefusals())
            this.reportProblem(refused.range, !refused.isFatal(), refused.code, refused.message);
        if (this.hasErrors())
            return null;
        try {
            ValidatedPlan result = new PlanValidator().validate(plan);
            this.getDebugStream(1)
                    .append("Validated plan ")
                    .append(plan.fingerprint().toString())
                    .newline();
            return result;
        } catch (CompilationError e) {
            this.reportProblem(e.range, false, e.code, e.getMessage());
            return null;
        }
    }

    /** Compile and validate a script whose predeclared tables have unknown columns. */
    @Nullable
    public ValidatedPlan compileAndValidate(String source, Set<String> predeclared) {
        Map<String, Schema> schemas = new LinkedHashMap<>();
        for (String table: new TreeSet<>(predeclared))
            schemas.put(table, Schema.OPEN);
        return this.compileAndValidate(source, schemas);
    }
}
