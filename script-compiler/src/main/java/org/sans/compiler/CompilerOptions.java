package org.sans.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.util.IDiff;
import org.sans.util.IValidate;
import org.sans.util.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IDiff<CompilerOptions>, IValidate {
    /** Options related to the language compiled. */
    @SuppressWarnings("CanBeFinal")
    public static class Language implements IDiff<Language>, IValidate {
        /** Maximum nesting of if/then/else actions inside a data step. */
        @Parameter(names = "--maxControlDepth", description = "Maximum nesting of if/then/else in a data step")
        public int maxControlDepth = 16;
        /** Treat warnings (e.g. non-fatal refused blocks) as errors. */
        @Parameter(names = "--Werror", description = "Treat warnings as errors")
        public boolean warningsAreErrors = false;
        /** Useful for development */
        public boolean throwOnError = false;

        public boolean same(Language language) {
            return this.maxControlDepth == language.maxControlDepth &&
                    this.warningsAreErrors == language.warningsAreErrors;
        }

        @Override
        public String toString() {
            return "Language{" +
                    "\n\tmaxControlDepth=" + this.maxControlDepth +
                    ",\n\twarningsAreErrors=" + this.warningsAreErrors +
                    ",\n\tthrowOnError=" + this.throwOnError +
                    '}';
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.maxControlDepth < 1) {
                reporter.reportError(SourcePositionRange.INVALID, ErrorCode.INTERNAL,
                        "--maxControlDepth must be positive, got " + this.maxControlDepth);
                return false;
            }
            return true;
        }

        @Override
        public String diff(Language other) {
            if (this.same(other))
                return "";
            StringBuilder result = new StringBuilder();
            result.append("Language{");
            if (this.maxControlDepth != other.maxControlDepth)
                result.append("maxControlDepth=")
                        .append(this.maxControlDepth)
                        .append("!=")
                        .append(other.maxControlDepth)
                        .append(System.lineSeparator());
            if (this.warningsAreErrors != other.warningsAreErrors)
                result.append(", warningsAreErrors=")
                        .append(this.warningsAreErrors)
                        .append("!=")
                        .append(other.warningsAreErrors)
                        .append(System.lineSeparator());
            result.append("}")
                    .append(System.lineSeparator());
            return result.toString();
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IDiff<IO>, IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-I", description = "Directory from which %include may read files (can be repeated)")
        public List<String> includeRoots = new ArrayList<>();
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;

        public boolean same(IO other) {
            return this.includeRoots.equals(other.includeRoots);
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
                try {
                    Integer.parseInt(entry.getValue());
                } catch (NumberFormatException ex) {
                    reporter.reportError(SourcePositionRange.INVALID, ErrorCode.INTERNAL,
                            "Logging level for " + entry.getKey() + " is not a number: " + entry.getValue());
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tincludeRoots=" + this.includeRoots +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tquiet=" + this.quiet +
                    '}';
        }

        @Override
        public String diff(IO other) {
            if (this.same(other))
                return "";
            return "IO{.includeRoots=" + this.includeRoots + "!=" + other.includeRoots + "}";
        }
    }

    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Language languageOptions = new Language();

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    /** Parse options from a command line. */
    public static CompilerOptions parse(String... args) {
        CompilerOptions options = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(options)
                .build();
        commander.setProgramName("sans");
        try {
            commander.parse(args);
        } catch (ParameterException ex) {
            throw new CompilationError(ErrorCode.INTERNAL, "Invalid command line: " + ex.getMessage());
        }
        return options;
    }

    /** Install the logging levels requested with -T. */
    public void applyLoggingLevels() {
        for (Map.Entry<String, String> entry: this.ioOptions.loggingLevel.entrySet())
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), Integer.parseInt(entry.getValue()));
    }

    public boolean same(CompilerOptions other) {
        if (!this.ioOptions.same(other.ioOptions)) return false;
        return this.languageOptions.same(other.languageOptions);
    }

    @Override
    public String diff(CompilerOptions other) {
        return this.languageOptions.diff(other.languageOptions) +
                this.ioOptions.diff(other.ioOptions);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nioOptions=" + this.ioOptions +
                ",\nlanguageOptions=" + this.languageOptions +
                "\n}";
    }

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.ioOptions.validate(reporter) &&
                this.languageOptions.validate(reporter);
    }
}
