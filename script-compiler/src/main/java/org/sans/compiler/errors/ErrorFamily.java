package org.sans.compiler.errors;

/** The kind of a failure.  Each kind maps to a distinct exit bucket. */
public enum ErrorFamily {
    PARSE("Parse error", 30),
    VALIDATE("Validation error", 31),
    TYPE("Type error", 31),
    CAPABILITY("Unsupported capability", 32),
    RUNTIME("Runtime error", 40),
    INTERNAL("Internal error", 50);

    public final String description;
    public final int exitCode;

    ErrorFamily(String description, int exitCode) {
        this.description = description;
        this.exitCode = exitCode;
    }

    /** Exit code of a successful run. */
    public static final int OK = 0;
    /** Exit code of a successful run which produced warnings. */
    public static final int OK_WITH_WARNINGS = 10;
}
