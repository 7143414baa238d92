package org.sans.compiler.errors;

/** Stable, machine-readable codes for every refusal the system can produce.
 * Messages are advisory; these codes are part of the contract. */
public enum ErrorCode {
    // Frontend
    MACRO_ERROR("SANS_PARSE_MACRO_ERROR", ErrorFamily.PARSE),
    UNSUPPORTED_PROC("SANS_PARSE_UNSUPPORTED_PROC", ErrorFamily.PARSE),
    UNSUPPORTED_STATEMENT("SANS_PARSE_UNSUPPORTED_STATEMENT", ErrorFamily.PARSE),
    EXPRESSION_ERROR("SANS_PARSE_EXPRESSION_ERROR", ErrorFamily.PARSE),
    DATASTEP_MISSING_BY("SANS_PARSE_DATASTEP_MISSING_BY", ErrorFamily.PARSE),
    UNSUPPORTED_DATASTEP_FORM("SANS_PARSE_UNSUPPORTED_DATASTEP_FORM", ErrorFamily.PARSE),
    DATASET_OPTION_UNSUPPORTED("SANS_PARSE_DATASET_OPTION_UNSUPPORTED", ErrorFamily.PARSE),
    MERGE_MALFORMED("SANS_PARSE_MERGE_STATEMENT_MALFORMED", ErrorFamily.PARSE),
    STATEFUL_TOKEN("SANS_BLOCK_STATEFUL_TOKEN", ErrorFamily.PARSE),
    SORT_UNSUPPORTED_OPTION("SANS_PARSE_SORT_UNSUPPORTED_OPTION", ErrorFamily.PARSE),
    SORT_MISSING_BY("SANS_PARSE_SORT_MISSING_BY", ErrorFamily.PARSE),
    TRANSPOSE_MALFORMED("SANS_PARSE_TRANSPOSE_MALFORMED", ErrorFamily.PARSE),
    SQL_UNSUPPORTED("SANS_PARSE_SQL_UNSUPPORTED", ErrorFamily.PARSE),
    FORMAT_MALFORMED("SANS_PARSE_FORMAT_MALFORMED", ErrorFamily.PARSE),
    SUMMARY_MALFORMED("SANS_PARSE_SUMMARY_MALFORMED", ErrorFamily.PARSE),
    SCRIPT_HEADER("SANS_PARSE_SCRIPT_HEADER", ErrorFamily.PARSE),
    SCRIPT_SYNTAX("SANS_PARSE_SCRIPT_SYNTAX", ErrorFamily.PARSE),
    KIND_CONFLICT("SANS_PARSE_KIND_CONFLICT", ErrorFamily.PARSE),
    DATASOURCE_MALFORMED("SANS_PARSE_DATASOURCE_MALFORMED", ErrorFamily.PARSE),

    // Validator
    TABLE_UNDEFINED("SANS_VALIDATE_TABLE_UNDEFINED", ErrorFamily.VALIDATE),
    DATASOURCE_UNDEFINED("SANS_VALIDATE_DATASOURCE_UNDEFINED", ErrorFamily.VALIDATE),
    OUTPUT_TABLE_COLLISION("SANS_VALIDATE_OUTPUT_TABLE_COLLISION", ErrorFamily.VALIDATE),
    SORT_WITHOUT_KEYS("SANS_VALIDATE_SORT_MISSING_BY", ErrorFamily.VALIDATE),
    ORDER_REQUIRED("SANS_VALIDATE_ORDER_REQUIRED", ErrorFamily.VALIDATE),
    KEYS_REQUIRED("SANS_VALIDATE_KEYS_REQUIRED", ErrorFamily.VALIDATE),
    COLUMN_EXISTS("SANS_VALIDATE_COLUMN_EXISTS", ErrorFamily.VALIDATE),
    SQL_AMBIGUOUS_COLUMN("SANS_VALIDATE_SQL_AMBIGUOUS_COLUMN", ErrorFamily.VALIDATE),

    // Types
    TYPE("E_TYPE", ErrorFamily.TYPE),
    TYPE_UNKNOWN("E_TYPE_UNKNOWN", ErrorFamily.TYPE),
    COLUMN_NOT_FOUND("E_COLUMN_NOT_FOUND", ErrorFamily.TYPE),

    // Capabilities
    UNSUPPORTED_OP("SANS_CAP_UNSUPPORTED_OP", ErrorFamily.CAPABILITY),
    SORT_DESCENDING("SANS_CAP_SORT_DESCENDING", ErrorFamily.CAPABILITY),

    // Contract violations
    CANON_SHAPE("SANS_IR_CANON_SHAPE", ErrorFamily.INTERNAL),
    INTERNAL("SANS_INTERNAL_COMPILER_ERROR", ErrorFamily.INTERNAL),

    // Execution
    RUNTIME_TABLE_UNDEFINED("SANS_RUNTIME_TABLE_UNDEFINED", ErrorFamily.RUNTIME),
    RUNTIME_UNTYPED_INPUT("SANS_RUNTIME_UNTYPED_INPUT", ErrorFamily.RUNTIME),
    RUNTIME_SCHEMA_MISMATCH("SANS_RUNTIME_SCHEMA_MISMATCH", ErrorFamily.RUNTIME),
    RUNTIME_ORDER_REQUIRED("SANS_RUNTIME_ORDER_REQUIRED", ErrorFamily.RUNTIME),
    RUNTIME_MERGE_MANY_MANY("SANS_RUNTIME_MERGE_MANY_MANY", ErrorFamily.RUNTIME),
    RUNTIME_FORMAT_UNDEFINED("SANS_RUNTIME_FORMAT_UNDEFINED", ErrorFamily.RUNTIME),
    RUNTIME_FORMAT_MISS("SANS_RUNTIME_FORMAT_MISS", ErrorFamily.RUNTIME),
    RUNTIME_INFORMAT_UNSUPPORTED("SANS_RUNTIME_INFORMAT_UNSUPPORTED", ErrorFamily.RUNTIME),
    RUNTIME_CAST_FAILED("SANS_RUNTIME_CAST_FAILED", ErrorFamily.RUNTIME),
    RUNTIME_TRANSPOSE_ID_MISSING("SANS_RUNTIME_TRANSPOSE_ID_MISSING", ErrorFamily.RUNTIME),
    RUNTIME_TRANSPOSE_ID_COLLISION("SANS_RUNTIME_TRANSPOSE_ID_COLLISION", ErrorFamily.RUNTIME),
    RUNTIME_SQL_AMBIGUOUS_COLUMN("SANS_RUNTIME_SQL_AMBIGUOUS_COLUMN", ErrorFamily.RUNTIME),
    RUNTIME_SQL_COLUMN_UNDEFINED("SANS_RUNTIME_SQL_COLUMN_UNDEFINED", ErrorFamily.RUNTIME),
    RUNTIME_TYPE_MISMATCH("SANS_RUNTIME_TYPE_MISMATCH", ErrorFamily.RUNTIME);

    public final String code;
    public final ErrorFamily family;

    ErrorCode(String code, ErrorFamily family) {
        this.code = code;
        this.family = family;
    }

    @Override
    public String toString() {
        return this.code;
    }
}
