package org.sans.compiler.ir.step;

/** The closed set of operations a plan can contain. */
public enum OpKind {
    IDENTITY("identity"),
    COMPUTE("compute"),
    FILTER("filter"),
    SELECT("select"),
    RENAME("rename"),
    SORT("sort"),
    DATA_STEP("data_step"),
    TRANSPOSE("transpose"),
    SQL_SELECT("sql_select"),
    FORMAT("format"),
    AGGREGATE("aggregate"),
    CAST("cast");

    /** Name used in canonical JSON. */
    public final String opName;

    OpKind(String opName) {
        this.opName = opName;
    }

    @Override
    public String toString() {
        return this.opName;
    }
}
