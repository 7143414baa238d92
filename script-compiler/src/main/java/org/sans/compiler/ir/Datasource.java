package org.sans.compiler.ir;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.HashString;

import javax.annotation.Nullable;

/** A declared external input.  Steps read a datasource through
 * the pseudo-table name returned by {@link #inputName(String)}. */
public final class Datasource {
    public enum Kind {
        CSV("csv"),
        INLINE_CSV("inline_csv");

        public final String text;

        Kind(String text) {
            this.text = text;
        }
    }

    public static final String PREFIX = "__datasource__";

    public final String name;
    public final Kind kind;
    @Nullable
    public final String path;
    /** Pinned columns; null when the types are not known at compile time. */
    @Nullable
    public final Schema columns;
    @Nullable
    public final String inlineText;
    @Nullable
    public final HashString inlineSha256;

    private Datasource(String name, Kind kind, @Nullable String path, @Nullable Schema columns,
                       @Nullable String inlineText) {
        this.name = name;
        this.kind = kind;
        this.path = path;
        this.columns = columns;
        this.inlineText = inlineText;
        this.inlineSha256 = inlineText == null ? null : HashString.sha256(inlineText);
    }

    public static Datasource csv(String name, String path, @Nullable Schema columns) {
        return new Datasource(name, Kind.CSV, path, columns, null);
    }

    public static Datasource inline(String name, String text, Schema columns) {
        return new Datasource(name, Kind.INLINE_CSV, null, columns, text);
    }

    public Schema getSchema() {
        return this.columns != null ? this.columns : Schema.OPEN;
    }

    public String getInputName() {
        return inputName(this.name);
    }

    public static String inputName(String name) {
        return PREFIX + name;
    }

    public static boolean isDatasourceInput(String table) {
        return table.startsWith(PREFIX);
    }

    public static String nameFromInput(String table) {
        return table.substring(PREFIX.length());
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("kind", this.kind.text);
        if (this.path != null)
            result.put("path", this.path);
        if (this.columns != null)
            result.set("columns", this.columns.toJson());
        if (this.inlineSha256 != null)
            result.put("inline_sha256", this.inlineSha256.toString());
        return result;
    }
}
