package org.sans.compiler.ir.type;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;

import javax.annotation.Nullable;

/** The scalar type lattice.  UNKNOWN only exists during type checking:
 * it describes columns whose type has not been pinned. */
public enum ScalarType {
    NULL("null"),
    BOOL("bool"),
    INT("int"),
    DECIMAL("decimal"),
    STRING("string"),
    UNKNOWN("unknown");

    public final String text;

    ScalarType(String text) {
        this.text = text;
    }

    public boolean isNumeric() {
        return this == INT || this == DECIMAL;
    }

    public boolean isConcrete() {
        return this != UNKNOWN;
    }

    @Override
    public String toString() {
        return this.text;
    }

    @Nullable
    public static ScalarType fromText(String text) {
        switch (text.toLowerCase()) {
            case "null": return NULL;
            case "bool": case "boolean": return BOOL;
            case "int": case "integer": return INT;
            case "decimal": case "numeric": return DECIMAL;
            case "string": case "str": return STRING;
            case "unknown": return UNKNOWN;
            default: return null;
        }
    }

    /** Unify two types the way branches of a conditional are unified.
     * Identical types unify to themselves, int with decimal gives decimal,
     * null with T gives T.  Anything else is an error. */
    public static ScalarType unify(ScalarType left, ScalarType right, String context) {
        if (left == right)
            return left;
        if (left == NULL)
            return right;
        if (right == NULL)
            return left;
        if (left == UNKNOWN || right == UNKNOWN)
            throw new CompilationError(ErrorCode.TYPE_UNKNOWN,
                    context + ": cannot unify " + left + " with " + right);
        if (left.isNumeric() && right.isNumeric())
            return DECIMAL;
        throw new CompilationError(ErrorCode.TYPE,
                context + ": cannot unify " + left + " with " + right);
    }
}
