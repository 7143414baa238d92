package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;

/** A block of source which could not be compiled.  It occupies the place
 * of the steps it would have produced. */
public final class RefusedBlock extends IRStep {
    public enum Severity {
        FATAL("fatal"),
        WARNING("warning");

        public final String text;

        Severity(String text) {
            this.text = text;
        }
    }

    public final ErrorCode code;
    public final String message;
    public final Severity severity;

    public RefusedBlock(ErrorCode code, String message, SourcePositionRange range, Severity severity) {
        super(range);
        this.code = code;
        this.message = message;
        this.severity = severity;
    }

    public RefusedBlock(ErrorCode code, String message, SourcePositionRange range) {
        this(code, message, range, Severity.FATAL);
    }

    public static RefusedBlock from(CompilationError error, SourcePositionRange fallback) {
        SourcePositionRange range = error.range.isValid() ? error.range : fallback;
        return new RefusedBlock(error.code, error.getMessage(), range);
    }

    public boolean isFatal() {
        return this.severity == Severity.FATAL;
    }

    public CompilationError toError() {
        return new CompilationError(this.code, this.message, this.range);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("kind", "block");
        result.put("code", this.code.code);
        result.put("message", this.message);
        result.put("severity", this.severity.text);
        this.range.appendAsJson(result.putObject("loc"));
        return result;
    }

    @Override
    public String toString() {
        return this.code + ": " + this.message;
    }
}
