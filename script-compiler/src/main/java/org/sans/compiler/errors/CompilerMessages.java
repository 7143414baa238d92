package org.sans.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.CompilerOptions;
import org.sans.compiler.IErrorReporter;
import org.sans.compiler.IHasSourcePositionRange;
import org.sans.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Diagnostics collected while compiling one source. */
public class CompilerMessages implements IErrorReporter {
    public class Message implements IHasSourcePositionRange {
        public final SourcePositionRange range;
        public final boolean warning;
        public final ErrorCode code;
        public final String message;

        protected Message(SourcePositionRange range, boolean warning, ErrorCode code, String message) {
            this.range = range;
            this.warning = warning;
            this.code = code;
            this.message = message;
        }

        Message(BaseCompilerException e) {
            this(e.getPositionRange(), false, e.code, e.getMessage());
        }

        Message(Throwable e) {
            this(SourcePositionRange.INVALID, false, ErrorCode.INTERNAL,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        public String getErrorKind() {
            return this.code.family.description;
        }

        public void format(SourceFileContents contents, StringBuilder output) {
            if (this.range.isValid()) {
                output.append(contents.getSourceFileName())
                        .append(":")
                        .append(this.range.start)
                        .append(": ");
            }
            output.append(this.warning ? "warning: " : "error: ")
                    .append(this.getErrorKind())
                    .append(" ")
                    .append(this.code.code)
                    .append(": ")
                    .append(this.message)
                    .append(SourceFileContents.newline());
            output.append(contents.getFragment(this.range, true));
        }

        public JsonNode toJson(SourceFileContents contents, ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            this.range.appendAsJson(result);
            result.put("warning", this.warning);
            result.put("code", this.code.code);
            result.put("error_type", this.getErrorKind());
            result.put("message", this.message);
            result.put("snippet", contents.getFragment(this.range, true));
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(CompilerMessages.this.sources, builder);
            return builder.toString();
        }

        @Override
        public SourcePositionRange getPositionRange() {
            return this.range;
        }
    }

    public final SourceFileContents sources;
    public final CompilerOptions options;
    public final List<Message> messages;

    public CompilerMessages(SourceFileContents sources, CompilerOptions options) {
        this.sources = sources;
        this.options = options;
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
    }

    void add(Message message) {
        this.messages.add(message);
    }

    @Override
    public void reportProblem(SourcePositionRange range, boolean warning, ErrorCode code, String message) {
        this.add(new Message(range, warning, code, message));
    }

    public void reportError(BaseCompilerException e) {
        this.add(new Message(e));
    }

    public void reportError(Throwable e) {
        this.add(new Message(e));
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount() > 0;
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getError(int ct) {
        return this.messages.get(ct);
    }

    /** Codes of all messages, in report order. */
    public List<String> codes() {
        List<String> result = new ArrayList<>();
        for (Message message: this.messages)
            result.add(message.code.code);
        return result;
    }

    /** The exit bucket corresponding to these messages: the first error decides. */
    public int exitCode() {
        for (Message message: this.messages)
            if (!message.warning)
                return message.code.family.exitCode;
        if (this.warningCount() > 0)
            return ErrorFamily.OK_WITH_WARNINGS;
        return ErrorFamily.OK;
    }

    public void show(PrintStream stream) {
        if (this.errorCount() +
                (this.options.ioOptions.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.options.ioOptions.emitJsonErrors) {
            JsonNode node = this.toJson();
            builder.append(node.toPrettyString());
        } else {
            for (Message message: this.messages) {
                if (this.options.ioOptions.quiet && message.warning)
                    continue;
                message.format(this.sources, builder);
            }
        }
        return builder.toString();
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            JsonNode node = message.toJson(this.sources, mapper);
            result.add(node);
        }
        return result;
    }
}
