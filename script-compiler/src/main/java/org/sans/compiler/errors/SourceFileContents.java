package org.sans.compiler.errors;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** The text of a compilation unit, used to render diagnostics. */
public class SourceFileContents {
    /** Null if the data does not come from a file. */
    public @Nullable String sourceFileName;
    final List<String> lines = new ArrayList<>();
    final StringBuilder builder = new StringBuilder();

    public SourceFileContents() {
        this.sourceFileName = null;
    }

    public SourceFileContents(@Nullable String sourceFileName, String code) {
        this.sourceFileName = sourceFileName;
        this.append(code);
    }

    public void append(String code) {
        this.lines.addAll(Arrays.asList(code.split("\r?\n", -1)));
        this.builder.append(code);
    }

    public String getWholeProgram() {
        return this.builder.toString();
    }

    public int lineCount() {
        return this.lines.size();
    }

    public static String newline() {
        return System.lineSeparator();
    }

    public String lineNo(int no, boolean decorated) {
        if (!decorated)
            return "";
        return String.format("%5d|", no + 1);
    }

    /** Get the source code fragment at the specified position.
     * @param range     Position to extract fragment from.
     * @param decorated If true print additional decorations around, like ^^^^^ */
    public String getFragment(SourcePositionRange range, boolean decorated) {
        if (!range.isValid())
            return "";
        int startLine = range.start.line - 1;
        int endLine = Math.min(range.end.line - 1, this.lines.size() - 1);
        if (startLine >= this.lines.size() || startLine > endLine)
            return "";
        StringBuilder result = new StringBuilder();
        if (startLine == endLine) {
            String line = this.lines.get(startLine);
            int startCol = Math.min(range.start.column - 1, line.length());
            int endCol = Math.max(Math.min(range.end.column, line.length()), startCol);
            if (!decorated) {
                result.append(line, startCol, endCol);
                return result.toString();
            }
            result.append(this.lineNo(startLine, true))
                    .append(line)
                    .append(SourceFileContents.newline())
                    .append(" ".repeat(startCol + 6))
                    .append("^".repeat(Math.max(1, endCol - startCol)))
                    .append(SourceFileContents.newline());
        } else if (endLine - startLine < 5 || !decorated) {
            for (int i = startLine; i <= endLine; i++) {
                result.append(this.lineNo(i, decorated))
                        .append(this.lines.get(i))
                        .append(SourceFileContents.newline());
            }
        } else {
            result.append(this.lineNo(startLine, true))
                    .append(this.lines.get(startLine))
                    .append(SourceFileContents.newline())
                    .append(this.lineNo(startLine + 1, true))
                    .append(this.lines.get(startLine + 1))
                    .append(SourceFileContents.newline())
                    .append("      ...")
                    .append(SourceFileContents.newline())
                    .append(this.lineNo(endLine, true))
                    .append(this.lines.get(endLine))
                    .append(SourceFileContents.newline());
        }
        return result.toString();
    }

    public String getSourceFileName() {
        return this.sourceFileName == null ? "(no input file)" : this.sourceFileName;
    }
}
