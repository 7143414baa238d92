package org.sans.compiler;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;

/** Interface for reporting errors. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     *
     * @param range     Source position where the problem occurred.
     * @param warning   If true, this is a warning.
     * @param code      Stable code of the problem.
     * @param message   Message to report.
     */
    void reportProblem(SourcePositionRange range, boolean warning, ErrorCode code, String message);

    default void reportError(SourcePositionRange range, ErrorCode code, String message) {
        this.reportProblem(range, false, code, message);
    }

    default void reportWarning(SourcePositionRange range, ErrorCode code, String message) {
        this.reportProblem(range, true, code, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
