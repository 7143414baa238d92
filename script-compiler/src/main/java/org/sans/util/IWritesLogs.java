package org.sans.util;

/** Marker for classes which emit messages through the {@link Logger}. */
public interface IWritesLogs {
    default IIndentStream getDebugStream(int level) {
        return Logger.INSTANCE.belowLevel(this, level);
    }
}
