package org.sans.compiler;

import org.sans.compiler.errors.SourcePositionRange;

/** Implemented by objects which know where in the source they come from. */
public interface IHasSourcePositionRange {
    SourcePositionRange getPositionRange();
}
