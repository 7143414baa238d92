package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.IHasSourcePositionRange;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.util.ICastable;

/** An element of a plan: either an operation or a refused block. */
public abstract class IRStep implements IHasSourcePositionRange, ICastable {
    public final SourcePositionRange range;

    protected IRStep(SourcePositionRange range) {
        this.range = range;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    /** JSON rendering including wiring and source position. */
    public abstract ObjectNode toJson();
}
