package org.sans.util;

import java.util.Collection;
import java.util.function.Supplier;

/** Drops all data written. */
public class NullIndentStream implements IIndentStream {
    public NullIndentStream() {}

    @Override
    public IIndentStream appendChar(char c) {
        return this;
    }

    @Override
    public IIndentStream append(String string) {
        return this;
    }

    @Override
    public <T extends ToIndentableString> IIndentStream append(T value) {
        return this;
    }

    @Override
    public IIndentStream appendSupplier(Supplier<String> supplier) {
        return this;
    }

    @Override
    public IIndentStream join(String separator, Collection<String> data) {
        return this;
    }

    @Override
    public IIndentStream appendFast(String string) {
        return this;
    }

    @Override
    public IIndentStream increase() {
        return this;
    }

    @Override
    public IIndentStream decrease() {
        return this;
    }
}
