package org.sans.util;

import java.util.Collection;
import java.util.function.Supplier;

@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    IIndentStream appendChar(char c);

    default IIndentStream append(String string) {
        if (!string.contains("\n"))
            return this.appendFast(string);
        String[] parts = string.split("\n", -1);
        boolean first = true;
        for (String part: parts) {
            if (!first)
                this.newline();
            first = false;
            this.appendFast(part);
        }
        return this;
    }

    /** Append a string that does not contain a newline */
    IIndentStream appendFast(String string);

    default IIndentStream append(boolean b) {
        return this.appendFast(Boolean.toString(b));
    }

    default <T extends ToIndentableString> IIndentStream append(T value) {
        value.toString(this);
        return this;
    }

    default IIndentStream append(int value) {
        return this.appendFast(Integer.toString(value));
    }

    default IIndentStream append(long value) {
        return this.appendFast(Long.toString(value));
    }

    /** For lazy evaluation of the argument. */
    default IIndentStream appendSupplier(Supplier<String> supplier) {
        return this.append(supplier.get());
    }

    default IIndentStream join(String separator, Collection<String> data) {
        boolean first = true;
        for (String d: data) {
            if (!first)
                this.append(separator);
            first = false;
            this.append(d);
        }
        return this;
    }

    default <T extends ToIndentableString> IIndentStream joinI(String separator, Collection<T> data) {
        boolean first = true;
        for (ToIndentableString d: data) {
            if (!first)
                this.append(separator);
            first = false;
            this.append(d);
        }
        return this;
    }

    default IIndentStream newline()  {
        return this.appendChar('\n');
    }

    /** Increase indentation and emit a newline. */
    IIndentStream increase();
    IIndentStream decrease();
}
