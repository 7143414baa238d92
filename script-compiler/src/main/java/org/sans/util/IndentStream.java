package org.sans.util;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

public class IndentStream implements IIndentStream {
    private Appendable stream;
    int spaces = 0;
    int amount = 4;
    String indentAdd = "";
    String indentString = "";
    final Map<Integer, String> indentStringCache = new HashMap<>();
    boolean emitIndent = false;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
        this.setIndentAmount(this.amount);
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    /** Set the indent amount.  If less or equal to 0, newline will have no effect. */
    public IIndentStream setIndentAmount(int amount) {
        Utilities.enforce(amount >= 0);
        this.amount = amount;
        this.indentAdd = " ".repeat(amount);
        return this;
    }

    @Override
    public IIndentStream appendChar(char c) {
        try {
            if (c == '\n') {
                this.stream.append(c);
                this.emitIndent = true;
                return this;
            }
            if (this.emitIndent && !Character.isSpaceChar(c)) {
                this.emitIndent = false;
                this.stream.append(this.indentString);
            }
            this.stream.append(c);
            return this;
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }

    /** Append a string that does not contain newlines */
    @Override
    public IIndentStream appendFast(String s) {
        try {
            if (s.isEmpty())
                return this;
            if (this.emitIndent) {
                this.emitIndent = false;
                this.stream.append(this.indentString);
            }
            this.stream.append(s);
            return this;
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }

    @Override
    public IIndentStream increase() {
        this.spaces += this.amount;
        this.indentString = this.indentStringCache.computeIfAbsent(this.spaces, " "::repeat);
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        this.spaces -= this.amount;
        if (this.spaces < 0)
            throw new RuntimeException("Negative indent");
        this.indentString = this.indentStringCache.computeIfAbsent(this.spaces, " "::repeat);
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
