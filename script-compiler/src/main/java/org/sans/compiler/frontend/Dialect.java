package org.sans.compiler.frontend;

/** The two surface syntaxes. */
public enum Dialect {
    /** The SAS-like legacy language. */
    LEGACY,
    /** Scripts starting with a '# sans' header. */
    NATIVE
}
