package org.sans.util;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** A Hash value produced by SHA256, as lowercase hex digits. */
public record HashString(String value) {
    /** Number of digits that is safe to use in abbreviations */
    static final int SHORT_SIZE = 12;

    /** Hash the UTF-8 encoding of a string. */
    public static HashString sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder();
            for (byte b: hash)
                builder.append(String.format("%02x", b));
            return new HashString(builder.toString());
        } catch (NoSuchAlgorithmException ex) {
            // Every JVM is required to ship SHA-256
            throw new RuntimeException(ex);
        }
    }

    @Override
    public String toString() {
        return this.value;
    }

    public String shortString() {
        return this.value.substring(0, SHORT_SIZE);
    }

    public String makeIdentifier(@Nullable String prefix) {
        if (prefix == null)
            prefix = "s";
        return prefix + "_" + this.shortString();
    }
}
