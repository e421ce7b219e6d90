package org.shellsafe.compiler.validation;

import org.shellsafe.compiler.api.CompilerErrorCode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Compares two renderings of the same source by their SHA-256 digests.
 */
public final class DeterminismCheck {

    private DeterminismCheck() {}

    /**
     * @param text Any text, encoded as UTF-8.
     * @return The lower-case hex SHA-256 digest.
     */
    public static String digest(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Verifies that a second compilation produced the same bytes.
     * @param first The accepted output.
     * @param second The output of an independent second run.
     * @throws ValidationException if the digests differ.
     */
    public static void verify(String first, String second) {
        String expected = digest(first);
        String actual = digest(second);
        if (!expected.equals(actual)) {
            throw new ValidationException(CompilerErrorCode.NON_DETERMINISTIC_OUTPUT,
                    "Two compilations of the same source differ (sha256 " + expected + " vs " + actual + ").");
        }
    }
}
