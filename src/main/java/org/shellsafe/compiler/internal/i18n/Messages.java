package org.shellsafe.compiler.internal.i18n;

import org.shellsafe.compiler.api.CompilerErrorCode;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Looks up the plain-language explanations of error codes in the {@code compiler_messages} bundle.
 * Keys have the form {@code <CODE_NAME>.explanation}.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "compiler_messages";
    private static final String EXPLANATION_SUFFIX = ".explanation";
    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ROOT);

    private Messages() {}

    /**
     * Returns the plain-language explanation of an error code.
     * @param code The error code.
     * @return The explanation text, or a marker naming the missing key.
     */
    public static String explanation(CompilerErrorCode code) {
        String key = code.name() + EXPLANATION_SUFFIX;
        try {
            return BUNDLE.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    /**
     * @param code The error code.
     * @return {@code true} if the bundle carries an explanation for the code.
     */
    public static boolean hasExplanation(CompilerErrorCode code) {
        return BUNDLE.containsKey(code.name() + EXPLANATION_SUFFIX);
    }
}
