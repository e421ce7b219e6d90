package org.shellsafe.compiler.frontend.parser;

/**
 * Thrown inside the {@link Parser} to unwind to the nearest recovery point after an error has been
 * reported. It never leaves the parser.
 */
final class ParseException extends RuntimeException {

    ParseException(String message) {
        super(message, null, false, false);
    }
}
