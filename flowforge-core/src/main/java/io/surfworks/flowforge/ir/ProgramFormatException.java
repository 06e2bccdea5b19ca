package io.surfworks.flowforge.ir;

/**
 * Exception thrown when a JSON program document is malformed.
 */
public class ProgramFormatException extends RuntimeException {

    public ProgramFormatException(String message) {
        super(message);
    }

    public ProgramFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
