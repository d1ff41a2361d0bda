package dev.receiptly.tools;

/**
 * A tool argument is missing or malformed.
 */
public class InvalidArgumentException extends RuntimeException {

    private final String argument;

    public InvalidArgumentException(String argument, String message) {
        super(message);
        this.argument = argument;
    }

    public InvalidArgumentException(String argument, String message, Throwable cause) {
        super(message, cause);
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }
}
