package net.salescoach.support.stream;

/**
 * Raised when a completion stream cannot be read to completion.
 */
public class StreamDecodeException extends RuntimeException {

    public StreamDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
