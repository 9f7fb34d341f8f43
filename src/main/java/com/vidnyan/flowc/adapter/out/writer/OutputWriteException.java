package com.vidnyan.flowc.adapter.out.writer;

/**
 * Generated files could not be written.
 */
public class OutputWriteException extends RuntimeException {

    public OutputWriteException(String message) {
        super(message);
    }

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
