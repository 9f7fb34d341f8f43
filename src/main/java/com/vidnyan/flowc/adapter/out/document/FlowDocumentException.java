package com.vidnyan.flowc.adapter.out.document;

/**
 * A flow document could not be read or parsed.
 */
public class FlowDocumentException extends RuntimeException {

    public FlowDocumentException(String message) {
        super(message);
    }

    public FlowDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
