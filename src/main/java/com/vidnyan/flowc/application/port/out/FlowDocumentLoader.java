package com.vidnyan.flowc.application.port.out;

import com.vidnyan.flowc.domain.document.FlowDocument;

import java.nio.file.Path;

/**
 * Port for reading flow documents.
 * Implemented by adapters that read files, request bodies, etc.
 */
public interface FlowDocumentLoader {

    /**
     * Load and parse a flow document from a file.
     */
    FlowDocument load(Path path);

    /**
     * Parse a flow document from its serialized text.
     */
    FlowDocument parse(String content, String name);
}
