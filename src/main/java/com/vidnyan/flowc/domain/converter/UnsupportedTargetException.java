package com.vidnyan.flowc.domain.converter;

import com.vidnyan.flowc.domain.codegen.TargetLanguage;

/**
 * A converter has no code template for the requested target language.
 */
public class UnsupportedTargetException extends RuntimeException {

    private final String nodeType;
    private final TargetLanguage target;

    public UnsupportedTargetException(String nodeType, TargetLanguage target) {
        super("No " + target.tag() + " template for node type '" + nodeType + "'");
        this.nodeType = nodeType;
        this.target = target;
    }

    public String getNodeType() {
        return nodeType;
    }

    public TargetLanguage getTarget() {
        return target;
    }
}
