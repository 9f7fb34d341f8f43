package com.vidnyan.flowc.domain.codegen;

import java.util.Locale;

/**
 * Output language families.
 */
public enum TargetLanguage {
    TYPESCRIPT("typescript", "ts"),
    JAVASCRIPT("javascript", "js"),
    PYTHON("python", "py");

    private final String tag;
    private final String fileExtension;

    TargetLanguage(String tag, String fileExtension) {
        this.tag = tag;
        this.fileExtension = fileExtension;
    }

    public String tag() {
        return tag;
    }

    public String fileExtension() {
        return fileExtension;
    }

    /**
     * True for the JavaScript family that shares one code template set.
     */
    public boolean isScript() {
        return this != PYTHON;
    }

    public static TargetLanguage fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return TYPESCRIPT;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (TargetLanguage language : values()) {
            if (language.tag.equals(normalized) || language.fileExtension.equals(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown target language: " + tag);
    }
}
