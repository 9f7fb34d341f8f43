package com.vidnyan.flowc.application.emit;

import com.vidnyan.flowc.domain.codegen.TargetLanguage;

import java.util.List;

/**
 * Final output of a run: the source text, the optional smoke test and the manifests.
 */
public record EmittedProgram(
    TargetLanguage target,
    String source,
    String testSource,                 // null unless tests were requested
    List<String> dependencies,         // sorted
    List<String> devDependencies,      // sorted, packages the test source needs
    List<String> exportedNames
) {

    public EmittedProgram {
        dependencies = List.copyOf(dependencies);
        devDependencies = List.copyOf(devDependencies);
        exportedNames = List.copyOf(exportedNames);
    }

    public boolean hasTests() {
        return testSource != null;
    }

    public String sourceFileName() {
        return "index." + target.fileExtension();
    }

    public String testFileName() {
        return target.isScript()
                ? "index.test." + target.fileExtension()
                : "test_index.py";
    }
}
