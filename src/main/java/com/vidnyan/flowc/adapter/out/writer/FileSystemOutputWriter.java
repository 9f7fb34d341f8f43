package com.vidnyan.flowc.adapter.out.writer;

import com.vidnyan.flowc.application.emit.EmittedProgram;
import com.vidnyan.flowc.application.port.out.OutputWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a generated program as a small project tree:
 * {@code src/index.<ext>}, the optional smoke test, and plain-text dependency lists.
 */
@Slf4j
@Component
public class FileSystemOutputWriter implements OutputWriter {

    static final String DEPENDENCIES_FILE = "dependencies.txt";
    static final String DEV_DEPENDENCIES_FILE = "dev-dependencies.txt";

    @Override
    public List<Path> write(EmittedProgram program, Path outputDirectory, boolean overwrite) {
        List<Path> written = new ArrayList<>();
        Path sourceDir = outputDirectory.resolve("src");

        written.add(writeFile(sourceDir.resolve(program.sourceFileName()), program.source(), overwrite));
        if (program.hasTests()) {
            written.add(writeFile(sourceDir.resolve(program.testFileName()), program.testSource(), overwrite));
        }
        written.add(writeFile(outputDirectory.resolve(DEPENDENCIES_FILE), lines(program.dependencies()), overwrite));
        if (!program.devDependencies().isEmpty()) {
            written.add(writeFile(outputDirectory.resolve(DEV_DEPENDENCIES_FILE),
                    lines(program.devDependencies()), overwrite));
        }

        log.info("Wrote {} files to {}", written.size(), outputDirectory);
        return written;
    }

    private Path writeFile(Path target, String content, boolean overwrite) {
        if (Files.exists(target) && !overwrite) {
            throw new OutputWriteException("Refusing to overwrite existing file: " + target);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
            log.debug("  wrote {}", target);
            return target;
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private static String lines(List<String> values) {
        return values.isEmpty() ? "" : String.join("\n", values) + "\n";
    }
}
