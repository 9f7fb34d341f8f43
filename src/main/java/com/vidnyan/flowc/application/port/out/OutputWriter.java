package com.vidnyan.flowc.application.port.out;

import com.vidnyan.flowc.application.emit.EmittedProgram;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for persisting generated programs.
 */
public interface OutputWriter {

    /**
     * Write the program below the output directory.
     * @return paths of the written files
     */
    List<Path> write(EmittedProgram program, Path outputDirectory, boolean overwrite);
}
