package com.machinebridge.core.ast;

import java.util.Optional;

/**
 * Snapshot of the parsed source files a project works against.
 *
 * <p>A program is replaced, never mutated, when the host reparses: callers hand a new instance to
 * {@link com.machinebridge.core.project.MachineProject#updateProgram(SourceProgram)}.
 */
public interface SourceProgram {

    /**
     * Returns the parsed file registered under the given name.
     *
     * @param fileName file name as known to the program
     * @return parsed file, or empty if the program does not contain it
     */
    Optional<SourceFile> getSourceFile(String fileName);
}
