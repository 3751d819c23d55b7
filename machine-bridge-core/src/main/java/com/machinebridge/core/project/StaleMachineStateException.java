package com.machinebridge.core.project;

/**
 * Thrown when patches target a machine whose file changed since its last extraction.
 */
public class StaleMachineStateException extends IllegalStateException {

    public StaleMachineStateException(String fileName, int machineIndex) {
        super("Source of machine " + fileName + " #" + machineIndex
            + " changed since it was extracted; extract it again before patching");
    }
}
