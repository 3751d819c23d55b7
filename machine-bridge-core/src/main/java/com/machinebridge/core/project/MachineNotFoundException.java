package com.machinebridge.core.project;

/**
 * Thrown when a machine index does not address an extracted machine of a file.
 */
public class MachineNotFoundException extends IllegalArgumentException {

    private final String fileName;
    private final int machineIndex;

    public MachineNotFoundException(String fileName, int machineIndex) {
        super("Machine not found: " + fileName + " #" + machineIndex);
        this.fileName = fileName;
        this.machineIndex = machineIndex;
    }

    public String getFileName() {
        return fileName;
    }

    public int getMachineIndex() {
        return machineIndex;
    }
}
