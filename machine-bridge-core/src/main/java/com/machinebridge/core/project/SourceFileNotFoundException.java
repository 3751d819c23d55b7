package com.machinebridge.core.project;

/**
 * Thrown when the current program does not contain a parsed file of the requested name.
 */
public class SourceFileNotFoundException extends IllegalArgumentException {

    private final String fileName;

    public SourceFileNotFoundException(String fileName) {
        super("File not found: " + fileName);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
