package com.phillippitts.callbridge.exception;

/**
 * Thrown when a configuration data file exists but cannot be read or parsed.
 */
public class ConfigDataException extends CallBridgeException {

    private final String fileName;

    public ConfigDataException(String fileName, Throwable cause) {
        super("Failed to load config data file: " + fileName, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
