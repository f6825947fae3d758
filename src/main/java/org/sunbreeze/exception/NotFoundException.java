package org.sunbreeze.exception;

public class NotFoundException extends RuntimeException {

    public static final String MESSAGE = "Not Found";

    private final String path;

    public NotFoundException(String path) {
        super(MESSAGE + ": " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

}
