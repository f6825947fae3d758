package org.sunbreeze.exception;

public class ProcessTerminationException extends RuntimeException {

    public ProcessTerminationException(String message) {
        super(message);
    }

    public ProcessTerminationException(String message, Throwable cause) {
        super(message, cause);
    }

}
