package org.sunbreeze.exception;

import java.util.Set;

public class MethodNotAllowedException extends RuntimeException {

    public static final String MESSAGE = "Method Not Allowed";

    private final String method;
    private final Set<String> allowed;

    public MethodNotAllowedException(String method, Set<String> allowed) {
        super(MESSAGE + ": " + method + " (allowed: " + allowed + ")");
        this.method = method;
        this.allowed = Set.copyOf(allowed);
    }

    public String getMethod() {
        return method;
    }

    public Set<String> getAllowed() {
        return allowed;
    }

}
