package org.sunbreeze.exception;

public class InvalidRoutePatternException extends IllegalArgumentException {

    private final String pattern;

    public InvalidRoutePatternException(String pattern, String reason) {
        super("Invalid route pattern '" + pattern + "': " + reason);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }

}
