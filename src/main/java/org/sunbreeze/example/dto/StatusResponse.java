package org.sunbreeze.example.dto;

public record StatusResponse(String name, String version, boolean debug) {
}
