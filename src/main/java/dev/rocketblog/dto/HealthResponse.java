package dev.rocketblog.dto;

public record HealthResponse(boolean success, String message) {

    public static HealthResponse ok() {
        return new HealthResponse(true, "ok");
    }
}
