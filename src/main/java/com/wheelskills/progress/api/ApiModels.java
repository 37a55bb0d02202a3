package com.wheelskills.progress.api;

import java.time.Instant;

public class ApiModels {
    public record Ack(boolean success, String message) {}

    public record ApiError(String error, String message, Instant timestamp) {}
}
