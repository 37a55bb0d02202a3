package com.wheelskills.progress.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;

public class DomainModels {
    public record Skill(String skillId, String title, String level, List<SkillStep> steps) {}

    public record SkillStep(int stepNumber, String expectedAction) {}

    public record User(String userId, TrainingPhase currentPhase, Instant createdAt, Instant updatedAt) {}

    public record TrainingSession(String sessionId, String userId, Instant startedAt) {}

    public record Attempt(String attemptId,
                          String userId,
                          String skillId,
                          String sessionId,
                          AttemptStatus status,
                          Boolean success,
                          Instant startTime,
                          Instant endTime) {
        public boolean completed() {
            return status == AttemptStatus.COMPLETED;
        }

        public boolean failed() {
            return completed() && Boolean.FALSE.equals(success);
        }

        public boolean succeeded() {
            return completed() && Boolean.TRUE.equals(success);
        }
    }

    public record StepRecord(String attemptId,
                             String userId,
                             String skillId,
                             int stepNumber,
                             String expectedInput,
                             String actualInput,
                             boolean correct,
                             Instant timestamp) {}

    public record ErrorRecord(String attemptId,
                              String userId,
                              String skillId,
                              int stepNumber,
                              ErrorType errorType,
                              String expectedAction,
                              String actualAction,
                              Instant timestamp) {}

    public record SkillProgress(String skillId,
                                int attempts,
                                int successfulAttempts,
                                double successRate,
                                Instant lastAttempt) {}

    public enum Severity {
        LOW, MEDIUM, HIGH, CRITICAL;

        @JsonValue
        public String code() {
            return name().toLowerCase();
        }
    }
}
