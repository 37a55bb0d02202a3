package com.wheelskills.progress.analytics;

import com.fasterxml.jackson.annotation.JsonValue;
import com.wheelskills.progress.domain.ErrorType;

import java.time.Instant;
import java.util.List;

public class AnalyticsModels {
    public record SkillErrorStats(String skillId,
                                  int totalAttempts,
                                  int failedAttempts,
                                  double failureRate,
                                  List<StepErrorRate> stepErrorRates,
                                  StepErrorRate mostDifficultStep,
                                  Instant generatedAt) {
        public long totalErrors() {
            return stepErrorRates.stream().mapToLong(StepErrorRate::totalErrors).sum();
        }
    }

    public record StepErrorRate(int stepNumber,
                                double errorRate,
                                long totalErrors,
                                List<ErrorTypeCount> commonErrorTypes,
                                List<WrongActionCount> commonWrongActions) {}

    public record ErrorTypeCount(ErrorType type, long count) {}

    public record WrongActionCount(String expected, String actual, long count) {}

    public record GlobalErrorStats(int totalAttempts,
                                   int totalUsers,
                                   List<SkillSummary> skillSummary,
                                   List<ProblematicStep> problematicSteps,
                                   List<ActionConfusion> actionConfusion,
                                   Instant generatedAt) {}

    public record SkillSummary(String skillId,
                               int totalAttempts,
                               int failedAttempts,
                               double failureRate,
                               long totalErrors,
                               Integer mostProblematicStep) {}

    public record ProblematicStep(String skillId, int stepNumber, long errorCount, ErrorType mostCommonError) {}

    public record ActionConfusion(String expected, String actual, long count, String description) {}

    public record SkillComparison(String skillId,
                                  double yourSuccessRate,
                                  double globalSuccessRate,
                                  Comparison comparison) {}

    public enum Comparison {
        ABOVE_AVERAGE, AVERAGE, BELOW_AVERAGE;

        @JsonValue
        public String code() {
            return name().toLowerCase();
        }
    }
}
