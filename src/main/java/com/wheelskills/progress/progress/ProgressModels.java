package com.wheelskills.progress.progress;

import com.wheelskills.progress.domain.DomainModels.SkillProgress;
import com.wheelskills.progress.domain.ErrorType;
import com.wheelskills.progress.domain.TrainingPhase;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ProgressModels {
    public record UserProgress(String userId,
                               TrainingPhase currentPhase,
                               Instant createdAt,
                               Instant updatedAt,
                               Map<String, SkillProgress> skillProgress,
                               List<String> attempts,
                               List<String> sessions) {}

    public record UserSkillStats(String skillId,
                                 int attempts,
                                 int successfulAttempts,
                                 double successRate,
                                 long totalErrors,
                                 Instant lastAttempt,
                                 Map<Integer, Long> errorByStep) {}

    public record CommonError(String skillId,
                              int stepNumber,
                              ErrorType errorType,
                              String expectedAction,
                              String actualAction,
                              long count) {}

    public record WeakStep(int stepNumber, long errorCount) {}
}
