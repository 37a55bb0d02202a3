package com.wheelskills.progress.tracking;

import com.wheelskills.progress.domain.AttemptStatus;
import com.wheelskills.progress.domain.DomainModels.ErrorRecord;
import com.wheelskills.progress.domain.DomainModels.SkillStep;
import com.wheelskills.progress.domain.DomainModels.StepRecord;

import java.time.Instant;
import java.util.List;

public class TrackingModels {
    public record StartedAttempt(String attemptId, String skillId, String sessionId, List<SkillStep> skillSteps) {}

    public record AttemptView(String attemptId,
                              String userId,
                              String skillId,
                              String sessionId,
                              AttemptStatus status,
                              Boolean success,
                              Instant startTime,
                              Instant endTime,
                              List<StepRecord> stepInputs,
                              List<ErrorRecord> stepErrors) {}
}
