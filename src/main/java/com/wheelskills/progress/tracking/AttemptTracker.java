package com.wheelskills.progress.tracking;

import com.wheelskills.progress.catalog.SkillCatalogService;
import com.wheelskills.progress.domain.AttemptStatus;
import com.wheelskills.progress.domain.DomainModels.Attempt;
import com.wheelskills.progress.domain.DomainModels.ErrorRecord;
import com.wheelskills.progress.domain.DomainModels.Skill;
import com.wheelskills.progress.domain.DomainModels.StepRecord;
import com.wheelskills.progress.domain.ErrorType;
import com.wheelskills.progress.error.InvalidStateException;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.error.ValidationException;
import com.wheelskills.progress.progress.UserService;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import com.wheelskills.progress.tracking.TrackingModels.AttemptView;
import com.wheelskills.progress.tracking.TrackingModels.StartedAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Drives attempts through IN_PROGRESS to COMPLETED and appends their observations to the
 * event log. All writes to one attempt are serialized through {@link AttemptLocks}, and the
 * lock is held until the completing transaction has committed.
 */
@Service
public class AttemptTracker {
    private static final Logger log = LoggerFactory.getLogger(AttemptTracker.class);

    private final EventLogJdbcRepository eventLog;
    private final SkillCatalogService catalog;
    private final UserService userService;
    private final AttemptLocks locks;
    private final TransactionTemplate transactionTemplate;

    public AttemptTracker(EventLogJdbcRepository eventLog,
                          SkillCatalogService catalog,
                          UserService userService,
                          AttemptLocks locks,
                          TransactionTemplate transactionTemplate) {
        this.eventLog = eventLog;
        this.catalog = catalog;
        this.userService = userService;
        this.locks = locks;
        this.transactionTemplate = transactionTemplate;
    }

    public StartedAttempt startAttempt(String userId, String skillId, String sessionId) {
        Skill skill = catalog.requireSkill(skillId);
        userService.requireUser(userId);
        String session = (sessionId == null || sessionId.isBlank()) ? null : sessionId;
        if (session != null) {
            userService.requireSession(userId, session);
        }

        String attemptId = "att_" + UUID.randomUUID();
        eventLog.insertAttempt(new Attempt(attemptId, userId, skillId, session,
                AttemptStatus.IN_PROGRESS, null, Instant.now(), null));
        log.info("Started attempt {} for user {} on skill {}", attemptId, userId, skillId);
        return new StartedAttempt(attemptId, skillId, session, skill.steps());
    }

    public StepRecord recordInput(String attemptId, Integer stepNumber, String expectedInput, String actualInput, Instant timestamp) {
        return locks.withLock(attemptId, () -> {
            Attempt attempt = requireOpen(attemptId);
            int step = requireStepNumber(stepNumber);
            String expected = requireText(expectedInput, "expected_input");
            String actual = requireText(actualInput, "actual_input");

            StepRecord record = new StepRecord(attemptId, attempt.userId(), attempt.skillId(), step,
                    expected, actual, Objects.equals(expected, actual), timestamp == null ? Instant.now() : timestamp);
            eventLog.appendStep(record);
            log.debug("Attempt {} step {} input expected={} actual={}", attemptId, step, expected, actual);
            return record;
        });
    }

    public ErrorRecord recordError(String attemptId, Integer stepNumber, String errorType, String expectedAction, String actualAction) {
        return locks.withLock(attemptId, () -> {
            Attempt attempt = requireOpen(attemptId);
            int step = requireStepNumber(stepNumber);
            ErrorType type = ErrorType.fromCode(errorType);

            ErrorRecord record = new ErrorRecord(attemptId, attempt.userId(), attempt.skillId(), step, type,
                    requireText(expectedAction, "expected_action"), requireText(actualAction, "actual_action"), Instant.now());
            eventLog.appendError(record);
            log.debug("Attempt {} step {} error {}", attemptId, step, type.code());
            return record;
        });
    }

    public Attempt complete(String attemptId, Boolean success) {
        if (success == null) {
            throw new ValidationException("success is required");
        }
        return locks.withLock(attemptId, () -> {
            Attempt attempt = requireAttempt(attemptId);
            AttemptStatus next = attempt.status().transitionTo(AttemptStatus.COMPLETED);
            Instant endTime = Instant.now();

            transactionTemplate.executeWithoutResult(tx -> {
                if (!eventLog.completeAttempt(attemptId, success, endTime)) {
                    throw new InvalidStateException("Attempt already completed: " + attemptId);
                }
                userService.recordCompletion(attempt.userId(), attempt.skillId(), success, endTime);
            });
            locks.release(attemptId);
            log.info("Completed attempt {} for user {} on skill {} success={}",
                    attemptId, attempt.userId(), attempt.skillId(), success);
            return new Attempt(attemptId, attempt.userId(), attempt.skillId(), attempt.sessionId(),
                    next, success, attempt.startTime(), endTime);
        });
    }

    public AttemptView attempt(String attemptId) {
        Attempt a = requireAttempt(attemptId);
        return new AttemptView(a.attemptId(), a.userId(), a.skillId(), a.sessionId(), a.status(), a.success(),
                a.startTime(), a.endTime(), eventLog.loadStepsByAttempt(attemptId), eventLog.loadErrorsByAttempt(attemptId));
    }

    private Attempt requireAttempt(String attemptId) {
        return eventLog.findAttempt(attemptId)
                .orElseThrow(() -> new NotFoundException("Attempt not found: " + attemptId));
    }

    private Attempt requireOpen(String attemptId) {
        Attempt attempt = requireAttempt(attemptId);
        if (!attempt.status().acceptsRecords()) {
            log.warn("Rejected write to completed attempt {}", attemptId);
            throw new InvalidStateException("Attempt already completed: " + attemptId);
        }
        return attempt;
    }

    private static int requireStepNumber(Integer stepNumber) {
        if (stepNumber == null || stepNumber < 1) {
            throw new ValidationException("step_number must be a positive integer, got " + stepNumber);
        }
        return stepNumber;
    }

    private static String requireText(String value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }
}
