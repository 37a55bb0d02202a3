package com.wheelskills.progress.progress;

import com.wheelskills.progress.catalog.SkillCatalogService;
import com.wheelskills.progress.domain.DomainModels.SkillProgress;
import com.wheelskills.progress.domain.DomainModels.TrainingSession;
import com.wheelskills.progress.domain.DomainModels.User;
import com.wheelskills.progress.domain.TrainingPhase;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.progress.ProgressModels.UserProgress;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import com.wheelskills.progress.repository.UserJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserJdbcRepository users;
    private final EventLogJdbcRepository eventLog;
    private final SkillCatalogService catalog;
    private final PhaseEvaluator phaseEvaluator;

    public UserService(UserJdbcRepository users,
                       EventLogJdbcRepository eventLog,
                       SkillCatalogService catalog,
                       PhaseEvaluator phaseEvaluator) {
        this.users = users;
        this.eventLog = eventLog;
        this.catalog = catalog;
        this.phaseEvaluator = phaseEvaluator;
    }

    /** Registers the user; an existing user is returned unchanged. */
    public User createUser(String userId) {
        var existing = users.findUser(userId);
        if (existing.isPresent()) return existing.get();

        User user = new User(userId, TrainingPhase.FOUNDATION, Instant.now(), null);
        try {
            users.insertUser(user);
            log.info("Registered user {}", userId);
            return user;
        } catch (DataIntegrityViolationException e) {
            // Registered concurrently by another request.
            return users.findUser(userId).orElseThrow(() -> e);
        }
    }

    public User requireUser(String userId) {
        return users.findUser(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }

    public TrainingSession openSession(String userId) {
        requireUser(userId);
        TrainingSession session = new TrainingSession("ses_" + UUID.randomUUID(), userId, Instant.now());
        users.insertSession(session);
        log.info("Opened training session {} for user {}", session.sessionId(), userId);
        return session;
    }

    public TrainingSession requireSession(String userId, String sessionId) {
        return users.findSession(sessionId)
                .filter(s -> s.userId().equals(userId))
                .orElseThrow(() -> new NotFoundException("Training session not found for user " + userId + ": " + sessionId));
    }

    @Transactional(readOnly = true)
    public UserProgress progress(String userId) {
        User user = requireUser(userId);
        Map<String, SkillProgress> skillProgress = users.loadSkillProgress(userId).stream()
                .collect(Collectors.toMap(SkillProgress::skillId, Function.identity(), (a, b) -> b, LinkedHashMap::new));
        List<String> attemptIds = eventLog.loadAttemptsByUser(userId).stream()
                .map(a -> a.attemptId())
                .toList();
        return new UserProgress(user.userId(), user.currentPhase(), user.createdAt(), user.updatedAt(),
                skillProgress, attemptIds, users.loadSessionIds(userId));
    }

    /**
     * Folds one completed attempt into the user's skill progress and re-evaluates the
     * training phase. Must run in the transaction that completes the attempt.
     */
    public SkillProgress recordCompletion(String userId, String skillId, boolean success, Instant endTime) {
        SkillProgress previous = users.findSkillProgress(userId, skillId)
                .orElse(new SkillProgress(skillId, 0, 0, 0.0, null));
        int attempts = previous.attempts() + 1;
        int successful = previous.successfulAttempts() + (success ? 1 : 0);
        SkillProgress updated = new SkillProgress(skillId, attempts, successful, (double) successful / attempts, endTime);
        users.upsertSkillProgress(userId, updated);
        users.touch(userId, endTime);
        updatePhase(userId);
        return updated;
    }

    public TrainingPhase updatePhase(String userId) {
        User user = requireUser(userId);
        Map<String, SkillProgress> progress = users.loadSkillProgress(userId).stream()
                .collect(Collectors.toMap(SkillProgress::skillId, Function.identity()));
        TrainingPhase next = phaseEvaluator.evaluate(user.currentPhase(), progress, catalog.listSkills());
        if (next != user.currentPhase()) {
            users.updatePhase(userId, next, Instant.now());
            log.info("User {} advanced from {} to {}", userId, user.currentPhase().label(), next.label());
        }
        return next;
    }
}
