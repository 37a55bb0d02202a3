package com.wheelskills.progress.progress;

import com.wheelskills.progress.domain.DomainModels.ErrorRecord;
import com.wheelskills.progress.domain.DomainModels.SkillProgress;
import com.wheelskills.progress.domain.ErrorType;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.progress.ProgressModels.CommonError;
import com.wheelskills.progress.progress.ProgressModels.UserSkillStats;
import com.wheelskills.progress.progress.ProgressModels.WeakStep;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import com.wheelskills.progress.repository.UserJdbcRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Per-user views over the event log: stats on one skill, the errors the user repeats and
 * the steps where they happen.
 */
@Service
public class UserInsightsService {
    private final UserService userService;
    private final UserJdbcRepository users;
    private final EventLogJdbcRepository eventLog;

    public UserInsightsService(UserService userService, UserJdbcRepository users, EventLogJdbcRepository eventLog) {
        this.userService = userService;
        this.users = users;
        this.eventLog = eventLog;
    }

    @Transactional(readOnly = true)
    public UserSkillStats skillStats(String userId, String skillId) {
        userService.requireUser(userId);
        SkillProgress progress = users.findSkillProgress(userId, skillId)
                .orElseThrow(() -> new NotFoundException("No completed attempts of user " + userId + " on skill: " + skillId));
        List<ErrorRecord> errors = userErrors(userId, skillId);
        Map<Integer, Long> byStep = errors.stream()
                .collect(Collectors.groupingBy(ErrorRecord::stepNumber, TreeMap::new, Collectors.counting()));
        return new UserSkillStats(skillId, progress.attempts(), progress.successfulAttempts(), progress.successRate(),
                errors.size(), progress.lastAttempt(), byStep);
    }

    /**
     * The user's errors grouped by skill, step, type and action pair, most frequent first.
     * Groups with equal counts keep the order of their first occurrence.
     */
    @Transactional(readOnly = true)
    public List<CommonError> commonErrors(String userId, String skillId) {
        userService.requireUser(userId);
        return group(userErrors(userId, skillId));
    }

    @Transactional(readOnly = true)
    public List<WeakStep> weakSteps(String userId, String skillId) {
        userService.requireUser(userId);
        return userErrors(userId, skillId).stream()
                .collect(Collectors.groupingBy(ErrorRecord::stepNumber, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new WeakStep(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(WeakStep::errorCount).reversed()
                        .thenComparingInt(WeakStep::stepNumber))
                .toList();
    }

    static List<CommonError> group(List<ErrorRecord> errors) {
        Map<ErrorKey, Long> counts = new LinkedHashMap<>();
        for (ErrorRecord e : errors) {
            counts.merge(new ErrorKey(e.skillId(), e.stepNumber(), e.errorType(), e.expectedAction(), e.actualAction()),
                    1L, Long::sum);
        }
        // stable sort keeps first-occurrence order among equal counts
        return counts.entrySet().stream()
                .map(e -> new CommonError(e.getKey().skillId(), e.getKey().stepNumber(), e.getKey().errorType(),
                        e.getKey().expectedAction(), e.getKey().actualAction(), e.getValue()))
                .sorted(Comparator.comparingLong(CommonError::count).reversed())
                .toList();
    }

    private List<ErrorRecord> userErrors(String userId, String skillId) {
        List<ErrorRecord> errors = eventLog.snapshotForUser(userId).errors();
        if (skillId == null || skillId.isBlank()) return errors;
        return errors.stream().filter(e -> e.skillId().equals(skillId)).toList();
    }

    private record ErrorKey(String skillId, int stepNumber, ErrorType errorType, String expectedAction, String actualAction) {}
}
