package com.wheelskills.progress.analytics;

import com.wheelskills.progress.analytics.AnalyticsModels.ErrorTypeCount;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.StepErrorRate;
import com.wheelskills.progress.analytics.AnalyticsModels.WrongActionCount;
import com.wheelskills.progress.domain.DomainModels.Attempt;
import com.wheelskills.progress.domain.DomainModels.ErrorRecord;
import com.wheelskills.progress.domain.ErrorType;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import com.wheelskills.progress.repository.EventLogJdbcRepository.EventSnapshot;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Error and failure statistics of a single skill, recomputed from the event log on every
 * call.
 */
@Service
public class SkillStatsAggregator {
    static final int MAX_COMMON_ITEMS = 3;

    private static final Comparator<StepErrorRate> HARDEST_FIRST =
            Comparator.comparingLong(StepErrorRate::totalErrors).reversed()
                    .thenComparingInt(StepErrorRate::stepNumber);

    private final EventLogJdbcRepository eventLog;

    public SkillStatsAggregator(EventLogJdbcRepository eventLog) {
        this.eventLog = eventLog;
    }

    @Transactional(readOnly = true)
    public SkillErrorStats compute(String skillId) {
        EventSnapshot snapshot = eventLog.snapshotForSkill(skillId);
        if (snapshot.isEmpty()) {
            throw new NotFoundException("No attempts recorded for skill: " + skillId);
        }
        return summarize(skillId, snapshot.attempts(), snapshot.errors(), Instant.now());
    }

    /** Statistics of one step only; {@code NotFound} when the skill was never attempted. */
    @Transactional(readOnly = true)
    public StepErrorRate computeStep(String skillId, int stepNumber) {
        List<Attempt> attempts = eventLog.loadAttemptsBySkill(skillId);
        if (attempts.isEmpty()) {
            throw new NotFoundException("No attempts recorded for skill: " + skillId);
        }
        List<ErrorRecord> errors = EventSnapshot.of(attempts, eventLog.loadErrorsBySkillAndStep(skillId, stepNumber)).errors();
        return stepRate(stepNumber, errors, attempts.size());
    }

    @Transactional(readOnly = true)
    public double failureRate(String skillId) {
        return failureRate(eventLog.loadAttemptsBySkill(skillId));
    }

    static SkillErrorStats summarize(String skillId, List<Attempt> attempts, List<ErrorRecord> errors, Instant generatedAt) {
        int total = attempts.size();
        int failed = (int) attempts.stream().filter(Attempt::failed).count();

        Map<Integer, List<ErrorRecord>> byStep = errors.stream()
                .collect(Collectors.groupingBy(ErrorRecord::stepNumber, TreeMap::new, Collectors.toList()));
        List<StepErrorRate> rates = byStep.entrySet().stream()
                .map(e -> stepRate(e.getKey(), e.getValue(), total))
                .sorted(HARDEST_FIRST)
                .toList();

        return new SkillErrorStats(skillId, total, failed, failureRate(attempts), rates,
                rates.isEmpty() ? null : rates.get(0), generatedAt);
    }

    static double failureRate(List<Attempt> attempts) {
        if (attempts.isEmpty()) return 0.0;
        long failed = attempts.stream().filter(Attempt::failed).count();
        return (double) failed / attempts.size();
    }

    private static StepErrorRate stepRate(int stepNumber, List<ErrorRecord> errors, int totalAttempts) {
        List<ErrorTypeCount> types = errors.stream()
                .collect(Collectors.groupingBy(ErrorRecord::errorType, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new ErrorTypeCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(ErrorTypeCount::count).reversed()
                        .thenComparing(c -> c.type().code()))
                .limit(MAX_COMMON_ITEMS)
                .toList();

        List<WrongActionCount> actions = errors.stream()
                .collect(Collectors.groupingBy(e -> new ActionPair(e.expectedAction(), e.actualAction()), Collectors.counting()))
                .entrySet().stream()
                .map(e -> new WrongActionCount(e.getKey().expected(), e.getKey().actual(), e.getValue()))
                .sorted(Comparator.comparingLong(WrongActionCount::count).reversed()
                        .thenComparing(WrongActionCount::expected)
                        .thenComparing(WrongActionCount::actual))
                .limit(MAX_COMMON_ITEMS)
                .toList();

        double errorRate = totalAttempts == 0 ? 0.0 : (double) errors.size() / totalAttempts;
        return new StepErrorRate(stepNumber, errorRate, errors.size(), types, actions);
    }

    static ErrorType mostCommon(List<ErrorRecord> errors) {
        return errors.stream()
                .collect(Collectors.groupingBy(ErrorRecord::errorType, Collectors.counting()))
                .entrySet().stream()
                .min(Comparator.<Map.Entry<ErrorType, Long>>comparingLong(Map.Entry::getValue).reversed()
                        .thenComparing(e -> e.getKey().code()))
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private record ActionPair(String expected, String actual) {}
}
