package com.wheelskills.progress.analytics;

import com.wheelskills.progress.analytics.AnalyticsModels.ActionConfusion;
import com.wheelskills.progress.analytics.AnalyticsModels.GlobalErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.ProblematicStep;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillSummary;
import com.wheelskills.progress.domain.DomainModels.Attempt;
import com.wheelskills.progress.domain.DomainModels.ErrorRecord;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import com.wheelskills.progress.repository.EventLogJdbcRepository.EventSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * System-wide error analytics over every recorded attempt. An empty log yields zeroed
 * statistics, never an error.
 */
@Service
public class GlobalAnalyticsEngine {
    private static final Logger log = LoggerFactory.getLogger(GlobalAnalyticsEngine.class);

    static final int MAX_PROBLEMATIC_STEPS = 20;
    static final int MAX_ACTION_CONFUSIONS = 20;

    private final EventLogJdbcRepository eventLog;

    public GlobalAnalyticsEngine(EventLogJdbcRepository eventLog) {
        this.eventLog = eventLog;
    }

    @Transactional(readOnly = true)
    public GlobalErrorStats computeGlobal() {
        EventSnapshot snapshot = eventLog.snapshot();
        Instant now = Instant.now();
        GlobalErrorStats stats = new GlobalErrorStats(
                snapshot.attempts().size(),
                (int) snapshot.attempts().stream().map(Attempt::userId).distinct().count(),
                skillSummary(snapshot, now),
                problematicSteps(snapshot.errors()),
                actionConfusion(snapshot.errors()),
                now);
        log.debug("Global analytics: attempts={}, users={}, skills={}",
                stats.totalAttempts(), stats.totalUsers(), stats.skillSummary().size());
        return stats;
    }

    private static List<SkillSummary> skillSummary(EventSnapshot snapshot, Instant now) {
        Map<String, List<Attempt>> attemptsBySkill = snapshot.attempts().stream()
                .collect(Collectors.groupingBy(Attempt::skillId, TreeMap::new, Collectors.toList()));
        Map<String, List<ErrorRecord>> errorsBySkill = snapshot.errors().stream()
                .collect(Collectors.groupingBy(ErrorRecord::skillId));

        return attemptsBySkill.entrySet().stream()
                .map(e -> {
                    SkillErrorStats s = SkillStatsAggregator.summarize(e.getKey(), e.getValue(),
                            errorsBySkill.getOrDefault(e.getKey(), List.of()), now);
                    return new SkillSummary(s.skillId(), s.totalAttempts(), s.failedAttempts(), s.failureRate(),
                            s.totalErrors(),
                            s.mostDifficultStep() == null ? null : s.mostDifficultStep().stepNumber());
                })
                .sorted(Comparator.comparingDouble(SkillSummary::failureRate).reversed()
                        .thenComparing(SkillSummary::skillId))
                .toList();
    }

    private List<ProblematicStep> problematicSteps(List<ErrorRecord> errors) {
        return errors.stream()
                .collect(Collectors.groupingBy(e -> new StepKey(e.skillId(), e.stepNumber())))
                .entrySet().stream()
                .map(e -> new ProblematicStep(e.getKey().skillId(), e.getKey().stepNumber(),
                        e.getValue().size(), SkillStatsAggregator.mostCommon(e.getValue())))
                .sorted(Comparator.comparingLong(ProblematicStep::errorCount).reversed()
                        .thenComparing(ProblematicStep::skillId)
                        .thenComparingInt(ProblematicStep::stepNumber))
                .limit(MAX_PROBLEMATIC_STEPS)
                .toList();
    }

    /**
     * Systematic substitutions: how often users perform one action where another was
     * expected. Records without both actions, or where they coincide, say nothing about a
     * substitution and are skipped.
     */
    private List<ActionConfusion> actionConfusion(List<ErrorRecord> errors) {
        return errors.stream()
                .filter(e -> !isBlank(e.expectedAction()) && !isBlank(e.actualAction()))
                .filter(e -> !e.expectedAction().equals(e.actualAction()))
                .collect(Collectors.groupingBy(e -> new ActionKey(e.expectedAction(), e.actualAction()), Collectors.counting()))
                .entrySet().stream()
                .map(e -> new ActionConfusion(e.getKey().expected(), e.getKey().actual(), e.getValue(),
                        "Users press " + e.getKey().actual() + " instead of " + e.getKey().expected()))
                .sorted(Comparator.comparingLong(ActionConfusion::count).reversed()
                        .thenComparing(ActionConfusion::expected)
                        .thenComparing(ActionConfusion::actual))
                .limit(MAX_ACTION_CONFUSIONS)
                .toList();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private record StepKey(String skillId, int stepNumber) {}
    private record ActionKey(String expected, String actual) {}
}
