package com.wheelskills.progress.analytics;

import com.wheelskills.progress.analytics.AnalyticsModels.Comparison;
import com.wheelskills.progress.analytics.AnalyticsModels.GlobalErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillComparison;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillSummary;
import com.wheelskills.progress.domain.DomainModels.Attempt;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Compares a user's success rate on each skill with the success rate of all users.
 * Only skills with at least one completed attempt by the user are compared.
 */
@Service
public class ComparisonEngine {
    static final double MARGIN = 0.05;
    private static final double EPSILON = 1e-9;

    private final EventLogJdbcRepository eventLog;
    private final SkillStatsAggregator aggregator;

    public ComparisonEngine(EventLogJdbcRepository eventLog, SkillStatsAggregator aggregator) {
        this.eventLog = eventLog;
        this.aggregator = aggregator;
    }

    @Transactional(readOnly = true)
    public List<SkillComparison> compare(String userId) {
        return compareWith(userId, aggregator::failureRate);
    }

    /** Same as {@link #compare(String)} but takes global failure rates from an already computed summary. */
    @Transactional(readOnly = true)
    public List<SkillComparison> compare(String userId, GlobalErrorStats global) {
        Map<String, Double> failureRates = global.skillSummary().stream()
                .collect(Collectors.toMap(SkillSummary::skillId, SkillSummary::failureRate));
        return compareWith(userId, skillId -> failureRates.getOrDefault(skillId, 0.0));
    }

    private List<SkillComparison> compareWith(String userId, ToDoubleFunction<String> failureRate) {
        Map<String, List<Attempt>> completedBySkill = eventLog.loadAttemptsByUser(userId).stream()
                .filter(Attempt::completed)
                .collect(Collectors.groupingBy(Attempt::skillId, TreeMap::new, Collectors.toList()));

        return completedBySkill.entrySet().stream()
                .map(e -> {
                    long ok = e.getValue().stream().filter(Attempt::succeeded).count();
                    double yours = (double) ok / e.getValue().size();
                    double global = 1.0 - failureRate.applyAsDouble(e.getKey());
                    return new SkillComparison(e.getKey(), yours, global, classify(yours, global));
                })
                .toList();
    }

    /** A difference of exactly the margin counts as average. */
    public static Comparison classify(double yourRate, double globalRate) {
        double diff = yourRate - globalRate;
        if (diff > MARGIN + EPSILON) return Comparison.ABOVE_AVERAGE;
        if (diff < -MARGIN - EPSILON) return Comparison.BELOW_AVERAGE;
        return Comparison.AVERAGE;
    }
}
