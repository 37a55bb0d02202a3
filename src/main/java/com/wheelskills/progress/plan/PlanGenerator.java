package com.wheelskills.progress.plan;

import com.wheelskills.progress.analytics.AnalyticsModels.GlobalErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillComparison;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillSummary;
import com.wheelskills.progress.analytics.ComparisonEngine;
import com.wheelskills.progress.analytics.GlobalAnalyticsEngine;
import com.wheelskills.progress.domain.DomainModels.User;
import com.wheelskills.progress.plan.PlanModels.GlobalInsights;
import com.wheelskills.progress.plan.PlanModels.TrainingPlan;
import com.wheelskills.progress.progress.ProgressModels.CommonError;
import com.wheelskills.progress.progress.UserInsightsService;
import com.wheelskills.progress.progress.UserService;
import com.wheelskills.progress.recommendation.RecommendationModels.Recommendation;
import com.wheelskills.progress.recommendation.RecommendationService;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Builds a personalised training plan: the recommendation block plus what the user can
 * learn from everybody else's mistakes and from their own.
 */
@Service
public class PlanGenerator {
    private static final Logger log = LoggerFactory.getLogger(PlanGenerator.class);

    static final int MAX_FAILED_SKILLS = 3;
    static final int MAX_COMMON_MISTAKES = 5;
    static final int MAX_PROBLEMATIC_STEPS = 5;
    static final int MAX_YOUR_ERRORS = 10;

    private final UserService userService;
    private final UserInsightsService insights;
    private final RecommendationService recommender;
    private final GlobalAnalyticsEngine globalEngine;
    private final ComparisonEngine comparisonEngine;
    private final EventLogJdbcRepository eventLog;

    public PlanGenerator(UserService userService,
                         UserInsightsService insights,
                         RecommendationService recommender,
                         GlobalAnalyticsEngine globalEngine,
                         ComparisonEngine comparisonEngine,
                         EventLogJdbcRepository eventLog) {
        this.userService = userService;
        this.insights = insights;
        this.recommender = recommender;
        this.globalEngine = globalEngine;
        this.comparisonEngine = comparisonEngine;
        this.eventLog = eventLog;
    }

    @Transactional(readOnly = true)
    public TrainingPlan generatePlan(String userId) {
        User user = userService.requireUser(userId);
        List<CommonError> commonErrors = insights.commonErrors(userId, null);
        Recommendation rec = recommender.recommend(userId, commonErrors);

        if (eventLog.loadAttemptsByUser(userId).isEmpty()) {
            log.debug("No attempts recorded for user {}, plan carries recommendations only", userId);
            return plan(user, rec, GlobalInsights.empty(), List.of(), List.of());
        }

        GlobalErrorStats global = globalEngine.computeGlobal();
        GlobalInsights globalInsights = new GlobalInsights(
                global.skillSummary().stream().limit(MAX_FAILED_SKILLS).map(SkillSummary::skillId).toList(),
                global.actionConfusion().stream().limit(MAX_COMMON_MISTAKES).toList(),
                global.problematicSteps().stream().limit(MAX_PROBLEMATIC_STEPS).toList());

        TrainingPlan plan = plan(user, rec, globalInsights,
                commonErrors.stream().limit(MAX_YOUR_ERRORS).toList(),
                comparisonEngine.compare(userId, global));
        log.info("Generated training plan for user {}: {} recommended, {} comparisons",
                userId, plan.recommendedSkills().size(), plan.skillComparisons().size());
        return plan;
    }

    private static TrainingPlan plan(User user, Recommendation rec, GlobalInsights globalInsights,
                                     List<CommonError> yourErrors, List<SkillComparison> comparisons) {
        return new TrainingPlan(user.userId(), user.currentPhase(), Instant.now(),
                rec.recommendedSkills(), rec.focusSkills(), rec.sessionGoals(), rec.notes(),
                globalInsights, yourErrors, comparisons);
    }
}
