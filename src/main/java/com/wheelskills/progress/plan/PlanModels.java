package com.wheelskills.progress.plan;

import com.wheelskills.progress.analytics.AnalyticsModels.ActionConfusion;
import com.wheelskills.progress.analytics.AnalyticsModels.ProblematicStep;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillComparison;
import com.wheelskills.progress.domain.TrainingPhase;
import com.wheelskills.progress.progress.ProgressModels.CommonError;
import com.wheelskills.progress.recommendation.RecommendationModels.FocusSkill;
import com.wheelskills.progress.recommendation.RecommendationModels.RecommendedSkill;

import java.time.Instant;
import java.util.List;

public class PlanModels {
    public record TrainingPlan(String userId,
                               TrainingPhase currentPhase,
                               Instant generatedAt,
                               List<RecommendedSkill> recommendedSkills,
                               List<FocusSkill> focusSkills,
                               List<String> sessionGoals,
                               List<String> notes,
                               GlobalInsights globalInsights,
                               List<CommonError> yourCommonErrors,
                               List<SkillComparison> skillComparisons) {}

    public record GlobalInsights(List<String> mostFailedSkills,
                                 List<ActionConfusion> commonMistakes,
                                 List<ProblematicStep> problematicSteps) {
        static GlobalInsights empty() {
            return new GlobalInsights(List.of(), List.of(), List.of());
        }
    }
}
