package com.wheelskills.progress.recommendation;

import com.wheelskills.progress.domain.ErrorType;

import java.util.List;

public class RecommendationModels {
    public record RecommendedSkill(String skillId,
                                   String title,
                                   String level,
                                   int attempts,
                                   double successRate,
                                   int priority,
                                   String reason) {}

    public record FocusSkill(String skillId, long totalErrors, List<ErrorType> errorTypes) {}

    public record Recommendation(List<RecommendedSkill> recommendedSkills,
                                 List<FocusSkill> focusSkills,
                                 List<String> sessionGoals,
                                 List<String> notes) {}
}
