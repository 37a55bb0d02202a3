package com.wheelskills.progress.recommendation;

import com.wheelskills.progress.catalog.SkillCatalogService;
import com.wheelskills.progress.domain.DomainModels.Skill;
import com.wheelskills.progress.domain.DomainModels.SkillProgress;
import com.wheelskills.progress.domain.DomainModels.User;
import com.wheelskills.progress.domain.TrainingPhase;
import com.wheelskills.progress.progress.ProgressModels.CommonError;
import com.wheelskills.progress.progress.UserService;
import com.wheelskills.progress.recommendation.RecommendationModels.FocusSkill;
import com.wheelskills.progress.recommendation.RecommendationModels.Recommendation;
import com.wheelskills.progress.recommendation.RecommendationModels.RecommendedSkill;
import com.wheelskills.progress.repository.UserJdbcRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Picks the skills of the user's current phase that most need practice and turns the
 * user's frequent errors into focus areas.
 */
@Service
public class RecommendationService {
    static final int FOCUS_SOURCE_ERRORS = 10;
    static final int MAX_FOCUS_SKILLS = 3;

    private final UserService userService;
    private final UserJdbcRepository users;
    private final SkillCatalogService catalog;
    private final int maxRecommended;
    private final double lowSuccessThreshold;
    private final double improvableThreshold;

    public RecommendationService(UserService userService,
                                 UserJdbcRepository users,
                                 SkillCatalogService catalog,
                                 @Value("${progress.recommendation.max-recommended:5}") int maxRecommended,
                                 @Value("${progress.recommendation.low-success-threshold:0.5}") double lowSuccessThreshold,
                                 @Value("${progress.recommendation.improvable-threshold:0.8}") double improvableThreshold) {
        this.userService = userService;
        this.users = users;
        this.catalog = catalog;
        this.maxRecommended = maxRecommended;
        this.lowSuccessThreshold = lowSuccessThreshold;
        this.improvableThreshold = improvableThreshold;
    }

    /** Skills of the current phase, never attempted first, then by falling success rate band. */
    @Transactional(readOnly = true)
    public List<RecommendedSkill> recommendedSkills(String userId) {
        User user = userService.requireUser(userId);
        Map<String, SkillProgress> progress = users.loadSkillProgress(userId).stream()
                .collect(Collectors.toMap(SkillProgress::skillId, Function.identity()));

        List<RecommendedSkill> result = new ArrayList<>();
        for (Skill skill : catalog.listSkills()) {
            if (!user.currentPhase().levels().contains(skill.level())) continue;

            SkillProgress p = progress.get(skill.skillId());
            int attempts = p == null ? 0 : p.attempts();
            double rate = p == null ? 0.0 : p.successRate();
            int priority;
            String reason;
            if (attempts == 0) {
                priority = 3;
                reason = "Not attempted yet";
            } else if (rate < lowSuccessThreshold) {
                priority = 2;
                reason = "Low success rate: " + percent(rate);
            } else if (rate < improvableThreshold) {
                priority = 1;
                reason = "Can be improved: " + percent(rate);
            } else {
                continue;
            }
            result.add(new RecommendedSkill(skill.skillId(), skill.title(), skill.level(), attempts, rate, priority, reason));
        }
        result.sort(Comparator.comparingInt(RecommendedSkill::priority).reversed()
                .thenComparing(RecommendedSkill::skillId));
        return result;
    }

    /**
     * Recommendation block of a training plan. {@code commonErrors} are the user's grouped
     * errors, most frequent first.
     */
    @Transactional(readOnly = true)
    public Recommendation recommend(String userId, List<CommonError> commonErrors) {
        TrainingPhase phase = userService.requireUser(userId).currentPhase();
        List<RecommendedSkill> recommended = recommendedSkills(userId);
        List<FocusSkill> focus = focusSkills(commonErrors);

        List<String> goals = new ArrayList<>();
        if (!recommended.isEmpty()) {
            RecommendedSkill top = recommended.get(0);
            goals.add("Priority skill: " + top.title() + " - " + top.reason());
        }

        List<String> notes = new ArrayList<>();
        if (!focus.isEmpty()) {
            notes.add("Watch out: frequent errors on '" + focus.get(0).skillId() + "'");
        }
        notes.add(phaseNote(phase));

        return new Recommendation(recommended.stream().limit(maxRecommended).toList(), focus, goals, notes);
    }

    static List<FocusSkill> focusSkills(List<CommonError> commonErrors) {
        Map<String, List<CommonError>> bySkill = commonErrors.stream()
                .limit(FOCUS_SOURCE_ERRORS)
                .collect(Collectors.groupingBy(CommonError::skillId, LinkedHashMap::new, Collectors.toList()));
        return bySkill.entrySet().stream()
                .map(e -> new FocusSkill(e.getKey(),
                        e.getValue().stream().mapToLong(CommonError::count).sum(),
                        e.getValue().stream().map(CommonError::errorType).toList()))
                .sorted(Comparator.comparingLong(FocusSkill::totalErrors).reversed())
                .limit(MAX_FOCUS_SKILLS)
                .toList();
    }

    private static String phaseNote(TrainingPhase phase) {
        return switch (phase) {
            case FOUNDATION -> "Focus on basic movements: forward, backward and turning";
            case MOBILITY -> "Practise terrain skills and obstacles";
            case ADVANCED -> "Advanced techniques and emergency skills";
        };
    }

    private static String percent(double rate) {
        return String.format(Locale.US, "%.0f%%", rate * 100);
    }
}
