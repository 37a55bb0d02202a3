package com.wheelskills.progress.progress;

import com.wheelskills.progress.domain.DomainModels.Skill;
import com.wheelskills.progress.domain.DomainModels.SkillProgress;
import com.wheelskills.progress.domain.TrainingPhase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Decides when a user has practised the skills of the current phase well enough to move
 * on: a share of the phase's skills must reach the success threshold.
 */
@Component
public class PhaseEvaluator {
    private final double successThreshold;
    private final double completionShare;

    public PhaseEvaluator(@Value("${progress.phase.success-threshold:0.7}") double successThreshold,
                          @Value("${progress.phase.completion-share:0.6}") double completionShare) {
        this.successThreshold = successThreshold;
        this.completionShare = completionShare;
    }

    public TrainingPhase evaluate(TrainingPhase current, Map<String, SkillProgress> progress, List<Skill> catalog) {
        if (current == TrainingPhase.ADVANCED) return current;

        List<Skill> phaseSkills = catalog.stream()
                .filter(s -> current.levels().contains(s.level()))
                .toList();
        if (phaseSkills.isEmpty()) return current;

        long mastered = phaseSkills.stream()
                .map(s -> progress.get(s.skillId()))
                .filter(p -> p != null && p.successRate() >= successThreshold)
                .count();
        return mastered >= phaseSkills.size() * completionShare ? current.next() : current;
    }
}
