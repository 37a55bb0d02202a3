package com.wheelskills.progress.catalog;

import com.wheelskills.progress.domain.DomainModels.Severity;
import com.wheelskills.progress.domain.DomainModels.Skill;
import com.wheelskills.progress.domain.DomainModels.SkillStep;
import com.wheelskills.progress.domain.ErrorType;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.repository.SkillCatalogJdbcRepository;
import com.wheelskills.progress.repository.SkillCatalogJdbcRepository.StepRow;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read access to the bundled skill catalog: which skills exist, their level and the
 * expected action of every step.
 */
@Service
public class SkillCatalogService {
    private final SkillCatalogJdbcRepository repository;

    public SkillCatalogService(SkillCatalogJdbcRepository repository) {
        this.repository = repository;
    }

    public List<Skill> listSkills() {
        Map<String, List<SkillStep>> steps = repository.loadAllSteps().stream()
                .collect(Collectors.groupingBy(StepRow::skillId, Collectors.mapping(StepRow::step, Collectors.toList())));
        return repository.loadSkills().stream()
                .map(s -> new Skill(s.skillId(), s.title(), s.level(), steps.getOrDefault(s.skillId(), List.of())))
                .toList();
    }

    public Skill requireSkill(String skillId) {
        return repository.findSkill(skillId)
                .map(s -> new Skill(s.skillId(), s.title(), s.level(), repository.loadSteps(s.skillId())))
                .orElseThrow(() -> new NotFoundException("Skill not found: " + skillId));
    }

    public List<ErrorTypeInfo> errorTypes() {
        return Arrays.stream(ErrorType.values())
                .map(t -> new ErrorTypeInfo(t, t.severity()))
                .toList();
    }

    public record ErrorTypeInfo(ErrorType type, Severity severity) {}
}
