package com.wheelskills.progress;

import com.wheelskills.progress.catalog.SkillCatalogService;
import com.wheelskills.progress.domain.DomainModels.Severity;
import com.wheelskills.progress.domain.ErrorType;
import com.wheelskills.progress.error.NotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SkillCatalogServiceTest {
    @Autowired
    private SkillCatalogService catalog;

    @Test
    void bundledCatalogHasOrderedSteps() {
        var skills = catalog.listSkills();
        assertEquals(13, skills.size());
        assertEquals("a01_10m_forward", skills.get(0).skillId());
        assertTrue(skills.stream().allMatch(s -> !s.steps().isEmpty()));

        var steps = catalog.requireSkill("a04_turn_backward_90").steps();
        assertEquals(4, steps.size());
        assertEquals(1, steps.get(0).stepNumber());
        assertEquals("brake", steps.get(3).expectedAction());
    }

    @Test
    void unknownSkillIsNotFound() {
        assertThrows(NotFoundException.class, () -> catalog.requireSkill("z99_missing"));
    }

    @Test
    void errorTypesCarryFixedSeverities() {
        var types = catalog.errorTypes();
        assertEquals(15, types.size());
        assertTrue(types.stream().anyMatch(t -> t.type() == ErrorType.SAFETY_VIOLATION && t.severity() == Severity.CRITICAL));
        assertEquals(Severity.LOW, ErrorType.fromCode("timing_error").severity());
    }
}
