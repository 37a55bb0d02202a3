package com.wheelskills.progress.api;

import com.wheelskills.progress.catalog.SkillCatalogService;
import com.wheelskills.progress.catalog.SkillCatalogService.ErrorTypeInfo;
import com.wheelskills.progress.domain.DomainModels.Skill;
import com.wheelskills.progress.domain.DomainModels.SkillStep;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/skills")
public class SkillCatalogController {
    private final SkillCatalogService catalog;

    public SkillCatalogController(SkillCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public ResponseEntity<List<Skill>> skills() {
        return ResponseEntity.ok(catalog.listSkills());
    }

    @GetMapping("/{skillId}/steps")
    public ResponseEntity<List<SkillStep>> steps(@PathVariable String skillId) {
        return ResponseEntity.ok(catalog.requireSkill(skillId).steps());
    }

    @GetMapping("/error-types")
    public ResponseEntity<List<ErrorTypeInfo>> errorTypes() {
        return ResponseEntity.ok(catalog.errorTypes());
    }
}
