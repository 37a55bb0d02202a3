package com.wheelskills.progress.repository;

import com.wheelskills.progress.domain.DomainModels.SkillStep;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class SkillCatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SkillCatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<SkillRow> loadSkills() {
        return jdbcTemplate.query(
                "SELECT skill_id, title, skill_level FROM skills ORDER BY skill_id",
                (rs, n) -> new SkillRow(rs.getString(1), rs.getString(2), rs.getString(3)));
    }

    public Optional<SkillRow> findSkill(String skillId) {
        return jdbcTemplate.query(
                "SELECT skill_id, title, skill_level FROM skills WHERE skill_id = ?",
                (rs, n) -> new SkillRow(rs.getString(1), rs.getString(2), rs.getString(3)),
                skillId).stream().findFirst();
    }

    public List<StepRow> loadAllSteps() {
        return jdbcTemplate.query(
                "SELECT skill_id, step_number, expected_action FROM skill_steps ORDER BY skill_id, step_number",
                (rs, n) -> new StepRow(rs.getString(1), new SkillStep(rs.getInt(2), rs.getString(3))));
    }

    public List<SkillStep> loadSteps(String skillId) {
        return jdbcTemplate.query(
                "SELECT step_number, expected_action FROM skill_steps WHERE skill_id = ? ORDER BY step_number",
                (rs, n) -> new SkillStep(rs.getInt(1), rs.getString(2)),
                skillId);
    }

    public record SkillRow(String skillId, String title, String level) {}
    public record StepRow(String skillId, SkillStep step) {}
}
