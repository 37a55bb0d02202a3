package com.wheelskills.progress.repository;

import com.wheelskills.progress.domain.DomainModels.SkillProgress;
import com.wheelskills.progress.domain.DomainModels.TrainingSession;
import com.wheelskills.progress.domain.DomainModels.User;
import com.wheelskills.progress.domain.TrainingPhase;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class UserJdbcRepository {
    private static final RowMapper<SkillProgress> PROGRESS_MAPPER = (rs, n) -> new SkillProgress(
            rs.getString(1), rs.getInt(2), rs.getInt(3), rs.getDouble(4),
            rs.getString(5) == null ? null : Instant.parse(rs.getString(5)));

    private final JdbcTemplate jdbcTemplate;

    public UserJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertUser(User user) {
        jdbcTemplate.update(
                "INSERT INTO users(user_id, current_phase, created_at, updated_at) VALUES (?,?,?,?)",
                user.userId(), user.currentPhase().name(), user.createdAt().toString(),
                user.updatedAt() == null ? null : user.updatedAt().toString());
    }

    public Optional<User> findUser(String userId) {
        return jdbcTemplate.query(
                "SELECT user_id, current_phase, created_at, updated_at FROM users WHERE user_id = ?",
                (rs, n) -> new User(rs.getString(1), TrainingPhase.fromLabel(rs.getString(2)),
                        Instant.parse(rs.getString(3)),
                        rs.getString(4) == null ? null : Instant.parse(rs.getString(4))),
                userId).stream().findFirst();
    }

    public void updatePhase(String userId, TrainingPhase phase, Instant ts) {
        jdbcTemplate.update("UPDATE users SET current_phase = ?, updated_at = ? WHERE user_id = ?",
                phase.name(), ts.toString(), userId);
    }

    public void touch(String userId, Instant ts) {
        jdbcTemplate.update("UPDATE users SET updated_at = ? WHERE user_id = ?", ts.toString(), userId);
    }

    public void insertSession(TrainingSession session) {
        jdbcTemplate.update("INSERT INTO training_sessions(session_id, user_id, started_at) VALUES (?,?,?)",
                session.sessionId(), session.userId(), session.startedAt().toString());
    }

    public Optional<TrainingSession> findSession(String sessionId) {
        return jdbcTemplate.query(
                "SELECT session_id, user_id, started_at FROM training_sessions WHERE session_id = ?",
                (rs, n) -> new TrainingSession(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))),
                sessionId).stream().findFirst();
    }

    public List<String> loadSessionIds(String userId) {
        return jdbcTemplate.queryForList(
                "SELECT session_id FROM training_sessions WHERE user_id = ? ORDER BY started_at, session_id",
                String.class, userId);
    }

    public void upsertSkillProgress(String userId, SkillProgress p) {
        jdbcTemplate.update(
                "MERGE INTO skill_progress(user_id, skill_id, attempts, successful_attempts, success_rate, last_attempt) KEY(user_id, skill_id) VALUES (?,?,?,?,?,?)",
                userId, p.skillId(), p.attempts(), p.successfulAttempts(), p.successRate(),
                p.lastAttempt() == null ? null : p.lastAttempt().toString());
    }

    public Optional<SkillProgress> findSkillProgress(String userId, String skillId) {
        return jdbcTemplate.query(
                "SELECT skill_id, attempts, successful_attempts, success_rate, last_attempt FROM skill_progress WHERE user_id = ? AND skill_id = ?",
                PROGRESS_MAPPER, userId, skillId).stream().findFirst();
    }

    public List<SkillProgress> loadSkillProgress(String userId) {
        return jdbcTemplate.query(
                "SELECT skill_id, attempts, successful_attempts, success_rate, last_attempt FROM skill_progress WHERE user_id = ? ORDER BY skill_id",
                PROGRESS_MAPPER, userId);
    }

    public void deleteSkillProgress(String userId) {
        jdbcTemplate.update("DELETE FROM skill_progress WHERE user_id = ?", userId);
    }

    public void deleteSessions(String userId) {
        jdbcTemplate.update("DELETE FROM training_sessions WHERE user_id = ?", userId);
    }
}
