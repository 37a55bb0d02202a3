package com.wheelskills.progress.repository;

import com.wheelskills.progress.domain.AttemptStatus;
import com.wheelskills.progress.domain.DomainModels.Attempt;
import com.wheelskills.progress.domain.DomainModels.ErrorRecord;
import com.wheelskills.progress.domain.DomainModels.StepRecord;
import com.wheelskills.progress.domain.ErrorType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Append-only store of attempts and the step and error observations reported during them.
 * The only in-place update is the completion of an attempt.
 */
@Repository
public class EventLogJdbcRepository {
    private static final String ATTEMPT_COLUMNS =
            "SELECT attempt_id, user_id, skill_id, session_id, status, success, start_time, end_time FROM attempts";
    private static final String STEP_COLUMNS =
            "SELECT attempt_id, user_id, skill_id, step_number, expected_input, actual_input, correct, ts FROM step_records";
    private static final String ERROR_COLUMNS =
            "SELECT attempt_id, user_id, skill_id, step_number, error_type, expected_action, actual_action, ts FROM error_records";

    private static final RowMapper<Attempt> ATTEMPT_MAPPER = (rs, n) -> new Attempt(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
            AttemptStatus.valueOf(rs.getString(5)),
            (Boolean) rs.getObject(6),
            Instant.parse(rs.getString(7)),
            parseNullable(rs.getString(8)));

    private static final RowMapper<StepRecord> STEP_MAPPER = (rs, n) -> new StepRecord(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4),
            rs.getString(5), rs.getString(6), rs.getBoolean(7), Instant.parse(rs.getString(8)));

    private static final RowMapper<ErrorRecord> ERROR_MAPPER = (rs, n) -> new ErrorRecord(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4),
            ErrorType.fromCode(rs.getString(5)), rs.getString(6), rs.getString(7), Instant.parse(rs.getString(8)));

    private final JdbcTemplate jdbcTemplate;

    public EventLogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertAttempt(Attempt a) {
        jdbcTemplate.update(
                "INSERT INTO attempts(attempt_id, user_id, skill_id, session_id, status, success, start_time, end_time) VALUES (?,?,?,?,?,?,?,?)",
                a.attemptId(), a.userId(), a.skillId(), a.sessionId(), a.status().name(), a.success(),
                a.startTime().toString(), a.endTime() == null ? null : a.endTime().toString());
    }

    public Optional<Attempt> findAttempt(String attemptId) {
        return jdbcTemplate.query(ATTEMPT_COLUMNS + " WHERE attempt_id = ?", ATTEMPT_MAPPER, attemptId)
                .stream().findFirst();
    }

    /**
     * Moves an in-progress attempt to completed. Returns false when the row was not in
     * progress any more, i.e. another writer completed or removed it first.
     */
    public boolean completeAttempt(String attemptId, boolean success, Instant endTime) {
        int updated = jdbcTemplate.update(
                "UPDATE attempts SET status = ?, success = ?, end_time = ? WHERE attempt_id = ? AND status = ?",
                AttemptStatus.COMPLETED.name(), success, endTime.toString(), attemptId, AttemptStatus.IN_PROGRESS.name());
        return updated == 1;
    }

    public void appendStep(StepRecord r) {
        jdbcTemplate.update(
                "INSERT INTO step_records(attempt_id, user_id, skill_id, step_number, expected_input, actual_input, correct, ts) VALUES (?,?,?,?,?,?,?,?)",
                r.attemptId(), r.userId(), r.skillId(), r.stepNumber(), r.expectedInput(), r.actualInput(), r.correct(),
                r.timestamp().toString());
    }

    public void appendError(ErrorRecord r) {
        jdbcTemplate.update(
                "INSERT INTO error_records(attempt_id, user_id, skill_id, step_number, error_type, expected_action, actual_action, ts) VALUES (?,?,?,?,?,?,?,?)",
                r.attemptId(), r.userId(), r.skillId(), r.stepNumber(), r.errorType().code(), r.expectedAction(), r.actualAction(),
                r.timestamp().toString());
    }

    public List<StepRecord> loadStepsByAttempt(String attemptId) {
        return jdbcTemplate.query(STEP_COLUMNS + " WHERE attempt_id = ? ORDER BY id", STEP_MAPPER, attemptId);
    }

    public List<ErrorRecord> loadErrorsByAttempt(String attemptId) {
        return jdbcTemplate.query(ERROR_COLUMNS + " WHERE attempt_id = ? ORDER BY id", ERROR_MAPPER, attemptId);
    }

    public List<Attempt> loadAttemptsBySkill(String skillId) {
        return jdbcTemplate.query(ATTEMPT_COLUMNS + " WHERE skill_id = ? ORDER BY start_time, attempt_id", ATTEMPT_MAPPER, skillId);
    }

    public List<Attempt> loadAttemptsByUser(String userId) {
        return jdbcTemplate.query(ATTEMPT_COLUMNS + " WHERE user_id = ? ORDER BY start_time, attempt_id", ATTEMPT_MAPPER, userId);
    }

    public List<ErrorRecord> loadErrorsBySkillAndStep(String skillId, int stepNumber) {
        return jdbcTemplate.query(ERROR_COLUMNS + " WHERE skill_id = ? AND step_number = ? ORDER BY id",
                ERROR_MAPPER, skillId, stepNumber);
    }

    public EventSnapshot snapshot() {
        List<Attempt> attempts = jdbcTemplate.query(ATTEMPT_COLUMNS + " ORDER BY start_time, attempt_id", ATTEMPT_MAPPER);
        List<ErrorRecord> errors = jdbcTemplate.query(ERROR_COLUMNS + " ORDER BY id", ERROR_MAPPER);
        return EventSnapshot.of(attempts, errors);
    }

    public EventSnapshot snapshotForSkill(String skillId) {
        List<Attempt> attempts = loadAttemptsBySkill(skillId);
        List<ErrorRecord> errors = jdbcTemplate.query(ERROR_COLUMNS + " WHERE skill_id = ? ORDER BY id", ERROR_MAPPER, skillId);
        return EventSnapshot.of(attempts, errors);
    }

    public EventSnapshot snapshotForUser(String userId) {
        List<Attempt> attempts = loadAttemptsByUser(userId);
        List<ErrorRecord> errors = jdbcTemplate.query(ERROR_COLUMNS + " WHERE user_id = ? ORDER BY id", ERROR_MAPPER, userId);
        return EventSnapshot.of(attempts, errors);
    }

    /** Removes every attempt of the user with its records; returns the number of attempts removed. */
    public int deleteByUser(String userId) {
        jdbcTemplate.update("DELETE FROM error_records WHERE user_id = ?", userId);
        jdbcTemplate.update("DELETE FROM step_records WHERE user_id = ?", userId);
        return jdbcTemplate.update("DELETE FROM attempts WHERE user_id = ?", userId);
    }

    private static Instant parseNullable(String value) {
        return value == null ? null : Instant.parse(value);
    }

    /**
     * Attempts and errors read together. Errors whose attempt was appended after the
     * attempt scan are dropped so they are never counted without their attempt.
     */
    public record EventSnapshot(List<Attempt> attempts, List<ErrorRecord> errors) {
        public static EventSnapshot of(List<Attempt> attempts, List<ErrorRecord> errors) {
            Set<String> ids = attempts.stream().map(Attempt::attemptId).collect(Collectors.toSet());
            return new EventSnapshot(attempts, errors.stream().filter(e -> ids.contains(e.attemptId())).toList());
        }

        public boolean isEmpty() {
            return attempts.isEmpty();
        }
    }
}
