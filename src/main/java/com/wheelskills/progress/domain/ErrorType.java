package com.wheelskills.progress.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.wheelskills.progress.domain.DomainModels.Severity;
import com.wheelskills.progress.error.ValidationException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ways an observed action can diverge from the expected one. The set is closed: error
 * reports naming anything else are rejected.
 */
public enum ErrorType {
    WRONG_INPUT("wrong_input", Severity.MEDIUM),
    WRONG_DIRECTION("wrong_direction", Severity.MEDIUM),
    WRONG_TURN_DIRECTION("wrong_turn_direction", Severity.MEDIUM),
    STOPPED_INSTEAD_OF_MOVING("stopped_instead_of_moving", Severity.MEDIUM),
    MOVED_INSTEAD_OF_STOPPING("moved_instead_of_stopping", Severity.MEDIUM),
    MISSED_POP_CASTERS("missed_pop_casters", Severity.HIGH),
    TIMEOUT("timeout", Severity.HIGH),
    WRONG_SEQUENCE("wrong_sequence", Severity.MEDIUM),
    TIMING_ERROR("timing_error", Severity.LOW),
    MISSING_INPUT("missing_input", Severity.HIGH),
    EXTRA_INPUT("extra_input", Severity.LOW),
    INCOMPLETE_ACTION("incomplete_action", Severity.MEDIUM),
    BALANCE_LOST("balance_lost", Severity.HIGH),
    COLLISION("collision", Severity.HIGH),
    SAFETY_VIOLATION("safety_violation", Severity.CRITICAL);

    private static final Map<String, ErrorType> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toMap(ErrorType::code, Function.identity()));

    private final String code;
    private final Severity severity;

    ErrorType(String code, Severity severity) {
        this.code = code;
        this.severity = severity;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }

    public static ErrorType fromCode(String code) {
        ErrorType type = code == null ? null : BY_CODE.get(code.trim().toLowerCase());
        if (type == null) {
            throw new ValidationException("Unknown error_type: " + code);
        }
        return type;
    }
}
