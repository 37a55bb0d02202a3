package com.wheelskills.progress.api;

import com.wheelskills.progress.domain.DomainModels.SkillStep;
import com.wheelskills.progress.error.InvalidStateException;
import com.wheelskills.progress.error.NotFoundException;
import com.wheelskills.progress.error.ValidationException;
import com.wheelskills.progress.tracking.AttemptTracker;
import com.wheelskills.progress.tracking.TrackingModels.StartedAttempt;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AttemptController.class)
class AttemptControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AttemptTracker tracker;

    @Test
    void start_withoutBody_returnsAttemptAndSteps() throws Exception {
        when(tracker.startAttempt("u-1", "a01_10m_forward", null)).thenReturn(new StartedAttempt(
                "att_1", "a01_10m_forward", null, List.of(new SkillStep(1, "move_forward"))));

        mockMvc.perform(post("/api/users/u-1/skills/a01_10m_forward/attempts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attempt_id", is("att_1")))
                .andExpect(jsonPath("$.skill_steps[0].expected_action", is("move_forward")));
    }

    @Test
    void start_unknownSkill_returnsNotFound() throws Exception {
        when(tracker.startAttempt("u-1", "nope", "ses_1"))
                .thenThrow(new NotFoundException("Skill not found: nope"));

        mockMvc.perform(post("/api/users/u-1/skills/nope/attempts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"ses_1\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("not_found")))
                .andExpect(jsonPath("$.message", is("Skill not found: nope")))
                .andExpect(jsonPath("$.timestamp", notNullValue()));
    }

    @Test
    void recordInput_mapsSnakeCaseBody() throws Exception {
        mockMvc.perform(post("/api/attempts/att_1/inputs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"step_number": 2, "expected_input": "turn_left", "actual_input": "turn_right",
                                 "timestamp": "2025-03-01T10:15:30Z"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)));

        verify(tracker).recordInput("att_1", 2, "turn_left", "turn_right", Instant.parse("2025-03-01T10:15:30Z"));
    }

    @Test
    void recordError_unknownType_returnsBadRequest() throws Exception {
        when(tracker.recordError(eq("att_1"), eq(1), eq("fell_asleep"), anyString(), anyString()))
                .thenThrow(new ValidationException("Unknown error_type: fell_asleep"));

        mockMvc.perform(post("/api/attempts/att_1/errors")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"step_number\":1,\"error_type\":\"fell_asleep\",\"expected_action\":\"a\",\"actual_action\":\"b\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("validation_error")));
    }

    @Test
    void complete_twice_returnsConflict() throws Exception {
        when(tracker.complete("att_1", true)).thenThrow(new InvalidStateException("Attempt already completed: att_1"));

        mockMvc.perform(post("/api/attempts/att_1/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"success\":true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("invalid_state")));
    }

    @Test
    void malformedBody_returnsBadRequestWithoutCallingTracker() throws Exception {
        mockMvc.perform(post("/api/attempts/att_1/inputs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"step_number\": \"two\""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("validation_error")));

        verifyNoInteractions(tracker);
    }

    @Test
    void storageFailure_returnsGenericInternalError() throws Exception {
        when(tracker.complete(eq("att_1"), any())).thenThrow(new IllegalStateException("connection reset"));

        mockMvc.perform(post("/api/attempts/att_1/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"success\":false}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("internal_error")))
                .andExpect(jsonPath("$.message", is("Internal server error")));
    }
}
