package com.wheelskills.progress.api;

import com.wheelskills.progress.analytics.AnalyticsModels.ActionConfusion;
import com.wheelskills.progress.analytics.AnalyticsModels.GlobalErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.SkillErrorStats;
import com.wheelskills.progress.analytics.AnalyticsModels.StepErrorRate;
import com.wheelskills.progress.analytics.GlobalAnalyticsEngine;
import com.wheelskills.progress.analytics.SkillStatsAggregator;
import com.wheelskills.progress.error.NotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GlobalAnalyticsEngine globalEngine;

    @MockitoBean
    private SkillStatsAggregator aggregator;

    @Test
    void globalErrors_emptyLog_returnsZeroedPayload() throws Exception {
        when(globalEngine.computeGlobal()).thenReturn(new GlobalErrorStats(0, 0, List.of(), List.of(), List.of(),
                Instant.parse("2025-03-01T10:15:30Z")));

        mockMvc.perform(get("/api/analytics/global-errors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_attempts", is(0)))
                .andExpect(jsonPath("$.total_users", is(0)))
                .andExpect(jsonPath("$.skill_summary", hasSize(0)))
                .andExpect(jsonPath("$.problematic_steps", hasSize(0)))
                .andExpect(jsonPath("$.action_confusion", hasSize(0)))
                .andExpect(jsonPath("$.generated_at", is("2025-03-01T10:15:30Z")));
    }

    @Test
    void globalErrors_rendersConfusionDescription() throws Exception {
        when(globalEngine.computeGlobal()).thenReturn(new GlobalErrorStats(3, 2, List.of(), List.of(),
                List.of(new ActionConfusion("brake", "none", 2, "Users press none instead of brake")), Instant.now()));

        mockMvc.perform(get("/api/analytics/global-errors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action_confusion[0].description", is("Users press none instead of brake")));
    }

    @Test
    void skillErrors_neverAttempted_returnsNotFound() throws Exception {
        when(aggregator.compute("a28_wheelie_turn_180"))
                .thenThrow(new NotFoundException("No attempts recorded for skill: a28_wheelie_turn_180"));

        mockMvc.perform(get("/api/analytics/skills/a28_wheelie_turn_180/errors"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("not_found")));
    }

    @Test
    void skillErrors_returnsFailureRateAndHardestStep() throws Exception {
        var step = new StepErrorRate(3, 0.4, 10, List.of(), List.of());
        when(aggregator.compute("a02_2m_backward")).thenReturn(new SkillErrorStats(
                "a02_2m_backward", 25, 15, 0.6, List.of(step), step, Instant.now()));

        mockMvc.perform(get("/api/analytics/skills/a02_2m_backward/errors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failure_rate", is(0.6)))
                .andExpect(jsonPath("$.most_difficult_step.step_number", is(3)))
                .andExpect(jsonPath("$.step_error_rates", hasSize(1)));
    }

    @Test
    void stepErrors_nonNumericStep_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/analytics/skills/a02_2m_backward/steps/two/errors"))
                .andExpect(status().isBadRequest());
    }
}
