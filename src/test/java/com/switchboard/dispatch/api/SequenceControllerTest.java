package com.switchboard.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.Report;
import com.switchboard.core.outreach.Channel;
import com.switchboard.core.outreach.Lead;
import com.switchboard.core.outreach.SequenceDefinition;
import com.switchboard.core.outreach.SequenceEngine;
import com.switchboard.core.outreach.SequenceExecution;
import com.switchboard.core.outreach.SequenceStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SequenceController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SequenceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SequenceEngine sequenceEngine;

    private static final SequenceDefinition DEFINITION = new SequenceDefinition("welcome",
            List.of(SequenceStep.of(1, Channel.EMAIL, "Hi {{name}}")), null);

    private static final Lead LEAD = Lead.of("lead-1", "Ana", "ana@example.com", null);

    // ── POST /api/v1/sequences/execute ──────────────────────────────

    @Test
    @DisplayName("POST /execute runs the sequence and returns the engine report")
    void executeSequence() throws Exception {
        when(sequenceEngine.executeSequence(any(), any())).thenReturn(Report.completed(
                "sequence_welcome_lead-1", "OUTREACH_MANAGER", Map.of("stepsExecuted", 1)));

        mockMvc.perform(post("/api/v1/sequences/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SequenceRequest(DEFINITION, LEAD, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.data.stepsExecuted").value(1));

        verify(sequenceEngine).executeSequence(argThat(d -> "welcome".equals(d.sequenceId())),
                argThat(l -> "lead-1".equals(l.id())));
        verify(sequenceEngine, never()).startSequence(any(), any());
    }

    @Test
    @DisplayName("POST /execute with deferred=true starts the sequence instead")
    void startDeferred() throws Exception {
        when(sequenceEngine.startSequence(any(), any())).thenReturn(Report.pending(
                "sequence_welcome_lead-1", "OUTREACH_MANAGER", Map.of("nextStep", 2)));

        mockMvc.perform(post("/api/v1/sequences/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SequenceRequest(DEFINITION, LEAD, true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"));

        verify(sequenceEngine, never()).executeSequence(any(), any());
    }

    @Test
    @DisplayName("POST /execute without a lead returns 400")
    void missingLead() throws Exception {
        mockMvc.perform(post("/api/v1/sequences/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SequenceRequest(DEFINITION, null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("lead is required"));
    }

    @Test
    @DisplayName("POST /execute accepts lower-case channels in the document")
    void lowerCaseChannel() throws Exception {
        when(sequenceEngine.executeSequence(any(), any())).thenReturn(Report.completed("t", "OUTREACH_MANAGER", Map.of()));
        String body = """
                {"sequence": {"sequenceId": "s", "steps": [{"stepNumber": 1, "channel": "sms", "template": "hi"}]},
                 "lead": {"id": "lead-2", "phone": "+15550100"}}
                """;

        mockMvc.perform(post("/api/v1/sequences/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        verify(sequenceEngine).executeSequence(argThat(d -> d.steps().get(0).channel() == Channel.SMS), any());
    }

    // ── other endpoints ─────────────────────────────────────────────

    @Test
    @DisplayName("POST /resume-due returns the reports of resumed sequences")
    void resumeDue() throws Exception {
        when(sequenceEngine.resumeDue()).thenReturn(List.of(
                Report.completed("sequence_welcome_lead-1", "OUTREACH_MANAGER", Map.of())));

        mockMvc.perform(post("/api/v1/sequences/resume-due"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    @DisplayName("GET execution returns 404 when the lead never started the sequence")
    void executionNotFound() throws Exception {
        when(sequenceEngine.execution("welcome", "lead-9")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/sequences/welcome/leads/lead-9"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET execution returns the stored progress")
    void executionFound() throws Exception {
        when(sequenceEngine.execution("welcome", "lead-1")).thenReturn(Optional.of(
                SequenceExecution.start("welcome", "lead-1", 3, Instant.parse("2026-03-02T12:00:00Z"))));

        mockMvc.perform(get("/api/v1/sequences/welcome/leads/lead-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.totalSteps").value(3))
                .andExpect(jsonPath("$.currentStep").value(0));
    }
}
