package com.trackflow.controller;

import com.trackflow.dto.InvocationResponse;
import com.trackflow.dto.RollbackResult;
import com.trackflow.error.GlobalExceptionHandler;
import com.trackflow.event.PromotionRequest;
import com.trackflow.model.PromotionAuditEntry;
import com.trackflow.service.PromotionAuditService;
import com.trackflow.service.PromotionRequestHandler;
import com.trackflow.service.PromotionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("promotion endpoints")
class PromotionControllerTest {

    private PromotionRequestHandler requestHandler;
    private PromotionService promotionService;
    private PromotionAuditService auditService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        requestHandler = mock(PromotionRequestHandler.class);
        promotionService = mock(PromotionService.class);
        auditService = mock(PromotionAuditService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PromotionController(requestHandler, promotionService, auditService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("the handler's status code and body are passed through")
    void invokePassesThrough() throws Exception {
        when(requestHandler.handle(any())).thenReturn(new InvocationResponse(503, Map.of("error", "target down")));

        mockMvc.perform(post("/api/promotion")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"promote_track\",\"trackId\":\"t1\",\"bypassAgeGate\":true}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("target down"));

        ArgumentCaptor<PromotionRequest> captor = ArgumentCaptor.forClass(PromotionRequest.class);
        verify(requestHandler).handle(captor.capture());
        assertThat(captor.getValue().getTrackId()).isEqualTo("t1");
        assertThat(captor.getValue().bypassAgeGateRequested()).isTrue();
    }

    @Test
    @DisplayName("rollback answers 200 when something was removed and 404 otherwise")
    void rollback() throws Exception {
        when(promotionService.rollback("t1")).thenReturn(new RollbackResult("t1", "prod", true, 2));
        when(promotionService.rollback("t2")).thenReturn(new RollbackResult("t2", "prod", false, 0));

        mockMvc.perform(delete("/api/promotion/t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blobsDeleted").value(2));
        mockMvc.perform(delete("/api/promotion/t2"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("history lists the audit entries of a track")
    void history() throws Exception {
        PromotionAuditEntry entry = new PromotionAuditEntry();
        entry.setTrackId("t1");
        entry.setSuccess(true);
        when(auditService.history("t1")).thenReturn(List.of(entry));

        mockMvc.perform(get("/api/promotion/t1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].trackId").value("t1"))
                .andExpect(jsonPath("$[0].success").value(true));
    }

    @Test
    @DisplayName("a body that is not JSON answers 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/promotion")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
        verifyNoInteractions(requestHandler);
    }
}
