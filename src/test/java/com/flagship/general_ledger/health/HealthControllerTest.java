package com.flagship.general_ledger.health;

import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.OutboxMetrics;
import com.flagship.general_ledger.support.AbstractIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class HealthControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OutboxMetrics outboxMetrics;

    @Test
    @DisplayName("Health reports the database and the outbox backlog")
    void health() throws Exception {
        outboxMetrics.refreshMetrics();

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.outbox_backlog").value(0))
            .andExpect(header().exists(CorrelationContext.CORRELATION_ID_HEADER));
    }

    @Test
    @DisplayName("A supplied correlation id is echoed back")
    void correlationIdEchoed() throws Exception {
        mockMvc.perform(get("/health").header(CorrelationContext.CORRELATION_ID_HEADER, "trace-42"))
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "trace-42"));
    }
}
