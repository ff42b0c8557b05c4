package com.meridian.backend.controller;

import com.meridian.backend.model.Position;
import com.meridian.backend.model.PositionSide;
import com.meridian.backend.service.risk.PositionRiskManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "meridian.scheduler.enabled=false",
        "meridian.risk.dispatch.base-delay=PT0.001S"
})
@AutoConfigureMockMvc
class PositionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PositionRiskManager positionRiskManager;

    @Test
    void stopHitThroughTickEndpointClosesPosition() throws Exception {
        positionRiskManager.register(Position.builder()
                .id("CTRL-1")
                .symbol("XRPUSDT")
                .side(PositionSide.LONG)
                .entryPrice(100.0)
                .quantity(1.0)
                .stopLossPrice(98.0)
                .openedAt(Instant.parse("2026-01-06T12:00:00Z"))
                .build());

        mockMvc.perform(get("/api/positions/CTRL-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopLossPrice").value(98.0))
                .andExpect(jsonPath("$.status").value("OPEN"));

        mockMvc.perform(post("/api/positions/xrpusdt/ticks").param("price", "97.5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("FULL_CLOSE"))
                .andExpect(jsonPath("$[0].reason").value("STOP_LOSS"));

        mockMvc.perform(get("/api/positions/CTRL-1"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/positions/closed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == 'CTRL-1')].exitReason").value("STOP_LOSS"));
    }

    @Test
    void rejectsNonPositivePrice() throws Exception {
        mockMvc.perform(post("/api/positions/BTCUSDT/ticks").param("price", "-5"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rejectsMissingPrice() throws Exception {
        mockMvc.perform(post("/api/positions/BTCUSDT/ticks"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listsOpenPositions() throws Exception {
        mockMvc.perform(get("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
