package com.meridian.backend.controller;

import com.meridian.backend.model.Position;
import com.meridian.backend.model.PositionAction;
import com.meridian.backend.service.risk.PositionRiskManager;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
public class PositionController {

    private final PositionRiskManager positionRiskManager;

    @GetMapping
    public ResponseEntity<List<Position>> getOpenPositions() {
        return ResponseEntity.ok(positionRiskManager.openPositions());
    }

    @GetMapping("/closed")
    public ResponseEntity<List<Position>> getClosedPositions() {
        return ResponseEntity.ok(positionRiskManager.closedPositions());
    }

    @GetMapping("/{positionId}")
    public ResponseEntity<Position> getPosition(@PathVariable String positionId) {
        return ResponseEntity.ok(positionRiskManager.position(positionId));
    }

    /**
     * Injects a price tick, mainly for paper trading without a live feed.
     */
    @PostMapping("/{symbol}/ticks")
    public ResponseEntity<List<PositionAction>> injectTick(@PathVariable String symbol,
                                                           @RequestParam @Positive double price) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        log.info("Manual tick {} @ {}", normalized, price);
        return ResponseEntity.ok(positionRiskManager.onPriceTick(normalized, price));
    }
}
