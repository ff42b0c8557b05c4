package com.meridian.backend.service.risk;

import com.meridian.backend.config.ResilienceConfig;
import com.meridian.backend.config.RiskProperties;
import com.meridian.backend.exception.ExecutionRejectedException;
import com.meridian.backend.exception.NotFoundException;
import com.meridian.backend.model.CriticalAlert;
import com.meridian.backend.model.Position;
import com.meridian.backend.model.PositionAction;
import com.meridian.backend.model.PositionAction.ActionType;
import com.meridian.backend.model.PositionEvent;
import com.meridian.backend.model.PositionSide;
import com.meridian.backend.model.PositionStatus;
import com.meridian.backend.model.Signal;
import com.meridian.backend.model.SignalType;
import com.meridian.backend.model.TakeProfitLevel;
import com.meridian.backend.service.MetricsService;
import com.meridian.backend.service.persistence.AsyncPersistenceService;
import com.meridian.backend.service.persistence.PersistencePort;
import com.meridian.backend.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PositionRiskManagerTest {

    private static final Instant NOW = Instant.parse("2026-01-06T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final List<CriticalAlert> alerts = new ArrayList<>();

    private ExecutionPort executionPort;
    private PersistencePort persistencePort;
    private RiskProperties riskProperties;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        executionPort = mock(ExecutionPort.class);
        persistencePort = mock(PersistencePort.class);
        when(executionPort.closePosition(anyString(), anyDouble(), anyString()))
                .thenAnswer(inv -> new ExecutionPort.ExecutionAck(inv.getArgument(0), null, NOW));
        when(executionPort.updateStop(anyString(), anyDouble()))
                .thenAnswer(inv -> new ExecutionPort.ExecutionAck(inv.getArgument(0), null, NOW));

        riskProperties = new RiskProperties();
        riskProperties.getDispatch().setMaxAttempts(2);
        riskProperties.getDispatch().setBaseDelay(Duration.ofMillis(1));
        metricsService = new MetricsService(new SimpleMeterRegistry());
    }

    @Test
    void trailingStopFollowsHighAndClosesOnPullback() {
        riskProperties.getTrailing().setActivationProfit(0.02);
        riskProperties.getTrailing().setDistance(0.01);
        riskProperties.setTakeProfitLevels(List.of());
        PositionRiskManager manager = manager();
        manager.register(longPosition("P1", 100.0, 98.0));

        List<PositionAction> afterRally = manager.onPriceTick("BTCUSDT", 103.0);

        assertThat(afterRally).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(ActionType.UPDATE_STOP);
            assertThat(action.newStopPrice()).isCloseTo(101.97, within(1e-9));
        });
        assertThat(manager.position("P1").getTrailingStop().isActive()).isTrue();

        List<PositionAction> afterPullback = manager.onPriceTick("BTCUSDT", 101.0);

        assertThat(afterPullback).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(ActionType.FULL_CLOSE);
            assertThat(action.reason()).isEqualTo("TRAILING_STOP");
            assertThat(action.fraction()).isEqualTo(1.0);
        });
        assertThat(manager.openPositions()).isEmpty();
        assertThat(manager.closedPositions()).singleElement()
                .satisfies(position -> assertThat(position.getStatus()).isEqualTo(PositionStatus.CLOSED));
    }

    @Test
    void stopNeverLoosens() {
        riskProperties.getTrailing().setActivationProfit(0.02);
        riskProperties.getTrailing().setDistance(0.01);
        riskProperties.setTakeProfitLevels(List.of());
        PositionRiskManager manager = manager();
        manager.register(longPosition("P1", 100.0, 98.0));

        double previous = manager.position("P1").getStopLossPrice();
        for (double price : new double[]{100.5, 103.0, 102.5, 104.0, 102.98, 103.5}) {
            manager.onPriceTick("BTCUSDT", price);
            double stop = manager.position("P1").getStopLossPrice();
            assertThat(stop).isGreaterThanOrEqualTo(previous);
            previous = stop;
        }
        assertThat(previous).isCloseTo(104.0 * 0.99, within(1e-9));
    }

    @Test
    void shortTrailingStopMovesDown() {
        riskProperties.getTrailing().setActivationProfit(0.02);
        riskProperties.getTrailing().setDistance(0.01);
        riskProperties.setTakeProfitLevels(List.of());
        PositionRiskManager manager = manager();
        manager.register(Position.builder()
                .id("S1").symbol("BTCUSDT").side(PositionSide.SHORT)
                .entryPrice(100.0).quantity(1.0).stopLossPrice(102.0)
                .build());

        manager.onPriceTick("BTCUSDT", 97.0);

        assertThat(manager.position("S1").getStopLossPrice()).isCloseTo(97.97, within(1e-9));
    }

    @Test
    void takeProfitLevelsFireOnceAndNeverOverClose() {
        riskProperties.getTrailing().setEnabled(false);
        PositionRiskManager manager = manager();
        Position position = manager.onEntryFilled(fill("P1", PositionSide.LONG, 100.0), null);
        assertThat(position.getTakeProfitLevels()).hasSize(3);
        assertThat(position.getTakeProfitLevels().get(0).getPrice()).isCloseTo(101.0, within(1e-9));
        assertThat(position.getTakeProfitLevels().get(2).getPrice()).isCloseTo(103.0, within(1e-9));

        List<PositionAction> first = manager.onPriceTick("BTCUSDT", 101.01);
        List<PositionAction> repeat = manager.onPriceTick("BTCUSDT", 101.2);
        List<PositionAction> gap = manager.onPriceTick("BTCUSDT", 103.5);

        assertThat(first).extracting(PositionAction::type)
                .containsExactly(ActionType.PARTIAL_CLOSE, ActionType.UPDATE_STOP);
        assertThat(first.get(1).newStopPrice()).isEqualTo(100.0);
        assertThat(first.get(1).reason()).isEqualTo("BREAKEVEN");
        assertThat(repeat).isEmpty();
        assertThat(gap).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(ActionType.FULL_CLOSE);
            assertThat(action.fraction()).isCloseTo(0.7, within(1e-9));
            assertThat(action.reason()).isEqualTo("TAKE_PROFIT_3");
        });

        assertThat(first.get(0).fraction() + gap.get(0).fraction()).isCloseTo(1.0, within(1e-9));
        assertThat(manager.openPositions()).isEmpty();
        Position closed = manager.closedPositions().get(0);
        assertThat(closed.getExitReason()).isEqualTo("TAKE_PROFIT_3");
        assertThat(closed.getTakeProfitLevels()).allMatch(TakeProfitLevel::isFilled);
    }

    @Test
    void gapThroughEveryTargetIsOneFullClose() {
        riskProperties.getTrailing().setEnabled(false);
        PositionRiskManager manager = manager();
        manager.onEntryFilled(fill("P1", PositionSide.LONG, 100.0), null);

        List<PositionAction> actions = manager.onPriceTick("BTCUSDT", 104.0);

        assertThat(actions).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(ActionType.FULL_CLOSE);
            assertThat(action.fraction()).isCloseTo(1.0, within(1e-9));
            assertThat(action.reason()).isEqualTo("TAKE_PROFIT_3");
        });
        assertThat(manager.openPositions()).isEmpty();
    }

    @Test
    void gapThroughSomeTargetsIsOnePartialCloseOfTheirSum() {
        riskProperties.getTrailing().setEnabled(false);
        PositionRiskManager manager = manager();
        manager.onEntryFilled(fill("P1", PositionSide.LONG, 100.0), null);

        List<PositionAction> actions = manager.onPriceTick("BTCUSDT", 102.5);

        assertThat(actions).extracting(PositionAction::type)
                .containsExactly(ActionType.PARTIAL_CLOSE, ActionType.UPDATE_STOP);
        assertThat(actions.get(0).fraction()).isCloseTo(0.6, within(1e-9));
        assertThat(actions.get(0).levelIndex()).isEqualTo(1);
        assertThat(actions.get(0).reason()).isEqualTo("TAKE_PROFIT_2");
        Position open = manager.position("P1");
        assertThat(open.getStatus()).isEqualTo(PositionStatus.PARTIALLY_CLOSED);
        assertThat(open.getClosedFraction()).isCloseTo(0.6, within(1e-9));
        assertThat(open.getTakeProfitLevels()).extracting(TakeProfitLevel::isFilled)
                .containsExactly(true, true, false);
    }

    @Test
    void stopHitClosesOnceWithFullClose() {
        PositionRiskManager manager = manager();
        manager.register(longPosition("P1", 100.0, 98.0));

        List<PositionAction> actions = manager.onPriceTick("BTCUSDT", 97.0);
        List<PositionAction> after = manager.onPriceTick("BTCUSDT", 96.0);

        assertThat(actions).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(ActionType.FULL_CLOSE);
            assertThat(action.reason()).isEqualTo("STOP_LOSS");
        });
        assertThat(after).isEmpty();
        verify(executionPort).closePosition("P1", 1.0, "STOP_LOSS");
    }

    @Test
    void rejectedDispatchLeavesStateUntouchedAndAlerts() {
        riskProperties.getTrailing().setActivationProfit(0.02);
        riskProperties.getTrailing().setDistance(0.01);
        riskProperties.setTakeProfitLevels(List.of());
        when(executionPort.updateStop(anyString(), anyDouble()))
                .thenThrow(new ExecutionRejectedException("P1", "venue refused"));
        PositionRiskManager manager = manager();
        manager.register(longPosition("P1", 100.0, 98.0));
        Position before = manager.position("P1");

        assertThatThrownBy(() -> manager.onPriceTick("BTCUSDT", 103.0))
                .isInstanceOf(ExecutionRejectedException.class);

        Position after = manager.position("P1");
        assertThat(after.getStopLossPrice()).isEqualTo(before.getStopLossPrice());
        assertThat(after.getTrailingStop().isActive()).isFalse();
        assertThat(alerts).singleElement()
                .satisfies(alert -> assertThat(alert.type()).isEqualTo("EXIT_DISPATCH_FAILED"));
        assertThat(metricsService.snapshot().exitDispatchFailures()).isEqualTo(1);
    }

    @Test
    void rejectionOnOnePositionDoesNotBlockOthers() {
        when(executionPort.closePosition("P1", 1.0, "STOP_LOSS"))
                .thenThrow(new ExecutionRejectedException("P1", "venue refused"));
        PositionRiskManager manager = manager();
        manager.register(longPosition("P1", 100.0, 98.0));
        manager.register(longPosition("P2", 100.0, 98.0));

        assertThatThrownBy(() -> manager.onPriceTick("BTCUSDT", 97.0))
                .isInstanceOf(ExecutionRejectedException.class);

        assertThat(manager.openPositions()).extracting(Position::getId).containsExactly("P1");
        assertThat(manager.closedPositions()).extracting(Position::getId).containsExactly("P2");
    }

    @Test
    void openOnSignalUsesSignalStopDistance() {
        when(executionPort.openPosition("BTCUSDT", PositionSide.LONG, 2.0, 100.0))
                .thenReturn(new ExecutionPort.PositionFill("P9", "BTCUSDT", PositionSide.LONG, 2.0, 100.0, NOW));
        PositionRiskManager manager = manager();

        Optional<Position> opened = manager.onSignal(signal(SignalType.LONG, NOW.plusSeconds(300)), 2.0);

        assertThat(opened).isPresent();
        assertThat(opened.get().getStopLossPrice()).isCloseTo(99.0, within(1e-9));
        assertThat(opened.get().getSignalFingerprint()).isEqualTo("fp-1");
        ArgumentCaptor<PositionEvent> events = ArgumentCaptor.forClass(PositionEvent.class);
        verify(persistencePort, atLeastOnce()).savePositionEvent(events.capture());
        assertThat(events.getAllValues()).extracting(PositionEvent::getType).contains(PositionEvent.EventType.OPENED);
    }

    @Test
    void neutralOrExpiredSignalsOpenNothing() {
        PositionRiskManager manager = manager();

        assertThat(manager.onSignal(signal(SignalType.NEUTRAL, NOW.plusSeconds(300)), 1.0)).isEmpty();
        assertThat(manager.onSignal(signal(SignalType.LONG, NOW), 1.0)).isEmpty();
        verify(executionPort, never()).openPosition(any(), any(), anyDouble(), anyDouble());
    }

    @Test
    void ticksForOtherSymbolsAreIgnored() {
        PositionRiskManager manager = manager();
        manager.register(longPosition("P1", 100.0, 98.0));

        assertThat(manager.onPriceTick("ETHUSDT", 50.0)).isEmpty();
        assertThat(manager.openPositions()).hasSize(1);
    }

    @Test
    void rejectsBadInput() {
        PositionRiskManager manager = manager();

        assertThatThrownBy(() -> manager.onPriceTick("BTCUSDT", -1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.position("missing")).isInstanceOf(NotFoundException.class);
        manager.register(longPosition("P1", 100.0, 98.0));
        assertThatThrownBy(() -> manager.register(longPosition("P1", 100.0, 98.0)))
                .isInstanceOf(IllegalStateException.class);
    }

    private PositionRiskManager manager() {
        ExitDispatcher dispatcher = new ExitDispatcher(executionPort,
                ResilienceConfig.buildExitDispatchRetry(riskProperties.getDispatch()),
                alerts::add, metricsService, clock);
        AsyncPersistenceService persistence = new AsyncPersistenceService(persistencePort, Runnable::run, metricsService);
        return new PositionRiskManager(executionPort, dispatcher, riskProperties, persistence, clock);
    }

    private static Position longPosition(String id, double entry, double stop) {
        return Position.builder()
                .id(id)
                .symbol("BTCUSDT")
                .side(PositionSide.LONG)
                .entryPrice(entry)
                .quantity(1.0)
                .stopLossPrice(stop)
                .openedAt(NOW)
                .build();
    }

    private static ExecutionPort.PositionFill fill(String id, PositionSide side, double price) {
        return new ExecutionPort.PositionFill(id, "BTCUSDT", side, 1.0, price, NOW);
    }

    private static Signal signal(SignalType type, Instant expiresAt) {
        return Signal.builder()
                .symbol("BTCUSDT")
                .signalType(type)
                .confidence(0.6)
                .referencePrice(100.0)
                .stopLossPrice(type == SignalType.NEUTRAL ? null : 99.0)
                .strategyId("patchtst_ml")
                .fingerprint("fp-1")
                .createdAt(NOW)
                .expiresAt(expiresAt)
                .build();
    }
}
