package com.meridian.backend.service.risk;

import com.meridian.backend.config.RiskProperties;
import com.meridian.backend.exception.ExecutionRejectedException;
import com.meridian.backend.exception.NotFoundException;
import com.meridian.backend.model.Position;
import com.meridian.backend.model.PositionAction;
import com.meridian.backend.model.PositionEvent;
import com.meridian.backend.model.PositionSide;
import com.meridian.backend.model.PositionStatus;
import com.meridian.backend.model.Signal;
import com.meridian.backend.model.TakeProfitLevel;
import com.meridian.backend.model.TrailingStopState;
import com.meridian.backend.service.persistence.AsyncPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;

/**
 * Owns every open position and drives its stop-loss, take-profit and trailing-stop state
 * from price ticks.
 * <p>
 * Each tick works on a copy of the position. A copy is committed only once the
 * {@link ExitDispatcher} has an acknowledgement for the action it produced, so a rejected
 * action leaves the last committed state in place. Ticks for the same position are
 * serialized by a per-position lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionRiskManager {

    private static final double EPSILON = 1e-9;
    private static final int CLOSED_HISTORY = 500;

    private final ExecutionPort executionPort;
    private final ExitDispatcher exitDispatcher;
    private final RiskProperties riskProperties;
    private final AsyncPersistenceService persistenceService;
    private final Clock clock;

    private final Map<String, Position> openPositions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Deque<Position> closedPositions = new ConcurrentLinkedDeque<>();

    /**
     * Opens a position for a directional, unexpired signal.
     *
     * @return the registered position, or empty for NEUTRAL or expired signals
     */
    public Optional<Position> onSignal(Signal signal, double quantity) {
        if (!signal.getSignalType().isDirectional()) {
            return Optional.empty();
        }
        if (signal.isExpiredAt(clock.instant())) {
            log.info("⌛ Ignoring expired signal symbol={} fingerprint={}", signal.getSymbol(), signal.getFingerprint());
            return Optional.empty();
        }
        ExecutionPort.PositionFill fill = executionPort.openPosition(
                signal.getSymbol(), signal.side(), quantity, signal.getReferencePrice());
        return Optional.of(onEntryFilled(fill, signal));
    }

    /**
     * Builds the position for a confirmed entry: stop distance from the signal (or the
     * configured default), take-profit schedule and trailing config from risk settings.
     */
    public Position onEntryFilled(ExecutionPort.PositionFill fill, Signal signal) {
        double entry = fill.fillPrice();
        double stopDistance = riskProperties.getDefaultStopDistance();
        if (signal != null && signal.getStopLossPrice() != null && signal.getReferencePrice() > 0) {
            stopDistance = Math.abs(signal.getReferencePrice() - signal.getStopLossPrice()) / signal.getReferencePrice();
        }
        double sign = fill.side() == PositionSide.LONG ? 1.0 : -1.0;

        List<TakeProfitLevel> levels = new ArrayList<>();
        for (RiskProperties.Level level : riskProperties.getTakeProfitLevels()) {
            levels.add(TakeProfitLevel.of(entry * (1.0 + sign * level.getDistance()), level.getFraction()));
        }

        Position position = Position.builder()
                .id(fill.positionId())
                .symbol(fill.symbol())
                .side(fill.side())
                .entryPrice(entry)
                .quantity(fill.quantity())
                .stopLossPrice(entry * (1.0 - sign * stopDistance))
                .takeProfitLevels(levels)
                .trailingStop(TrailingStopState.inactive(entry, riskProperties.getTrailing().getDistance()))
                .signalFingerprint(signal != null ? signal.getFingerprint() : null)
                .openedAt(fill.filledAt())
                .updatedAt(fill.filledAt())
                .build();
        register(position);
        return position;
    }

    /**
     * Adopts a position opened elsewhere, e.g. on restart.
     */
    public void register(Position position) {
        if (position.getId() == null || position.getSymbol() == null || position.getSide() == null) {
            throw new IllegalArgumentException("Position needs an id, symbol and side");
        }
        if (!(position.getEntryPrice() > 0) || !(position.getQuantity() > 0)) {
            throw new IllegalArgumentException("Position " + position.getId() + " needs a positive entry price and quantity");
        }
        Position owned = position.copy();
        if (owned.getTrailingStop() == null) {
            owned.setTrailingStop(TrailingStopState.inactive(owned.getEntryPrice(), riskProperties.getTrailing().getDistance()));
        }
        if (owned.getOpenedAt() == null) {
            owned.setOpenedAt(clock.instant());
        }
        if (openPositions.putIfAbsent(owned.getId(), owned) != null) {
            throw new IllegalStateException("Position " + owned.getId() + " is already registered");
        }
        log.info("📈 Position opened id={} {} {} qty={} entry={} stop={} targets={}",
                owned.getId(), owned.getSide(), owned.getSymbol(), owned.getQuantity(),
                owned.getEntryPrice(), owned.getStopLossPrice(), owned.getTakeProfitLevels().size());
        publish(owned, PositionEvent.EventType.OPENED, owned.getEntryPrice(), "registered");
    }

    /**
     * Evaluates every open position of the symbol against the tick. Positions are handled
     * independently; if any dispatch is rejected the first rejection is rethrown after the
     * remaining positions have been evaluated.
     *
     * @return the actions acknowledged by the execution collaborator
     */
    public List<PositionAction> onPriceTick(String symbol, double price) {
        if (!(price > 0) || !Double.isFinite(price)) {
            throw new IllegalArgumentException("Tick price must be positive: " + price);
        }
        List<PositionAction> executed = new ArrayList<>();
        ExecutionRejectedException firstRejection = null;
        List<String> ids = openPositions.values().stream()
                .filter(position -> position.getSymbol().equals(symbol))
                .map(Position::getId)
                .toList();
        for (String id : ids) {
            try {
                executed.addAll(evaluate(id, price));
            } catch (ExecutionRejectedException ex) {
                log.error("❌ Tick not applied to position {}: {}", id, ex.getMessage());
                if (firstRejection == null) {
                    firstRejection = ex;
                }
            }
        }
        if (firstRejection != null) {
            throw firstRejection;
        }
        return executed;
    }

    public List<Position> openPositions() {
        return openPositions.values().stream()
                .map(Position::copy)
                .sorted(Comparator.comparing(Position::getOpenedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public List<Position> closedPositions() {
        return closedPositions.stream().map(Position::copy).toList();
    }

    public Position position(String positionId) {
        Position position = openPositions.get(positionId);
        if (position == null) {
            throw new NotFoundException("Open position not found: " + positionId);
        }
        return position.copy();
    }

    private List<PositionAction> evaluate(String positionId, double price) {
        ReentrantLock lock = locks.computeIfAbsent(positionId, id -> new ReentrantLock());
        lock.lock();
        try {
            Position committed = openPositions.get(positionId);
            if (committed == null || !committed.isOpen()) {
                return List.of();
            }
            if (isStopHit(committed, price)) {
                return List.of(closeOnStop(committed, price));
            }
            List<PositionAction> executed = new ArrayList<>();
            takeProfits(committed, price).ifPresent(executed::add);
            Position current = openPositions.get(positionId);
            if (current != null && current.isOpen()) {
                adjustStop(current, price).ifPresent(executed::add);
            }
            return executed;
        } finally {
            lock.unlock();
        }
    }

    private PositionAction closeOnStop(Position committed, double price) {
        Position working = committed.copy();
        boolean trailed = working.getTrailingStop() != null && working.getTrailingStop().isActive();
        String reason = trailed ? "TRAILING_STOP" : "STOP_LOSS";
        PositionAction action = PositionAction.fullClose(working, working.remainingFraction(), price, reason);
        exitDispatcher.dispatch(action);

        markClosed(working, reason);
        commit(working);
        log.info("🛑 {} hit id={} {} price={} stop={}", reason, working.getId(), working.getSymbol(), price, working.getStopLossPrice());
        publish(working, PositionEvent.EventType.CLOSED, price, reason);
        return action;
    }

    /**
     * Every unfilled level the price has reached is folded into one close intent for the
     * tick: a FULL_CLOSE of the remainder when nothing is left afterwards, otherwise a
     * single PARTIAL_CLOSE of the summed fractions. The reason names the farthest level.
     */
    private Optional<PositionAction> takeProfits(Position committed, double price) {
        Position working = committed.copy();
        double remaining = working.remainingFraction();
        double fraction = 0.0;
        int farthest = -1;
        for (int index : levelOrder(working)) {
            TakeProfitLevel level = working.getTakeProfitLevels().get(index);
            if (level.isFilled() || !level.isReachedBy(working.getSide(), price)) {
                continue;
            }
            double levelFraction = Math.min(level.getFraction(), Math.max(0.0, remaining - fraction));
            level.setFraction(levelFraction);
            level.setFilled(true);
            fraction += levelFraction;
            farthest = index;
        }
        if (farthest < 0) {
            return Optional.empty();
        }

        boolean allFilled = working.getTakeProfitLevels().stream().allMatch(TakeProfitLevel::isFilled);
        boolean closes = allFilled || remaining - fraction <= EPSILON;
        String reason = "TAKE_PROFIT_" + (farthest + 1);
        PositionAction action = closes
                ? PositionAction.fullClose(working, remaining, price, reason)
                : PositionAction.partialClose(working, farthest, fraction, price);
        exitDispatcher.dispatch(action);

        if (closes) {
            markClosed(working, reason);
        } else {
            working.setClosedFraction(working.getClosedFraction() + fraction);
            working.setStatus(PositionStatus.PARTIALLY_CLOSED);
            working.setUpdatedAt(clock.instant());
        }
        commit(working);
        log.info("🎯 {} id={} {} price={} fraction={} remaining={}",
                reason, working.getId(), working.getSymbol(), price,
                closes ? remaining : fraction, working.remainingFraction());
        publish(working, closes ? PositionEvent.EventType.CLOSED : PositionEvent.EventType.PARTIAL_CLOSED, price, reason);
        return Optional.of(action);
    }

    /**
     * Breakeven after the first target and the trailing stop. Both only ever tighten the
     * stop; the water mark is committed even when the stop does not move.
     */
    private Optional<PositionAction> adjustStop(Position committed, double price) {
        Position working = committed.copy();
        PositionSide side = working.getSide();
        double stop = working.getStopLossPrice();
        boolean stateChanged = false;
        boolean activated = false;
        List<String> reasons = new ArrayList<>();

        boolean anyFilled = working.getTakeProfitLevels().stream().anyMatch(TakeProfitLevel::isFilled);
        if (riskProperties.isBreakevenAfterFirstTarget() && anyFilled && !working.isBreakevenApplied()) {
            working.setBreakevenApplied(true);
            stateChanged = true;
            double tightened = tighten(side, stop, working.getEntryPrice());
            if (tightened != stop) {
                stop = tightened;
                reasons.add("BREAKEVEN");
            }
        }

        TrailingStopState trailing = working.getTrailingStop();
        RiskProperties.Trailing trailingConfig = riskProperties.getTrailing();
        if (trailingConfig.isEnabled() && trailing != null) {
            if (!trailing.isActive()) {
                if (working.unrealizedReturn(price) >= trailingConfig.getActivationProfit()) {
                    trailing.setActive(true);
                    trailing.setWaterMark(side == PositionSide.LONG
                            ? Math.max(trailing.getWaterMark(), price)
                            : Math.min(trailing.getWaterMark(), price));
                    stateChanged = true;
                    activated = true;
                }
            } else {
                double mark = side == PositionSide.LONG
                        ? Math.max(trailing.getWaterMark(), price)
                        : Math.min(trailing.getWaterMark(), price);
                if (mark != trailing.getWaterMark()) {
                    trailing.setWaterMark(mark);
                    stateChanged = true;
                }
            }
            if (trailing.isActive()) {
                double candidate = side == PositionSide.LONG
                        ? trailing.getWaterMark() * (1.0 - trailing.getTrailDistance())
                        : trailing.getWaterMark() * (1.0 + trailing.getTrailDistance());
                double tightened = tighten(side, stop, candidate);
                if (tightened != stop) {
                    stop = tightened;
                    reasons.add("TRAILING_STOP");
                }
            }
        }

        PositionAction action = null;
        if (stop != working.getStopLossPrice()) {
            action = PositionAction.updateStop(working, stop, price, String.join("+", reasons));
            exitDispatcher.dispatch(action);
            working.setStopLossPrice(stop);
        }
        if (stateChanged || action != null) {
            working.setUpdatedAt(clock.instant());
            commit(working);
        }
        if (activated) {
            log.info("🚀 Trailing activated id={} {} mark={}", working.getId(), working.getSymbol(), trailing.getWaterMark());
            publish(working, PositionEvent.EventType.TRAILING_ACTIVATED, price, "mark=" + trailing.getWaterMark());
        }
        if (action != null) {
            log.info("🔒 Stop moved id={} {} stop={} reason={}", working.getId(), working.getSymbol(), stop, action.reason());
            publish(working, PositionEvent.EventType.STOP_UPDATED, price, action.reason());
        }
        return Optional.ofNullable(action);
    }

    private static double tighten(PositionSide side, double currentStop, double candidate) {
        return side == PositionSide.LONG ? Math.max(currentStop, candidate) : Math.min(currentStop, candidate);
    }

    private static boolean isStopHit(Position position, double price) {
        return position.getSide() == PositionSide.LONG
                ? price <= position.getStopLossPrice()
                : price >= position.getStopLossPrice();
    }

    /**
     * Indices of the take-profit levels nearest first: ascending price for longs,
     * descending for shorts.
     */
    private static List<Integer> levelOrder(Position position) {
        List<TakeProfitLevel> levels = position.getTakeProfitLevels();
        Comparator<Integer> byPrice = Comparator.comparingDouble(i -> levels.get(i).getPrice());
        return IntStream.range(0, levels.size())
                .boxed()
                .sorted(position.getSide() == PositionSide.LONG ? byPrice : byPrice.reversed())
                .toList();
    }

    private void markClosed(Position working, String reason) {
        Instant now = clock.instant();
        working.setClosedFraction(1.0);
        working.setStatus(PositionStatus.CLOSED);
        working.setExitReason(reason);
        working.setClosedAt(now);
        working.setUpdatedAt(now);
    }

    private void commit(Position working) {
        if (working.isOpen()) {
            openPositions.put(working.getId(), working);
            return;
        }
        openPositions.remove(working.getId());
        locks.remove(working.getId());
        closedPositions.addFirst(working);
        while (closedPositions.size() > CLOSED_HISTORY) {
            closedPositions.pollLast();
        }
    }

    private void publish(Position position, PositionEvent.EventType type, double price, String detail) {
        persistenceService.savePositionEvent(PositionEvent.builder()
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .type(type)
                .price(price)
                .stopLossPrice(position.getStopLossPrice())
                .closedFraction(position.getClosedFraction())
                .status(position.getStatus())
                .detail(detail)
                .timestamp(clock.instant())
                .build());
    }
}
