package com.quantcore.engine.service.position;

import com.quantcore.engine.exception.InvalidParameterException;
import com.quantcore.engine.exception.PositionNotFoundException;
import com.quantcore.engine.model.OrderSide;
import com.quantcore.engine.model.Position;
import com.quantcore.engine.model.PositionFill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory book of open positions. Fills open and update positions, price
 * ticks mark them, and a position leaves the book when it is closed or its
 * quantity reaches zero. Each mutation of one position runs inside the map's
 * per-key compute so concurrent updates to the same position are serialized.
 */
@Service
@Slf4j
public class PositionLedger {

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final DoubleAdder realizedPnL = new DoubleAdder();
    private final Clock clock;

    public PositionLedger() {
        this(Clock.systemUTC());
    }

    public PositionLedger(Clock clock) {
        this.clock = clock;
    }

    public Position open(PositionFill fill) {
        List<String> violations = new ArrayList<>();
        if (fill.getSymbol() == null || fill.getSymbol().isBlank()) {
            violations.add("symbol is required");
        }
        if (fill.getSide() == null) {
            violations.add("side is required");
        }
        if (!(fill.getQuantity() > 0)) {
            violations.add("quantity must be positive (got " + fill.getQuantity() + ")");
        }
        if (!(fill.getPrice() > 0)) {
            violations.add("price must be positive (got " + fill.getPrice() + ")");
        }
        if (!violations.isEmpty()) {
            throw new InvalidParameterException(violations);
        }

        Instant at = fill.getTimestamp() == null ? clock.instant() : fill.getTimestamp();
        Position position = Position.builder()
                .positionId(UUID.randomUUID().toString())
                .symbol(fill.getSymbol())
                .exchange(fill.getExchange())
                .side(fill.getSide())
                .quantity(fill.getQuantity())
                .entryPrice(fill.getPrice())
                .currentPrice(fill.getPrice())
                .stopLoss(fill.getStopLoss())
                .takeProfit(fill.getTakeProfit())
                .openedAt(at)
                .updatedAt(at)
                .strategyId(fill.getStrategyId())
                .openOrderId(fill.getOrderId())
                .build();
        positions.put(position.getPositionId(), position);
        log.info("Opened {} position {} in {}: {} @ {}", position.getSide(), position.getPositionId(),
                position.getSymbol(), position.getQuantity(), position.getEntryPrice());
        return copy(position);
    }

    /**
     * Applies a partial fill. A fill that reduces the quantity to zero closes
     * the position and the returned snapshot reports quantity 0.
     */
    public Position applyFill(String positionId, OrderSide side, double quantity, double price) {
        if (side == null || !(quantity > 0) || !(price > 0)) {
            throw new InvalidParameterException(String.format("Invalid fill for %s: %s %s @ %s",
                    positionId, side, quantity, price));
        }
        Position[] updated = new Position[1];
        positions.computeIfPresent(positionId, (id, position) -> {
            double realized = position.applyFill(side, quantity, price, clock.instant());
            realizedPnL.add(realized);
            updated[0] = copy(position);
            if (position.isClosed()) {
                log.info("Position {} in {} closed by fill, realized {}", id, position.getSymbol(), realized);
                return null;
            }
            log.debug("Position {} updated by fill: qty {}, entry {}", id, position.getQuantity(),
                    position.getEntryPrice());
            return position;
        });
        if (updated[0] == null) {
            throw new PositionNotFoundException(positionId);
        }
        return updated[0];
    }

    /**
     * Marks every open position in {@code symbol} to {@code price}; returns how
     * many were updated.
     */
    public int markPrice(String symbol, double price) {
        Instant now = clock.instant();
        int[] marked = new int[1];
        for (String id : positions.keySet()) {
            positions.computeIfPresent(id, (key, position) -> {
                if (Objects.equals(position.getSymbol(), symbol)) {
                    position.markPrice(price, now);
                    marked[0]++;
                }
                return position;
            });
        }
        return marked[0];
    }

    /**
     * Removes the position, realizing its PnL at the last marked price.
     */
    public Position close(String positionId) {
        Position removed = positions.remove(positionId);
        if (removed == null) {
            throw new PositionNotFoundException(positionId);
        }
        realizedPnL.add(removed.getUnrealizedPnL());
        log.info("Closed position {} in {} with PnL {}", positionId, removed.getSymbol(), removed.getUnrealizedPnL());
        return removed;
    }

    public Optional<Position> findById(String positionId) {
        Position position = positions.get(positionId);
        return Optional.ofNullable(position == null ? null : copy(position));
    }

    public List<Position> findBySymbol(String symbol) {
        return select(position -> Objects.equals(position.getSymbol(), symbol));
    }

    public List<Position> findByStrategy(String strategyId) {
        return select(position -> Objects.equals(position.getStrategyId(), strategyId));
    }

    public List<Position> openPositions() {
        return select(position -> true);
    }

    public List<Position> stopLossHits() {
        return select(Position::isStopLossHit);
    }

    public List<Position> takeProfitHits() {
        return select(Position::isTakeProfitHit);
    }

    public double totalUnrealizedPnL() {
        return positions.values().stream().mapToDouble(Position::getUnrealizedPnL).sum();
    }

    public double totalRealizedPnL() {
        return realizedPnL.sum();
    }

    /**
     * Long quantity minus short quantity for the symbol.
     */
    public double netQuantity(String symbol) {
        return positions.values().stream()
                .filter(position -> Objects.equals(position.getSymbol(), symbol))
                .mapToDouble(position -> position.getSide().sign() * position.getQuantity())
                .sum();
    }

    private List<Position> select(Predicate<Position> filter) {
        return positions.values().stream()
                .filter(filter)
                .map(PositionLedger::copy)
                .collect(Collectors.toList());
    }

    private static Position copy(Position position) {
        return position.toBuilder().build();
    }
}
