package com.quantcore.engine.service.position;

import com.quantcore.engine.exception.InvalidParameterException;
import com.quantcore.engine.exception.PositionNotFoundException;
import com.quantcore.engine.model.OrderSide;
import com.quantcore.engine.model.Position;
import com.quantcore.engine.model.PositionFill;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PositionLedgerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new PositionLedger(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PositionFill fill(String symbol, OrderSide side, double quantity, double price) {
        return PositionFill.builder()
                .symbol(symbol)
                .exchange("binance")
                .side(side)
                .quantity(quantity)
                .price(price)
                .stopLoss(side == OrderSide.BUY ? price * 0.97 : price * 1.03)
                .takeProfit(side == OrderSide.BUY ? price * 1.06 : price * 0.94)
                .strategyId("rsi")
                .orderId("order-1")
                .build();
    }

    @Test
    void openRecordsEntryAndDefaultsTimestampToClock() {
        Position position = ledger.open(fill("BTCUSD", OrderSide.BUY, 2.0, 100.0));

        assertThat(position.getPositionId()).isNotBlank();
        assertThat(position.getEntryPrice()).isEqualTo(100.0);
        assertThat(position.getCurrentPrice()).isEqualTo(100.0);
        assertThat(position.getOpenedAt()).isEqualTo(NOW);
        assertThat(position.getOpenOrderId()).isEqualTo("order-1");
        assertThat(ledger.findById(position.getPositionId())).isPresent();
    }

    @Test
    void openRejectsInvalidFill() {
        assertThatThrownBy(() -> ledger.open(fill(" ", OrderSide.BUY, 0.0, -1.0)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("symbol")
                .hasMessageContaining("quantity")
                .hasMessageContaining("price");
        assertThat(ledger.openPositions()).isEmpty();
    }

    @Test
    void returnedPositionsAreCopies() {
        Position position = ledger.open(fill("BTCUSD", OrderSide.BUY, 2.0, 100.0));

        position.setQuantity(99.0);

        assertThat(ledger.findById(position.getPositionId()).orElseThrow().getQuantity()).isEqualTo(2.0);
    }

    @Test
    void sameSideFillAveragesEntry() {
        Position position = ledger.open(fill("BTCUSD", OrderSide.BUY, 1.0, 100.0));

        Position updated = ledger.applyFill(position.getPositionId(), OrderSide.BUY, 1.0, 110.0);

        assertThat(updated.getQuantity()).isEqualTo(2.0);
        assertThat(updated.getEntryPrice()).isCloseTo(105.0, within(1e-9));
        assertThat(ledger.totalRealizedPnL()).isZero();
    }

    @Test
    void oppositeFillReducesAndRealizes() {
        Position position = ledger.open(fill("BTCUSD", OrderSide.BUY, 2.0, 100.0));

        Position updated = ledger.applyFill(position.getPositionId(), OrderSide.SELL, 0.5, 110.0);

        assertThat(updated.getQuantity()).isEqualTo(1.5);
        assertThat(ledger.totalRealizedPnL()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void fillToZeroClosesPosition() {
        Position position = ledger.open(fill("BTCUSD", OrderSide.SELL, 1.0, 100.0));

        Position updated = ledger.applyFill(position.getPositionId(), OrderSide.BUY, 1.0, 90.0);

        assertThat(updated.getQuantity()).isZero();
        assertThat(ledger.findById(position.getPositionId())).isEmpty();
        assertThat(ledger.totalRealizedPnL()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void applyFillValidatesInput() {
        Position position = ledger.open(fill("BTCUSD", OrderSide.BUY, 1.0, 100.0));

        assertThatThrownBy(() -> ledger.applyFill(position.getPositionId(), OrderSide.SELL, 0.0, 100.0))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> ledger.applyFill("missing", OrderSide.SELL, 1.0, 100.0))
                .isInstanceOf(PositionNotFoundException.class);
    }

    @Test
    void markPriceUpdatesOnlyMatchingSymbol() {
        ledger.open(fill("BTCUSD", OrderSide.BUY, 1.0, 100.0));
        ledger.open(fill("BTCUSD", OrderSide.SELL, 1.0, 100.0));
        ledger.open(fill("ETHUSD", OrderSide.BUY, 1.0, 50.0));

        int marked = ledger.markPrice("BTCUSD", 96.0);

        assertThat(marked).isEqualTo(2);
        assertThat(ledger.totalUnrealizedPnL()).isCloseTo(0.0, within(1e-9));
        assertThat(ledger.findBySymbol("ETHUSD")).singleElement()
                .satisfies(p -> assertThat(p.getCurrentPrice()).isEqualTo(50.0));
    }

    @Test
    void exitLevelsAreReported() {
        Position longPosition = ledger.open(fill("BTCUSD", OrderSide.BUY, 1.0, 100.0));
        Position shortPosition = ledger.open(fill("ETHUSD", OrderSide.SELL, 1.0, 100.0));

        ledger.markPrice("BTCUSD", 96.0);
        ledger.markPrice("ETHUSD", 93.0);

        assertThat(ledger.stopLossHits()).extracting(Position::getPositionId)
                .containsExactly(longPosition.getPositionId());
        assertThat(ledger.takeProfitHits()).extracting(Position::getPositionId)
                .containsExactly(shortPosition.getPositionId());
    }

    @Test
    void netQuantityNetsLongsAgainstShorts() {
        ledger.open(fill("BTCUSD", OrderSide.BUY, 3.0, 100.0));
        ledger.open(fill("BTCUSD", OrderSide.SELL, 1.0, 100.0));

        assertThat(ledger.netQuantity("BTCUSD")).isEqualTo(2.0);
        assertThat(ledger.findByStrategy("rsi")).hasSize(2);
        assertThat(ledger.findByStrategy("macd")).isEmpty();
    }

    @Test
    void closeRealizesAtMarkedPriceAndCannotRepeat() {
        Position position = ledger.open(fill("BTCUSD", OrderSide.BUY, 2.0, 100.0));
        ledger.markPrice("BTCUSD", 103.0);

        Position closed = ledger.close(position.getPositionId());

        assertThat(closed.getUnrealizedPnL()).isCloseTo(6.0, within(1e-9));
        assertThat(ledger.totalRealizedPnL()).isCloseTo(6.0, within(1e-9));
        assertThat(ledger.openPositions()).isEmpty();
        assertThatThrownBy(() -> ledger.close(position.getPositionId()))
                .isInstanceOf(PositionNotFoundException.class)
                .hasMessageContaining(position.getPositionId());
    }
}
