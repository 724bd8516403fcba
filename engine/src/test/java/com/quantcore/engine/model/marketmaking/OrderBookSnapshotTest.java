package com.quantcore.engine.model.marketmaking;

import com.quantcore.engine.exception.InvalidMarketStateException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OrderBookSnapshotTest {

    private static OrderBookSnapshot.OrderBookSnapshotBuilder book() {
        return OrderBookSnapshot.builder()
                .symbol("BTCUSD")
                .exchange("binance")
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"));
    }

    private static OrderBookSnapshot standardBook() {
        return book()
                .bid(OrderBookLevel.of(99.0, 3.0))
                .bid(OrderBookLevel.of(98.0, 1.0))
                .ask(OrderBookLevel.of(101.0, 1.0))
                .ask(OrderBookLevel.of(102.0, 1.0))
                .build();
    }

    @Test
    void derivesTopOfBookMetrics() {
        OrderBookSnapshot snapshot = standardBook();

        assertThat(snapshot.isValid()).isTrue();
        assertThat(snapshot.getBestBid()).isEqualTo(99.0);
        assertThat(snapshot.getBestAsk()).isEqualTo(101.0);
        assertThat(snapshot.getSpread()).isEqualTo(2.0);
        assertThat(snapshot.getMidPrice()).isEqualTo(100.0);
        assertThat(snapshot.getSpreadPercent()).isCloseTo(0.02, within(1e-12));
        // heavy bid pulls the microprice toward the ask
        assertThat(snapshot.getMicroprice()).isCloseTo((99.0 * 1.0 + 101.0 * 3.0) / 4.0, within(1e-12));
    }

    @Test
    void depthAndImbalanceOverTopLevels() {
        OrderBookSnapshot snapshot = standardBook();

        assertThat(snapshot.getBidVolume(5)).isEqualTo(4.0);
        assertThat(snapshot.getAskVolume(5)).isEqualTo(2.0);
        assertThat(snapshot.getBidDepth(1)).isEqualTo(297.0);
        assertThat(snapshot.getTotalDepth(5)).isEqualTo(99 * 3 + 98 + 101 + 102.0);
        assertThat(snapshot.getOrderBookImbalance(5)).isCloseTo(2.0 / 6.0, within(1e-12));
        assertThat(snapshot.getOrderBookImbalance(5)).isBetween(-1.0, 1.0);
    }

    @Test
    void zeroVolumeGuards() {
        OrderBookSnapshot snapshot = book()
                .bid(OrderBookLevel.of(99.0, 0.0))
                .ask(OrderBookLevel.of(101.0, 0.0))
                .build();

        assertThat(snapshot.getOrderBookImbalance(5)).isZero();
        assertThat(snapshot.getWeightedMidPrice(5)).isEqualTo(snapshot.getMidPrice());
        assertThat(snapshot.getMicroprice()).isEqualTo(snapshot.getMidPrice());
    }

    @Test
    void crossedBookIsInvalid() {
        OrderBookSnapshot crossed = book()
                .bid(OrderBookLevel.of(101.0, 1.0))
                .ask(OrderBookLevel.of(100.0, 1.0))
                .build();
        OrderBookSnapshot locked = book()
                .bid(OrderBookLevel.of(100.0, 1.0))
                .ask(OrderBookLevel.of(100.0, 1.0))
                .build();

        assertThat(crossed.isValid()).isFalse();
        assertThat(locked.isValid()).isFalse();
        assertThatThrownBy(crossed::requireValid)
                .isInstanceOf(InvalidMarketStateException.class)
                .hasMessageContaining("crossed");
    }

    @Test
    void unsortedOrEmptySidesAreInvalid() {
        OrderBookSnapshot unsortedBids = book()
                .bid(OrderBookLevel.of(98.0, 1.0))
                .bid(OrderBookLevel.of(99.0, 1.0))
                .ask(OrderBookLevel.of(101.0, 1.0))
                .build();
        OrderBookSnapshot unsortedAsks = book()
                .bid(OrderBookLevel.of(99.0, 1.0))
                .ask(OrderBookLevel.of(102.0, 1.0))
                .ask(OrderBookLevel.of(101.0, 1.0))
                .build();
        OrderBookSnapshot noAsks = book().bid(OrderBookLevel.of(99.0, 1.0)).build();

        assertThat(unsortedBids.isValid()).isFalse();
        assertThat(unsortedAsks.isValid()).isFalse();
        assertThat(noAsks.isValid()).isFalse();
    }

    @Test
    void weightedMidUsesVolumeWeightedSidePrices() {
        OrderBookSnapshot snapshot = standardBook();
        double bidPrice = (99.0 * 3 + 98.0) / 4.0;
        double askPrice = (101.0 + 102.0) / 2.0;

        assertThat(snapshot.getWeightedMidPrice(5))
                .isCloseTo((bidPrice * 2.0 + askPrice * 4.0) / 6.0, within(1e-12));
    }
}
