package com.quantcore.engine.service.marketmaking;

import com.quantcore.engine.config.MarketMakingProperties;
import com.quantcore.engine.model.marketmaking.ASParameters;
import com.quantcore.engine.model.marketmaking.ASSignal;
import com.quantcore.engine.model.marketmaking.OrderBookSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Closed-form Avellaneda-Stoikov quoting.
 *
 * <p>With normalized inventory {@code q = (inventory - target) / maxInventory}:
 * <ul>
 *   <li>reservation price {@code r = mid * (1 - q * gamma * sigma^2 * T)}</li>
 *   <li>optimal spread {@code delta = gamma * sigma^2 * T + (2 / gamma) * ln(1 + gamma / kappa)},
 *       as a fraction of mid, clamped to the configured bps band</li>
 *   <li>{@code bid = r - r * delta / 2}, {@code ask = r + r * delta / 2}, so the spread
 *       measured on the quote itself equals the clamped value</li>
 * </ul>
 * Sigma is read as a fraction of price and T as the remaining share of the
 * session (1.0 at the open, 0.0 at the close).
 *
 * <p>A quote with nothing to offer on one side (inventory at its limit) is
 * not executable and is returned invalid.
 *
 * <p>Never throws: every rejected input becomes an invalid {@link ASSignal}
 * stamped with the snapshot's timestamp.
 */
@Component
@Slf4j
public class AvellanedaStoikovQuoter {

    private final double baseOrderSize;

    @Autowired
    public AvellanedaStoikovQuoter(MarketMakingProperties properties) {
        this(properties.getBaseOrderSize());
    }

    public AvellanedaStoikovQuoter(double baseOrderSize) {
        this.baseOrderSize = baseOrderSize;
    }

    public ASSignal quote(OrderBookSnapshot snapshot, ASParameters params, double inventory) {
        if (snapshot == null) {
            log.warn("Rejected quote: order book snapshot is missing");
            return ASSignal.invalid(null, "Order book snapshot is missing");
        }
        String symbol = snapshot.getSymbol();
        Instant at = snapshot.getTimestamp();
        try {
            if (params == null) {
                return reject(symbol, at, "Quoting parameters are missing");
            }
            if (!snapshot.isValid()) {
                return reject(symbol, at, "Invalid order book: " + snapshot);
            }
            if (!Double.isFinite(inventory)) {
                return reject(symbol, at, "Inventory is not a finite number");
            }
            double mid = snapshot.getMidPrice();
            if (mid <= 0) {
                return reject(symbol, at, "Mid price must be positive (got " + mid + ")");
            }

            double gamma = params.getGamma();
            double variance = params.getSigma() * params.getSigma();
            double horizon = params.getTimeRemaining();
            double q = (inventory - params.getTargetInventory()) / params.getMaxInventory();

            double reservation = mid * (1.0 - q * gamma * variance * horizon);

            double modelSpread = gamma * variance * horizon + (2.0 / gamma) * Math.log(1.0 + gamma / params.getKappa());
            double modelSpreadBps = modelSpread * 10_000.0;
            double spreadBps = Math.max(params.getMinSpreadBps(), Math.min(params.getMaxSpreadBps(), modelSpreadBps));
            boolean clamped = spreadBps != modelSpreadBps;
            double halfSpread = reservation * spreadBps / 10_000.0 / 2.0;

            double bid = reservation - halfSpread;
            double ask = reservation + halfSpread;
            if (bid <= 0 || ask <= 0) {
                return reject(symbol, at, String.format("Quote prices must be positive (bid %.8f, ask %.8f)", bid, ask));
            }

            double skew = Math.max(-1.0, Math.min(1.0, q));
            double bidQuantity = Math.max(0.0, Math.min(baseOrderSize * (1.0 - skew), params.getMaxInventory() - inventory));
            double askQuantity = Math.max(0.0, Math.min(baseOrderSize * (1.0 + skew), params.getMaxInventory() + inventory));
            if (bidQuantity <= 0 || askQuantity <= 0) {
                return reject(symbol, at, String.format("Inventory %s is at its limit %s: one-sided quote (bid qty %s, ask qty %s)",
                        inventory, params.getMaxInventory(), bidQuantity, askQuantity));
            }

            double confidence = 1.0 - 0.5 * Math.min(Math.abs(q), 1.0);
            if (clamped) {
                confidence *= 0.5;
            }

            ASSignal signal = ASSignal.builder()
                    .symbol(symbol)
                    .timestamp(at)
                    .bidPrice(bid)
                    .askPrice(ask)
                    .bidQuantity(bidQuantity)
                    .askQuantity(askQuantity)
                    .reservationPrice(reservation)
                    .optimalSpread(2.0 * halfSpread)
                    .currentInventory(inventory)
                    .confidence(confidence)
                    .build();
            log.debug("Quote for {}: {} (model spread {} bps, q={})", symbol, signal, modelSpreadBps, q);
            return signal;
        } catch (RuntimeException e) {
            log.warn("Quote computation failed for {}: {}", symbol, e.getMessage());
            return ASSignal.invalid(symbol, at, "Quote computation failed: " + e.getMessage());
        }
    }

    private static ASSignal reject(String symbol, Instant at, String reason) {
        log.warn("Rejected quote for {}: {}", symbol, reason);
        return ASSignal.invalid(symbol, at, reason);
    }
}
