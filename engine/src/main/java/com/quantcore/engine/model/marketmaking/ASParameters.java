package com.quantcore.engine.model.marketmaking;

import com.quantcore.engine.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Avellaneda-Stoikov quoting parameters. Instances are always valid: the
 * builder rejects a combination with every violated constraint listed.
 */
@Value
public class ASParameters {

    /** Risk aversion, (0, 10]. */
    double gamma;
    /** Order arrival decay / liquidity, (0, 100]. */
    double kappa;
    /** Volatility as a fraction of price, (0, 5]. */
    double sigma;
    /** Remaining session horizon normalized from 1.0 to 0.0. */
    double timeRemaining;
    double maxInventory;
    double targetInventory;
    double minSpreadBps;
    double maxSpreadBps;

    @Builder(toBuilder = true)
    private ASParameters(double gamma, double kappa, double sigma, double timeRemaining, double maxInventory,
                         double targetInventory, double minSpreadBps, double maxSpreadBps) {
        List<String> errors = validate(gamma, kappa, sigma, timeRemaining, maxInventory, minSpreadBps, maxSpreadBps);
        if (!errors.isEmpty()) {
            throw new InvalidParameterException(errors);
        }
        this.gamma = gamma;
        this.kappa = kappa;
        this.sigma = sigma;
        this.timeRemaining = timeRemaining;
        this.maxInventory = maxInventory;
        this.targetInventory = targetInventory;
        this.minSpreadBps = minSpreadBps;
        this.maxSpreadBps = maxSpreadBps;
    }

    public static List<String> validate(double gamma, double kappa, double sigma, double timeRemaining,
                                        double maxInventory, double minSpreadBps, double maxSpreadBps) {
        List<String> errors = new ArrayList<>();
        if (!(gamma > 0 && gamma <= 10.0)) {
            errors.add("Gamma must be between 0 and 10.0 (got " + gamma + ")");
        }
        if (!(kappa > 0 && kappa <= 100.0)) {
            errors.add("Kappa must be between 0 and 100.0 (got " + kappa + ")");
        }
        if (!(sigma > 0 && sigma <= 5.0)) {
            errors.add("Sigma must be between 0 and 5.0 (got " + sigma + ")");
        }
        if (!(timeRemaining >= 0 && timeRemaining <= 1.0)) {
            errors.add("T must be between 0.0 and 1.0 (got " + timeRemaining + ")");
        }
        if (!(maxInventory > 0)) {
            errors.add("MaxInventory must be positive (got " + maxInventory + ")");
        }
        if (!(minSpreadBps >= 0)) {
            errors.add("MinSpreadBps must be non-negative (got " + minSpreadBps + ")");
        }
        if (!(maxSpreadBps > minSpreadBps)) {
            errors.add("MaxSpreadBps (" + maxSpreadBps + ") must be greater than MinSpreadBps (" + minSpreadBps + ")");
        }
        return errors;
    }

    public static ASParameters conservative(double maxInventory) {
        return ASParameters.builder()
                .gamma(0.1)
                .kappa(1.5)
                .sigma(0.5)
                .timeRemaining(1.0)
                .maxInventory(maxInventory)
                .targetInventory(0.0)
                .minSpreadBps(10.0)
                .maxSpreadBps(50.0)
                .build();
    }

    public static ASParameters aggressive(double maxInventory) {
        return ASParameters.builder()
                .gamma(0.01)
                .kappa(5.0)
                .sigma(0.3)
                .timeRemaining(1.0)
                .maxInventory(maxInventory)
                .targetInventory(0.0)
                .minSpreadBps(2.0)
                .maxSpreadBps(20.0)
                .build();
    }

    public ASParameters withTimeRemaining(double timeRemaining) {
        return toBuilder().timeRemaining(timeRemaining).build();
    }

    public static class ASParametersBuilder {
        private double targetInventory = 0.0;
        private double minSpreadBps = 5.0;
        private double maxSpreadBps = 100.0;
    }

    @Override
    public String toString() {
        return String.format("ASParameters: gamma=%.3f, kappa=%.2f, sigma=%.2f, T=%.2f, MaxInv=%.4f, Spread=[%.1f-%.1f] bps",
                gamma, kappa, sigma, timeRemaining, maxInventory, minSpreadBps, maxSpreadBps);
    }
}
