package com.pointbreak.award.utils;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Slf4j
public class CppCalculator {

    private static final int CPP_DECIMAL_PLACES = 2;
    private static final BigDecimal CENTS_PER_DOLLAR = BigDecimal.valueOf(100);

    private CppCalculator() {
    }

    /**
     * Cents-per-point value of an award redemption.
     * Formula: CPP = (cash - taxes) / points * 100, rounded half-up to 2 places
     *
     * @param cashPrice total cash fare in USD
     * @param taxes     taxes and fees still payable on the award ticket, in USD
     * @param points    total points required, must be positive
     * @return cents per point
     */
    public static BigDecimal calculateCpp(BigDecimal cashPrice, BigDecimal taxes, long points) {
        if (points <= 0) {
            throw new IllegalArgumentException("Points value must be greater than zero to compute CPP.");
        }
        if (cashPrice == null || taxes == null) {
            throw new IllegalArgumentException("Cash price and taxes are required to compute CPP.");
        }

        BigDecimal cpp = cashPrice.subtract(taxes)
                .multiply(CENTS_PER_DOLLAR)
                .divide(BigDecimal.valueOf(points), CPP_DECIMAL_PLACES, RoundingMode.HALF_UP);

        log.debug("Calculated CPP {} from cash={}, taxes={}, points={}", cpp, cashPrice, taxes, points);
        return cpp;
    }

    /**
     * Money amounts are reported at cent precision.
     */
    public static BigDecimal toCents(BigDecimal amount) {
        return amount.setScale(CPP_DECIMAL_PLACES, RoundingMode.HALF_UP);
    }
}
