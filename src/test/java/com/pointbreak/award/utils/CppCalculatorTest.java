package com.pointbreak.award.utils;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CppCalculatorTest {

    @Test
    void calculateCpp_roundsHalfUpToTwoPlaces() {
        // (289.00 - 5.60) / 12500 * 100 = 2.2672
        assertThat(CppCalculator.calculateCpp(new BigDecimal("289.00"), new BigDecimal("5.60"), 12500))
                .isEqualByComparingTo("2.27");
        // (100.00 - 0) / 8000 * 100 = 1.25
        assertThat(CppCalculator.calculateCpp(new BigDecimal("100.00"), BigDecimal.ZERO, 8000))
                .isEqualByComparingTo("1.25");
        // 0.125 rounds up
        assertThat(CppCalculator.calculateCpp(new BigDecimal("10.00"), BigDecimal.ZERO, 8000))
                .isEqualByComparingTo("0.13");
    }

    @Test
    void calculateCpp_taxesAboveCash_isNegative() {
        assertThat(CppCalculator.calculateCpp(new BigDecimal("5.00"), new BigDecimal("15.00"), 1000))
                .isEqualByComparingTo("-1.00");
    }

    @Test
    void calculateCpp_nonPositivePoints_throws() {
        assertThatThrownBy(() -> CppCalculator.calculateCpp(BigDecimal.TEN, BigDecimal.ONE, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CppCalculator.calculateCpp(BigDecimal.TEN, BigDecimal.ONE, -5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toCents_scalesToTwoPlaces() {
        assertThat(CppCalculator.toCents(new BigDecimal("289")).toPlainString()).isEqualTo("289.00");
        assertThat(CppCalculator.toCents(new BigDecimal("5.605")).toPlainString()).isEqualTo("5.61");
    }
}
