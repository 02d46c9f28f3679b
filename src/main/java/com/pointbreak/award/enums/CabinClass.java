package com.pointbreak.award.enums;

import com.pointbreak.award.exception.UnsupportedCabinClassException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Cabin buckets for which both the award and the cash responses expose a
 * pricing block that can be cross-referenced.
 */
public enum CabinClass {
    MAIN,
    PREMIUM_ECONOMY;

    public static CabinClass fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedCabinClassException("Cabin class is required. Must be one of " + supportedValues());
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedCabinClassException(
                        "Invalid cabin class: " + normalized + ". Must be one of " + supportedValues()));
    }

    public String lowerName() {
        return name().toLowerCase(Locale.ROOT);
    }

    private static String supportedValues() {
        return Arrays.toString(values());
    }
}
