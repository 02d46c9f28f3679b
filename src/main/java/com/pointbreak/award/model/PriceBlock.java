package com.pointbreak.award.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Price components of one cabin bucket on one side of a search. Any component may be absent.
 */
@Value
@Builder
public class PriceBlock {
    Long pointsPerPassenger;
    BigDecimal cashAmount;
    BigDecimal taxesAmount;
}
