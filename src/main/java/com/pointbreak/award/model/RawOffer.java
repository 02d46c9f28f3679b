package com.pointbreak.award.model;

import com.pointbreak.award.enums.CabinClass;
import com.pointbreak.award.enums.SearchType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;

/**
 * One priced flight option as returned by a single award or revenue search.
 */
@Value
@Builder
public class RawOffer {
    SearchType searchType;
    String hash;
    String flightNumber;
    LocalTime departureTime;
    LocalTime arrivalTime;
    @Builder.Default
    Map<CabinClass, PriceBlock> pricing = Map.of();

    public boolean hasHash() {
        return hash != null && !hash.isBlank();
    }

    public Optional<PriceBlock> pricingFor(CabinClass cabinClass) {
        return Optional.ofNullable(pricing.get(cabinClass));
    }
}
