package com.pointbreak.award.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * An award offer joined with the cash offer for the same flight, priced in cents per point.
 */
@Value
@Builder
public class MatchedFlight {

    @JsonProperty("flight_number")
    String flightNumber;

    @JsonProperty("departure_time")
    @JsonFormat(pattern = "HH:mm")
    LocalTime departureTime;

    @JsonProperty("arrival_time")
    @JsonFormat(pattern = "HH:mm")
    LocalTime arrivalTime;

    @JsonProperty("points_required")
    long pointsRequired;

    @JsonProperty("cash_price_usd")
    BigDecimal cashPriceUsd;

    @JsonProperty("taxes_fees_usd")
    BigDecimal taxesFeesUsd;

    @JsonProperty("cpp")
    BigDecimal cpp;
}
