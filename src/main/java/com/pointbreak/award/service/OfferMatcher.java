package com.pointbreak.award.service;

import com.pointbreak.award.enums.CabinClass;
import com.pointbreak.award.model.MatchedFlight;
import com.pointbreak.award.model.PriceBlock;
import com.pointbreak.award.model.RawOffer;
import com.pointbreak.award.utils.CppCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.*;

/**
 * Joins award and cash offers on their identity hash and prices each pair in cents per point.
 * Pairs with missing pricing or a zero point price are dropped, not reported.
 */
@Slf4j
@Component
public class OfferMatcher {

    public List<MatchedFlight> match(List<RawOffer> awardOffers, List<RawOffer> cashOffers,
                                     CabinClass cabinClass, int passengerCount) {
        // a repeated hash keeps its last offer; awards stay in order of first appearance
        Map<String, RawOffer> cashByHash = new HashMap<>();
        for (RawOffer cash : cashOffers) {
            if (cash.hasHash()) {
                cashByHash.put(cash.getHash(), cash);
            }
        }
        Map<String, RawOffer> awardByHash = new LinkedHashMap<>();
        for (RawOffer award : awardOffers) {
            if (award.hasHash()) {
                awardByHash.put(award.getHash(), award);
            }
        }

        List<MatchedFlight> matched = new ArrayList<>();
        int dropped = 0;
        for (RawOffer award : awardByHash.values()) {
            RawOffer cash = cashByHash.get(award.getHash());
            if (cash == null) {
                continue;
            }
            Optional<MatchedFlight> flight = price(award, cash, cabinClass, passengerCount);
            if (flight.isPresent()) {
                matched.add(flight.get());
            } else {
                dropped++;
            }
        }

        log.debug("Matched {} flights for {} ({} hash pairs dropped for incomplete pricing)",
                matched.size(), cabinClass, dropped);
        return matched;
    }

    private Optional<MatchedFlight> price(RawOffer award, RawOffer cash, CabinClass cabinClass, int passengerCount) {
        PriceBlock awardBlock = award.pricingFor(cabinClass).orElse(null);
        PriceBlock cashBlock = cash.pricingFor(cabinClass).orElse(null);
        if (awardBlock == null || cashBlock == null) {
            return Optional.empty();
        }

        Long perPassenger = awardBlock.getPointsPerPassenger();
        BigDecimal cashPrice = cashBlock.getCashAmount();
        BigDecimal taxes = awardBlock.getTaxesAmount() != null ? awardBlock.getTaxesAmount() : cashBlock.getTaxesAmount();
        String flightNumber = firstNonNull(award.getFlightNumber(), cash.getFlightNumber());
        LocalTime departure = firstNonNull(award.getDepartureTime(), cash.getDepartureTime());
        LocalTime arrival = firstNonNull(award.getArrivalTime(), cash.getArrivalTime());

        if (perPassenger == null || cashPrice == null || taxes == null
                || flightNumber == null || departure == null || arrival == null) {
            return Optional.empty();
        }

        long pointsRequired = perPassenger * passengerCount;
        if (pointsRequired <= 0) {
            return Optional.empty();
        }

        return Optional.of(MatchedFlight.builder()
                .flightNumber(flightNumber)
                .departureTime(departure)
                .arrivalTime(arrival)
                .pointsRequired(pointsRequired)
                .cashPriceUsd(CppCalculator.toCents(cashPrice))
                .taxesFeesUsd(CppCalculator.toCents(taxes))
                .cpp(CppCalculator.calculateCpp(cashPrice, taxes, pointsRequired))
                .build());
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
