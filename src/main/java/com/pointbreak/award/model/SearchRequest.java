package com.pointbreak.award.model;

import com.pointbreak.award.enums.CabinClass;
import com.pointbreak.award.exception.SearchValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One-way, adult-only itinerary search. Immutable once built.
 */
@Value
@Builder
public class SearchRequest {

    private static final Pattern IATA = Pattern.compile("^[A-Z]{3}$");

    String origin;
    String destination;
    LocalDate date;
    int passengerCount;
    CabinClass cabinClass;

    /**
     * Validates and normalizes raw query input. IATA codes are upper-cased.
     */
    public static SearchRequest of(String origin, String destination, String date,
                                   int passengers, CabinClass cabinClass) {
        if (cabinClass == null) {
            throw new SearchValidationException("Cabin class is required.");
        }
        if (passengers <= 0) {
            throw new SearchValidationException("Number of passengers must be at least 1.");
        }
        LocalDate departureDate;
        try {
            departureDate = LocalDate.parse(date == null ? "" : date.trim());
        } catch (DateTimeParseException e) {
            throw new SearchValidationException("Invalid departure date: " + date + ". Expected YYYY-MM-DD.", e);
        }
        return SearchRequest.builder()
                .origin(airportCode("origin", origin))
                .destination(airportCode("destination", destination))
                .date(departureDate)
                .passengerCount(passengers)
                .cabinClass(cabinClass)
                .build();
    }

    private static String airportCode(String field, String value) {
        String code = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        if (!IATA.matcher(code).matches()) {
            throw new SearchValidationException("Invalid " + field + " airport code: " + value);
        }
        return code;
    }
}
