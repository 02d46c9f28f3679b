package com.pointbreak.award.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pointbreak.award.enums.CabinClass;
import com.pointbreak.award.enums.SearchType;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.model.PriceBlock;
import com.pointbreak.award.model.RawOffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Normalizes an itinerary search response into {@link RawOffer}s.
 * <p>
 * Missing fields leave the matching offer component absent; only a body that is not a JSON
 * object is an error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItineraryParser {
    private static final String DEFAULT_CARRIER = "AA";

    private final ObjectMapper objectMapper;

    public List<RawOffer> parse(String body, SearchType searchType) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new UpstreamUnavailableException("Malformed itinerary response: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new UpstreamUnavailableException("Itinerary response is not a JSON object");
        }

        JsonNode slices = root.path("slices");
        if (!slices.isArray()) {
            log.info("{} response carried no slices", searchType);
            return List.of();
        }

        List<RawOffer> offers = new ArrayList<>(slices.size());
        for (JsonNode slice : slices) {
            offers.add(toOffer(slice, searchType));
        }
        log.debug("Parsed {} {} offers", offers.size(), searchType);
        return offers;
    }

    private RawOffer toOffer(JsonNode slice, SearchType searchType) {
        JsonNode flight = slice.path("segments").path(0).path("flight");

        Map<CabinClass, PriceBlock> pricing = new EnumMap<>(CabinClass.class);
        for (CabinClass cabin : CabinClass.values()) {
            PriceBlock block = searchType == SearchType.AWARD ? awardBlock(slice, cabin) : cashBlock(slice, cabin);
            if (block != null) {
                pricing.put(cabin, block);
            }
        }

        return RawOffer.builder()
                .searchType(searchType)
                .hash(text(slice.get("hash")))
                .flightNumber(flightNumber(flight))
                .departureTime(localTime(text(slice.get("departureDateTime"))))
                .arrivalTime(localTime(text(slice.get("arrivalDateTime"))))
                .pricing(pricing)
                .build();
    }

    // first productPricing entry that names the cabin anywhere in its tree
    private PriceBlock awardBlock(JsonNode slice, CabinClass cabin) {
        for (JsonNode entry : slice.path("productPricing")) {
            if (!mentions(entry, cabin.name())) {
                continue;
            }
            JsonNode slicePricing = entry.path("regularPrice").path("slicePricing");
            JsonNode points = slicePricing.path("perPassengerAwardPoints");
            Long pointsPerPassenger = points.isNumber() ? points.asLong() : null;
            BigDecimal taxes = amount(slicePricing.path("allPassengerDisplayTotal").path("amount"));
            if (pointsPerPassenger == null && taxes == null) {
                return null;
            }
            return PriceBlock.builder()
                    .pointsPerPassenger(pointsPerPassenger)
                    .taxesAmount(taxes)
                    .build();
        }
        return null;
    }

    private PriceBlock cashBlock(JsonNode slice, CabinClass cabin) {
        JsonNode first = slice.path("productGroups").path(cabin.name()).path(0);
        BigDecimal cash = amount(first.path("slicePricing").path("allPassengerDisplayTotal").path("amount"));
        if (cash == null) {
            return null;
        }
        return PriceBlock.builder().cashAmount(cash).build();
    }

    private static boolean mentions(JsonNode node, String value) {
        if (node.isTextual()) {
            return value.equals(node.asText());
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (value.equals(field.getKey()) || mentions(field.getValue(), value)) {
                    return true;
                }
            }
            return false;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                if (mentions(child, value)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String flightNumber(JsonNode flight) {
        String number = text(flight.get("flightNumber"));
        if (number == null) {
            return null;
        }
        String carrier = text(flight.get("carrierCode"));
        return (carrier == null ? DEFAULT_CARRIER : carrier) + number;
    }

    private static BigDecimal amount(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    /**
     * Wall-clock time at the airport. The offset, when present, is not applied.
     */
    static LocalTime localTime(String dateTime) {
        if (dateTime == null) {
            return null;
        }
        String normalized = dateTime.trim();
        try {
            return OffsetDateTime.parse(normalized).toLocalTime().withSecond(0).withNano(0);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(normalized).toLocalTime().withSecond(0).withNano(0);
            } catch (DateTimeParseException ex) {
                log.debug("Unparseable date-time '{}'", dateTime);
                return null;
            }
        }
    }
}
