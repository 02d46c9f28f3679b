package com.pointbreak.award.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pointbreak.award.enums.SearchType;
import com.pointbreak.award.model.SearchRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the itinerary search body. Award and revenue searches differ only in {@code tripOptions.searchType}.
 */
@Component
@RequiredArgsConstructor
public class ItineraryPayloadBuilder {

    private final ObjectMapper objectMapper;

    public String build(SearchRequest request, SearchType searchType) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode metadata = root.putObject("metadata");
        metadata.putArray("selectedProducts");
        metadata.put("tripType", "OneWay");
        metadata.putObject("udo").put("search_method", "Lowest");

        root.putArray("passengers").addObject()
                .put("type", "adult")
                .put("count", request.getPassengerCount());

        root.putObject("requestHeader").put("clientId", "AAcom");

        ArrayNode slices = root.putArray("slices");
        ObjectNode slice = slices.addObject();
        slice.put("allCarriers", true);
        slice.put("cabin", "");
        slice.put("departureDate", request.getDate().toString());
        slice.put("destination", request.getDestination());
        slice.put("destinationNearbyAirports", false);
        slice.putNull("maxStops");
        slice.put("origin", request.getOrigin());
        slice.put("originNearbyAirports", false);

        ObjectNode tripOptions = root.putObject("tripOptions");
        tripOptions.put("corporateBooking", false);
        tripOptions.put("fareType", "Lowest");
        tripOptions.put("locale", "en_US");
        tripOptions.putNull("pointOfSale");
        tripOptions.put("searchType", searchType.getWireValue());

        root.putNull("loyaltyInfo");
        root.put("version", "cfr");

        ObjectNode queryParams = root.putObject("queryParams");
        queryParams.put("sliceIndex", 0);
        queryParams.put("sessionId", "");
        queryParams.put("solutionSet", "");
        queryParams.put("solutionId", "");
        queryParams.put("sort", "CARRIER");

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize itinerary payload", e);
        }
    }
}
