package com.pointbreak.award.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pointbreak.award.model.SearchRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchMetadata {
    private String origin;
    private String destination;
    private String date;
    private int passengers;
    @JsonProperty("cabin_class")
    private String cabinClass;

    public static SearchMetadata from(SearchRequest request) {
        return SearchMetadata.builder()
                .origin(request.getOrigin())
                .destination(request.getDestination())
                .date(request.getDate().toString())
                .passengers(request.getPassengerCount())
                .cabinClass(request.getCabinClass().lowerName())
                .build();
    }
}
