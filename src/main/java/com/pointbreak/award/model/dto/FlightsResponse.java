package com.pointbreak.award.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pointbreak.award.model.ComparisonResult;
import com.pointbreak.award.model.MatchedFlight;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlightsResponse {
    @JsonProperty("search_metadata")
    private SearchMetadata searchMetadata;
    private List<MatchedFlight> flights;
    @JsonProperty("total_results")
    private int totalResults;

    public static FlightsResponse from(ComparisonResult result) {
        return FlightsResponse.builder()
                .searchMetadata(SearchMetadata.from(result.request()))
                .flights(result.flights())
                .totalResults(result.totalResults())
                .build();
    }
}
