package com.pointbreak.award.model;

import java.util.List;

public record ComparisonResult(SearchRequest request, List<MatchedFlight> flights) {

    public int totalResults() {
        return flights.size();
    }
}
