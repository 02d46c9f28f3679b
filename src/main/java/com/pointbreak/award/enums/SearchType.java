package com.pointbreak.award.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SearchType {
    AWARD("Award"),
    REVENUE("Revenue");

    // value of tripOptions.searchType on the wire
    private final String wireValue;
}
