package com.pointbreak.award.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CredentialsMode {
    INCLUDE("include"),
    SAME_ORIGIN("same-origin"),
    OMIT("omit");

    private final String fetchValue;
}
