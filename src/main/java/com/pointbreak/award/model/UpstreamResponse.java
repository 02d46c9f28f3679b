package com.pointbreak.award.model;

import lombok.Value;

@Value
public class UpstreamResponse {
    int status;
    String body;
}
