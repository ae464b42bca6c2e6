package com.prediction.market.amm.controller.dto;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ApiErrorResponse {

    private final String code;
    private final String kind;
    private final String message;
    private final Map<String, Object> details;
    private final boolean retryable;
}
