package com.prediction.market.amm.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ResolveRequest {

    /** Null asks for vote consensus */
    private String outcome;

    @NotBlank
    private String resolvedBy;
}
