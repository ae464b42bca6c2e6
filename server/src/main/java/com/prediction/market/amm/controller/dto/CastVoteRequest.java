package com.prediction.market.amm.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Range checks on weight and confidence are left to the engine so they
 * surface as INVALID_VOTE.
 */
@Data
public class CastVoteRequest {

    @NotBlank
    private String voterId;

    @NotBlank
    private String outcome;

    private Integer confidence;

    private Integer weight;

    private Boolean isFinal;

    private String reasoning;
}
