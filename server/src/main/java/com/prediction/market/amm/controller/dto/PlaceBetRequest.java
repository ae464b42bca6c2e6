package com.prediction.market.amm.controller.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PlaceBetRequest {

    @NotBlank
    private String userId;

    @NotBlank
    private String outcome;

    @NotNull
    private BigDecimal amount;
}
