package com.prediction.market.amm.controller.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateMarketRequest {

    @NotBlank
    private String question;

    private String description;

    private String creatorId;

    @NotNull
    @Size(min = 2, max = 10)
    private List<String> outcomes;

    @NotNull
    private Instant endTime;

    /** Defaults to endTime plus the auto-refund window */
    private Instant resolutionDeadline;

    /** Defaults to the configured seed liquidity */
    @Positive
    private BigDecimal initialLiquidity;
}
