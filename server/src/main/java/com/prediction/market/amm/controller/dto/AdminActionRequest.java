package com.prediction.market.amm.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AdminActionRequest {

    @NotBlank
    private String actor;
}
