package com.flagship.chain_webhooks.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ThresholdRequest {

    @NotNull(message = "Threshold is required")
    @Min(value = 1, message = "Threshold must be at least 1")
    @Max(value = 1000, message = "Threshold must be at most 1000")
    @JsonProperty("threshold")
    Integer threshold;
}
