package com.flagship.chain_webhooks.dlq.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ResolveDeadLetterRequest {

    @NotBlank(message = "Resolution notes are required")
    @Size(max = 2000, message = "Resolution notes must be at most 2000 characters")
    @JsonProperty("notes")
    String notes;
}
