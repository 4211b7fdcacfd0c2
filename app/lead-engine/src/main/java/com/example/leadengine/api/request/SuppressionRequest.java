package com.example.leadengine.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** value はアドレス、またはドメイン単位の抑止ならドメイン。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SuppressionRequest(@NotBlank String value, @NotBlank String reason) {}
