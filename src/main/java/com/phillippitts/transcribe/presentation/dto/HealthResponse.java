package com.phillippitts.transcribe.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Body of {@code GET /health}.
 *
 * @param status      "healthy" when the model is loaded, "degraded" otherwise
 * @param modelState  lifecycle state name
 * @param model       configured model identifier
 * @param device      configured compute device
 * @param computeType configured compute profile
 * @param version     service version
 * @param failure     load failure message, present only when the load failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        String status,
        String modelState,
        String model,
        String device,
        String computeType,
        String version,
        String failure
) {
}
