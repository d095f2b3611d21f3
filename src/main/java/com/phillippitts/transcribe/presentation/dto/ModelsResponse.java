package com.phillippitts.transcribe.presentation.dto;

import java.util.List;

/**
 * Body of {@code GET /api/v1/models}.
 *
 * @param models model identifiers the service can be configured with
 * @param active the configured model
 */
public record ModelsResponse(List<String> models, String active) {
}
