/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/transcribe} - transcription (API key required)</li>
 *   <li>{@code GET /health} - model state and service version</li>
 *   <li>{@code GET /api/v1/models} - available and active models</li>
 * </ul>
 *
 * <p>Controller Responsibilities:
 * <ul>
 *   <li>Accept HTTP requests and extract parameters</li>
 *   <li>Delegate to service layer for business logic</li>
 *   <li>Convert service results to response DTOs</li>
 *   <li>Let {@code GlobalExceptionHandler} handle exceptions</li>
 * </ul>
 *
 * @see com.phillippitts.transcribe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.transcribe.presentation.controller;
