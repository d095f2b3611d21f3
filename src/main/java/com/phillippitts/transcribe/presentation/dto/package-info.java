/**
 * JSON response bodies. Field names are snake_case on the wire.
 */
package com.phillippitts.transcribe.presentation.dto;
