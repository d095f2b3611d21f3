/**
 * Exception-to-HTTP mapping for the REST API.
 *
 * @see com.phillippitts.transcribe.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.transcribe.presentation.exception;
