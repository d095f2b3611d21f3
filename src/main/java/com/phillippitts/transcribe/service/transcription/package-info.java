/**
 * Transcription invocation: parameter defaulting and guarded engine calls.
 */
package com.phillippitts.transcribe.service.transcription;
