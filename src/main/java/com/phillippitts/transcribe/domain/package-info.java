/**
 * Immutable value types exchanged between the web layer and the transcription services.
 *
 * <p>All types are records; the ones built from client input validate in their compact
 * constructors so an invalid instance cannot exist.
 */
package com.phillippitts.transcribe.domain;
