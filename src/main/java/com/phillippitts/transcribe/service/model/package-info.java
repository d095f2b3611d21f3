/**
 * Model lifecycle.
 *
 * <p>{@link com.phillippitts.transcribe.service.model.ModelLifecycleManager} is the single owner
 * of the speech engine. Loading happens at most once, on the {@code modelLoadExecutor}, and
 * its outcome is published through a future that every request waits on with a bounded
 * timeout. A failed load is terminal until the process restarts.
 *
 * <pre>
 * UNINITIALIZED --startLoadingAsync--> LOADING --success--> READY
 *                                              \--error----> FAILED(message)
 * </pre>
 */
package com.phillippitts.transcribe.service.model;
