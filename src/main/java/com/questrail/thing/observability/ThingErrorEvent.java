package com.questrail.thing.observability;

import java.time.Instant;

/**
 * Record representing an error observed by the exposed-thing runtime.
 * <p>
 * Reporting an error here never replaces propagating it: handler failures still
 * reach the caller through the returned future.
 *
 * @param timestamp when the error was observed
 * @param source    where it was observed (interaction name or subscriber description)
 * @param message   short description
 * @param cause     the underlying throwable
 */
public record ThingErrorEvent(
    Instant timestamp,
    String source,
    String message,
    Throwable cause
) {
}
