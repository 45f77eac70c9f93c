package com.questrail.thing.config;

import java.util.Objects;

/**
 * ThingRuntimeConfig
 * -----------------------------------------------------------------------------
 * Configuration of a single exposed Thing.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>descriptionContext</b> — JSON-LD {@code @context} written into the
 *       rendered Thing description.</li>
 *   <li><b>prettyPrintDescription</b> — whether the rendered description is
 *       indented. Only affects {@code getThingDescription()}.</li>
 *   <li><b>isolateSubscriberFailures</b> — when {@code true}, a subscriber that
 *       throws is reported to the observability sink and the remaining
 *       subscribers still receive the event. When {@code false}, the first
 *       failure is also rethrown by the thread that delivered the event, once
 *       every pending event has been offered to every subscriber. Writes and
 *       invocations still complete normally, since their effect has already
 *       been applied; {@code emitEvent} and direct bus publishers see the
 *       exception.</li>
 * </ul>
 */
public record ThingRuntimeConfig(
    String descriptionContext,
    boolean prettyPrintDescription,
    boolean isolateSubscriberFailures
) {
    public static final String DEFAULT_DESCRIPTION_CONTEXT = "https://www.w3.org/2019/wot/td/v1";

    public ThingRuntimeConfig {
        Objects.requireNonNull(descriptionContext, "descriptionContext");
        if (descriptionContext.isBlank()) {
            throw new IllegalArgumentException("descriptionContext must not be blank");
        }
    }

    /**
     * Returns a configuration with typical defaults:
     * <ul>
     *   <li>descriptionContext: {@value #DEFAULT_DESCRIPTION_CONTEXT}</li>
     *   <li>prettyPrintDescription: false</li>
     *   <li>isolateSubscriberFailures: true</li>
     * </ul>
     */
    public static ThingRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String descriptionContext = DEFAULT_DESCRIPTION_CONTEXT;
        private boolean prettyPrintDescription = false;
        private boolean isolateSubscriberFailures = true;

        public Builder withDescriptionContext(String descriptionContext) {
            this.descriptionContext = descriptionContext;
            return this;
        }

        public Builder withPrettyPrintDescription(boolean prettyPrint) {
            this.prettyPrintDescription = prettyPrint;
            return this;
        }

        public Builder withIsolateSubscriberFailures(boolean isolate) {
            this.isolateSubscriberFailures = isolate;
            return this;
        }

        public ThingRuntimeConfig build() {
            return new ThingRuntimeConfig(descriptionContext, prettyPrintDescription, isolateSubscriberFailures);
        }
    }
}
