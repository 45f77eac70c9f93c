package com.questrail.thing.core;

import com.questrail.thing.api.ServientHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * In-process {@link ServientHost} that only records which Things are exposed.
 * <p>
 * Useful when Things are consumed in the same JVM and no protocol binding is
 * involved, and as the host of choice in tests.
 */
public final class LocalServientHost implements ServientHost
{
    private static final Logger log = LoggerFactory.getLogger(LocalServientHost.class);

    private final Set<String> exposed = Collections.synchronizedSet(new LinkedHashSet<>());

    @Override
    public void enableExposedThing(String thingId) {
        Objects.requireNonNull(thingId, "thingId");
        if (exposed.add(thingId)) {
            log.info("Thing {} exposed", thingId);
        }
    }

    @Override
    public void removeExposedThing(String thingId) {
        Objects.requireNonNull(thingId, "thingId");
        if (exposed.remove(thingId)) {
            log.info("Thing {} removed", thingId);
        } else {
            log.debug("Thing {} was not exposed", thingId);
        }
    }

    public boolean isExposed(String thingId) {
        return exposed.contains(thingId);
    }

    /**
     * Snapshot of the ids of the currently exposed Things, in exposure order.
     */
    public Set<String> exposedThingIds() {
        synchronized (exposed) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(exposed));
        }
    }
}
