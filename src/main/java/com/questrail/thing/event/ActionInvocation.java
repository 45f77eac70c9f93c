package com.questrail.thing.event;

import java.util.Objects;

/**
 * Payload of an action-invocation notification.
 *
 * @param actionName  invoked action
 * @param returnValue value the action handler resolved with ({@code null} allowed)
 */
public record ActionInvocation(String actionName, Object returnValue) {
    public ActionInvocation {
        Objects.requireNonNull(actionName, "actionName");
    }
}
