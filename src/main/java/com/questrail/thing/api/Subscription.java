package com.questrail.thing.api;

/**
 * Handle to an attached event subscription.
 */
public interface Subscription
{
    /**
     * Detaches the subscription. Once this returns, the subscriber receives no
     * further events. Events already handed to other subscriptions are
     * unaffected. Calling it more than once has no effect.
     */
    void unsubscribe();

    /**
     * Returns {@code true} until the subscription is detached, either by
     * {@link #unsubscribe()} or by destruction of the Thing.
     */
    boolean isActive();
}
