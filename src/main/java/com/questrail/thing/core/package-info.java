/**
 * Exposed-thing runtime core
 * =============================================================================
 *
 * <p>This package holds the runtime that binds a Thing's declared interactions
 * to application handlers:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.thing.core.HandlerRegistry} — per-Thing handler
 *       table with global defaults and per-interaction overrides</li>
 *   <li>{@link com.questrail.thing.core.InteractionStateStore} — current
 *       property values</li>
 *   <li>{@link com.questrail.thing.core.EventBus} — ordered, filtered fan-out
 *       of notifications</li>
 *   <li>{@link com.questrail.thing.core.DefaultExposedThing} — the façade that
 *       coordinates the three</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   protocol binding (HTTP, CoAP, MQTT, WebSocket)   -- not in this project
 *        → ExposedThing façade
 *            → HandlerRegistry → application handler (async)
 *            → InteractionStateStore
 *            → EventBus → subscribers
 * </pre>
 *
 * <p>Nothing here is process-wide: every exposed Thing owns its own registry,
 * store and bus.</p>
 */
package com.questrail.thing.core;
