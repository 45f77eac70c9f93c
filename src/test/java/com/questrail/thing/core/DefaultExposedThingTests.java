package com.questrail.thing.core;

import com.questrail.thing.api.error.InteractionNotFoundException;
import com.questrail.thing.api.error.NotWritableException;
import com.questrail.thing.api.error.UndefinedActionHandlerException;
import com.questrail.thing.event.ActionInvocation;
import com.questrail.thing.event.EmittedEvent;
import com.questrail.thing.event.PropertyChange;
import com.questrail.thing.model.ActionInit;
import com.questrail.thing.model.PropertyInit;
import com.questrail.thing.model.Thing;
import com.questrail.thing.observability.RecordingObservabilitySink;
import com.questrail.thing.observability.ThingErrorEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DefaultExposedThing}: handler resolution, default
 * handlers and the notifications published by successful calls.
 *
 * Every handler here completes on the calling thread unless stated otherwise,
 * so futures are already done when the call returns.
 */
class DefaultExposedThingTests
{
    private LocalServientHost host;
    private RecordingObservabilitySink sink;
    private EventBus bus;
    private DefaultExposedThing thing;
    private List<EmittedEvent> published;

    @BeforeEach
    void setUp() {
        host = new LocalServientHost();
        sink = new RecordingObservabilitySink();
        bus = new EventBus(sink, () -> Instant.EPOCH, true);
        thing = DefaultExposedThing.builder()
                .withHost(host)
                .withThing(new Thing("urn:dev:thermostat", "Thermostat"))
                .withObservabilitySink(sink)
                .withWallClock(() -> Instant.EPOCH)
                .withEventBus(bus)
                .build();

        thing.addProperty("temp", PropertyInit.builder()
                .withValue(20)
                .writable(true)
                .observable(true)
                .build());
        thing.addProperty("serial", PropertyInit.builder()
                .withValue("SN-1")
                .build());
        thing.addAction("reset", ActionInit.builder().build());

        // everything published after setup
        published = new ArrayList<>();
        bus.subscribe(e -> true, published::add);
    }

    private List<EmittedEvent> publishedOfType(Class<? extends EmittedEvent> type) {
        List<EmittedEvent> result = new ArrayList<>();
        for (EmittedEvent e : published) {
            if (type.isInstance(e)) {
                result.add(e);
            }
        }
        return result;
    }

    // ---------- reads ----------

    @Test
    void defaultReadReturnsSeededValue() throws Exception {
        assertEquals(20, thing.readProperty("temp").get());
        assertEquals("SN-1", thing.readProperty("serial").get());
    }

    @Test
    void defaultReadOfNeverSetPropertyResolvesNull() throws Exception {
        thing.addProperty("humidity", PropertyInit.builder().build());

        assertNull(thing.readProperty("humidity").get());
    }

    @Test
    void readOfUnknownPropertyThrowsBeforeAnyHandlerRuns() {
        AtomicReference<String> called = new AtomicReference<>();
        thing.setPropertyReadHandler(name -> {
            called.set(name);
            return CompletableFuture.completedFuture(null);
        });

        assertThrows(InteractionNotFoundException.class, () -> thing.readProperty("pressure"));
        assertThrows(InteractionNotFoundException.class, () -> thing.readProperty("reset"));
        assertNull(called.get());
    }

    @Test
    void dedicatedReadHandlerTakesPrecedenceOverGlobal() throws Exception {
        thing.setPropertyReadHandler(name -> CompletableFuture.completedFuture("global:" + name));
        thing.setPropertyReadHandler(name -> CompletableFuture.completedFuture("dedicated"), "temp");

        assertEquals("dedicated", thing.readProperty("temp").get());
        assertEquals("global:serial", thing.readProperty("serial").get());
    }

    @Test
    void readHandlerErrorIsPassedThroughUnmodifiedAndReported() {
        IllegalStateException failure = new IllegalStateException("sensor offline");
        thing.setPropertyReadHandler(name -> CompletableFuture.failedFuture(failure), "temp");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> thing.readProperty("temp").get());

        assertSame(failure, ex.getCause());
        assertEquals(1, sink.getErrors().size());
        ThingErrorEvent error = sink.getErrors().get(0);
        assertEquals("temp", error.source());
        assertSame(failure, error.cause());
    }

    @Test
    void handlerThatThrowsSynchronouslyYieldsFailedFuture() {
        IllegalArgumentException failure = new IllegalArgumentException("bad");
        thing.setPropertyReadHandler(name -> {
            throw failure;
        }, "temp");

        CompletableFuture<Object> result = thing.readProperty("temp");

        assertTrue(result.isCompletedExceptionally());
        ExecutionException ex = assertThrows(ExecutionException.class, result::get);
        assertSame(failure, ex.getCause());
    }

    @Test
    void handlerReturningNullFutureYieldsFailedFuture() {
        thing.setPropertyReadHandler(name -> null, "temp");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> thing.readProperty("temp").get());
        assertInstanceOf(NullPointerException.class, ex.getCause());
    }

    // ---------- writes ----------

    @Test
    void writeStoresValueAndPublishesExactlyOneChange() throws Exception {
        thing.writeProperty("temp", 25).get();

        assertEquals(25, thing.readProperty("temp").get());

        List<EmittedEvent> changes = publishedOfType(EmittedEvent.PropertyChanged.class);
        assertEquals(1, changes.size());
        assertEquals(new PropertyChange("temp", 25), changes.get(0).payload());
        assertEquals(Instant.EPOCH, changes.get(0).timestamp());
    }

    @Test
    void lastWriteWins() throws Exception {
        thing.writeProperty("temp", 21).get();
        thing.writeProperty("temp", 22).get();

        assertEquals(22, thing.readProperty("temp").get());
    }

    @Test
    void writingNullClearsTheStoredValue() throws Exception {
        thing.writeProperty("temp", null).get();

        assertNull(thing.readProperty("temp").get());
        assertEquals(new PropertyChange("temp", null),
                publishedOfType(EmittedEvent.PropertyChanged.class).get(0).payload());
    }

    @Test
    void writeToReadOnlyPropertyThrowsAndPublishesNothing() throws Exception {
        AtomicReference<Object> written = new AtomicReference<>();
        thing.setPropertyWriteHandler((name, value) -> {
            written.set(value);
            return CompletableFuture.completedFuture(null);
        });

        NotWritableException ex = assertThrows(NotWritableException.class,
                () -> thing.writeProperty("serial", "SN-2"));

        assertEquals("serial", ex.interactionName());
        assertNull(written.get());
        assertTrue(published.isEmpty());
        assertEquals("SN-1", thing.readProperty("serial").get());
    }

    @Test
    void writeToUnknownPropertyThrows() {
        assertThrows(InteractionNotFoundException.class, () -> thing.writeProperty("pressure", 1));
        assertThrows(InteractionNotFoundException.class, () -> thing.writeProperty("reset", 1));
    }

    @Test
    void failedWritePublishesNothingAndKeepsPreviousValue() throws Exception {
        IllegalStateException failure = new IllegalStateException("bus fault");
        thing.setPropertyWriteHandler((name, value) -> CompletableFuture.failedFuture(failure), "temp");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> thing.writeProperty("temp", 30).get());

        assertSame(failure, ex.getCause());
        assertTrue(published.isEmpty());
        assertEquals(20, thing.readProperty("temp").get());
    }

    @Test
    void customWriteHandlerBypassesStoredState() throws Exception {
        List<Object> forwarded = new ArrayList<>();
        thing.setPropertyWriteHandler((name, value) -> {
            forwarded.add(value);
            return CompletableFuture.completedFuture(null);
        }, "temp");

        thing.writeProperty("temp", 99).get();

        assertEquals(List.of(99), forwarded);
        assertEquals(20, thing.readProperty("temp").get());
        assertEquals(1, publishedOfType(EmittedEvent.PropertyChanged.class).size());
    }

    @Test
    void asynchronousWritePublishesBeforeCallerFutureResolves() {
        CompletableFuture<Void> handlerFuture = new CompletableFuture<>();
        thing.setPropertyWriteHandler((name, value) -> handlerFuture, "temp");

        List<Boolean> doneWhenPublished = new ArrayList<>();
        CompletableFuture<Void>[] result = new CompletableFuture[1];
        thing.onPropertyChange("temp").subscribe(e -> doneWhenPublished.add(result[0].isDone()));

        result[0] = thing.writeProperty("temp", 24);
        assertFalse(result[0].isDone());
        assertTrue(doneWhenPublished.isEmpty());

        handlerFuture.complete(null);

        assertEquals(List.of(false), doneWhenPublished);
        assertTrue(result[0].isDone());
        assertFalse(result[0].isCompletedExceptionally());
    }

    // ---------- actions ----------

    @Test
    void invokeWithoutHandlerFailsWithUndefinedActionHandler() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> thing.invokeAction("reset").get());

        UndefinedActionHandlerException cause =
                assertInstanceOf(UndefinedActionHandlerException.class, ex.getCause());
        assertEquals("reset", cause.interactionName());
        assertTrue(publishedOfType(EmittedEvent.ActionInvoked.class).isEmpty());
    }

    @Test
    void invokeResolvesWithHandlerResultAndPublishesInvocation() throws Exception {
        List<Object> seenArgs = new ArrayList<>();
        thing.setActionHandler((name, args) -> {
            seenArgs.addAll(args);
            return CompletableFuture.completedFuture("ok");
        }, "reset");

        assertEquals("ok", thing.invokeAction("reset", 1, "hard").get());

        assertEquals(List.of(1, "hard"), seenArgs);
        List<EmittedEvent> invocations = publishedOfType(EmittedEvent.ActionInvoked.class);
        assertEquals(1, invocations.size());
        assertEquals(new ActionInvocation("reset", "ok"), invocations.get(0).payload());
    }

    @Test
    void globalActionHandlerServesActionsWithoutDedicatedHandler() throws Exception {
        thing.addAction("calibrate", ActionInit.builder().build());
        thing.setActionHandler((name, args) -> CompletableFuture.completedFuture("global:" + name));
        thing.setActionHandler((name, args) -> CompletableFuture.completedFuture("dedicated"), "reset");

        assertEquals("dedicated", thing.invokeAction("reset").get());
        assertEquals("global:calibrate", thing.invokeAction("calibrate").get());
    }

    @Test
    void failedInvocationPublishesNothing() {
        RuntimeException failure = new RuntimeException("motor jammed");
        thing.setActionHandler((name, args) -> CompletableFuture.failedFuture(failure), "reset");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> thing.invokeAction("reset").get());

        assertSame(failure, ex.getCause());
        assertTrue(publishedOfType(EmittedEvent.ActionInvoked.class).isEmpty());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void invokeOfUnknownOrNonActionInteractionThrows() {
        assertThrows(InteractionNotFoundException.class, () -> thing.invokeAction("selfDestruct"));
        assertThrows(InteractionNotFoundException.class, () -> thing.invokeAction("temp"));
    }

    @Test
    void dedicatedHandlerForUnknownInteractionIsRejected() {
        assertThrows(InteractionNotFoundException.class,
                () -> thing.setActionHandler((name, args) -> CompletableFuture.completedFuture(null), "temp"));
        assertThrows(InteractionNotFoundException.class,
                () -> thing.setPropertyReadHandler(name -> CompletableFuture.completedFuture(null), "reset"));
        assertThrows(InteractionNotFoundException.class,
                () -> thing.setPropertyWriteHandler((name, value) -> CompletableFuture.completedFuture(null), "nope"));
    }

    // ---------- identity and lifecycle ----------

    @Test
    void equalityIsByHostAndThingId() {
        DefaultExposedThing sameId = DefaultExposedThing.builder()
                .withHost(host)
                .withThing(new Thing("urn:dev:thermostat", "Other name"))
                .build();
        DefaultExposedThing otherHost = DefaultExposedThing.builder()
                .withHost(new LocalServientHost())
                .withThing(new Thing("urn:dev:thermostat", "Thermostat"))
                .build();

        assertEquals(thing, sameId);
        assertEquals(thing.hashCode(), sameId.hashCode());
        assertNotEquals(thing, otherHost);
    }

    @Test
    void exposeAndDestroyAreForwardedToHost() throws Exception {
        thing.expose();
        assertTrue(host.isExposed("urn:dev:thermostat"));

        thing.destroy();
        assertFalse(host.isExposed("urn:dev:thermostat"));

        // subscriptions were detached
        thing.writeProperty("temp", 1).get();
        assertTrue(published.isEmpty());
    }

    @Test
    void fromNameGeneratesUrnIdentity() {
        DefaultExposedThing generated = DefaultExposedThing.fromName(host, "Living Room Lamp");

        assertTrue(generated.id().startsWith("urn:uuid:"));
        assertEquals("Living Room Lamp", generated.name());
        assertEquals("living-room-lamp", generated.urlName());
        assertSame(host, generated.host());
        assertTrue(generated.properties().isEmpty());
    }

    @Test
    void builderRequiresHostAndThing() {
        assertThrows(NullPointerException.class,
                () -> DefaultExposedThing.builder().withThing(Thing.fromName("x")).build());
        assertThrows(NullPointerException.class,
                () -> DefaultExposedThing.builder().withHost(host).build());
    }
}
