package me.internalizable.sessionhub.servermanager.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Observer list for a single kind of event.
 *
 * <p>Emission is synchronous and fire-and-forget. Listeners may be attached
 * or detached at any time, including from inside another listener, without
 * affecting the delivery to the others. A listener that throws is logged and
 * skipped.</p>
 *
 * @param <T> event type
 */
public class EventChannel<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventChannel.class);

    private final String name;
    private final CopyOnWriteArrayList<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Create an event channel.
     *
     * @param name channel name, used in log output
     */
    public EventChannel(@Nonnull String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Attach a listener.
     *
     * @param listener the listener
     * @return subscription detaching exactly this registration
     */
    @Nonnull
    public Subscription subscribe(@Nonnull Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "listener");
        // Wrapped so the same consumer can be registered twice and removed independently
        Consumer<? super T> registration = listener::accept;
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }

    /**
     * Deliver an event to every listener attached at the time of the call.
     *
     * @param event the event
     */
    public void fireSync(T event) {
        for (Consumer<? super T> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOGGER.error("Listener on '{}' failed", name, e);
            }
        }
    }

    /**
     * Get the number of attached listeners.
     *
     * @return listener count
     */
    public int getListenerCount() {
        return listeners.size();
    }

    /**
     * Detach every listener.
     */
    public void clear() {
        listeners.clear();
    }

    @Nonnull
    public String getName() {
        return name;
    }
}
