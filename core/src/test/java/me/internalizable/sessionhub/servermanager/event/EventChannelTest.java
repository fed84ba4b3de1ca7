package me.internalizable.sessionhub.servermanager.event;

import me.internalizable.sessionhub.servermanager.registry.ServerDescriptor;
import me.internalizable.sessionhub.servermanager.registry.ServerKind;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class EventChannelTest {

    @Test
    void deliversToEveryListenerInOrder() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> received = new ArrayList<>();

        channel.subscribe(event -> received.add("a:" + event));
        channel.subscribe(event -> received.add("b:" + event));
        channel.fireSync("x");

        assertThat(received).containsExactly("a:x", "b:x");
    }

    @Test
    void throwingListenerDoesNotStopDelivery() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> received = new ArrayList<>();

        channel.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        channel.subscribe(received::add);
        channel.fireSync("x");

        assertThat(received).containsExactly("x");
    }

    @Test
    void subscriptionRemovesOnlyItsOwnRegistration() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> received = new ArrayList<>();
        Consumer<String> listener = received::add;

        Subscription first = channel.subscribe(listener);
        channel.subscribe(listener);
        first.unsubscribe();
        first.unsubscribe();
        channel.fireSync("x");

        assertThat(received).containsExactly("x");
        assertThat(channel.getListenerCount()).isEqualTo(1);
    }

    @Test
    void listenerMayUnsubscribeDuringDelivery() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> received = new ArrayList<>();
        Subscription[] self = new Subscription[1];

        self[0] = channel.subscribe(event -> {
            received.add("once:" + event);
            self[0].unsubscribe();
        });
        channel.subscribe(event -> received.add("always:" + event));

        channel.fireSync("1");
        channel.fireSync("2");

        assertThat(received).containsExactly("once:1", "always:1", "always:2");
    }

    @Test
    void clearDetachesEverything() {
        EventChannel<String> channel = new EventChannel<>("test");
        List<String> received = new ArrayList<>();
        channel.subscribe(received::add);

        channel.clear();
        channel.fireSync("x");

        assertThat(received).isEmpty();
        assertThat(channel.getName()).isEqualTo("test");
    }

    @Test
    void statusChangeEventReportsDirection() {
        ServerDescriptor stopped = ServerDescriptor.configured(
                URI.create("http://localhost:10000"), ServerKind.LOCAL, null, null);
        ServerDescriptor running = stopped.withRunning(true);

        ServerStatusChangeEvent recovered = new ServerStatusChangeEvent(stopped, running);
        ServerStatusChangeEvent lost = new ServerStatusChangeEvent(running, stopped);

        assertThat(recovered.recovered()).isTrue();
        assertThat(recovered.becameUnreachable()).isFalse();
        assertThat(lost.becameUnreachable()).isTrue();
        assertThat(lost.getServerUrl()).isEqualTo(URI.create("http://localhost:10000/"));
    }
}
