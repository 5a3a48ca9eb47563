package com.questrail.phoenix;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.phoenix.channel.PhoenixChannel;
import com.questrail.phoenix.channel.RecordingChannel;
import com.questrail.phoenix.model.Envelope;
import com.questrail.phoenix.observability.PhoenixProtocolEvent;
import com.questrail.phoenix.transport.FakeSocketTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection loss handling: phx_error fan-out and the single scheduled
 * reconnect attempt.
 */
class PhoenixSocketReconnectTest {

    @Test
    void resetBroadcastsPhxErrorThenReconnectsWithSameUrlAndParams() {
        SocketHarness h = new SocketHarness();
        RecordingChannel lobby = new RecordingChannel("room:lobby");
        RecordingChannel room1 = new RecordingChannel("room:1");
        h.socket.addChannel(lobby);
        h.socket.addChannel(room1);

        h.socket.connect(Map.of("token", "secret"));
        h.drain();
        FakeSocketTransport first = h.transports.latest();
        first.simulateOpen();
        h.drain();

        first.simulateClose("ECONNRESET");
        h.drain();

        for (RecordingChannel channel : List.of(lobby, room1)) {
            assertEquals(1, channel.deliveries().size());
            RecordingChannel.Delivery delivery = channel.deliveries().get(0);
            assertEquals(Envelope.CHANNEL_ERROR_EVENT, delivery.event());
            assertEquals("ECONNRESET", delivery.payload().asText());
            assertEquals(OptionalLong.of(0), delivery.ref());
        }
        assertFalse(h.socket.isConnected());

        h.advance(SocketHarness.RECONNECT.minusMillis(1));
        assertEquals(1, h.transports.created().size());

        h.advance(Duration.ofMillis(1));
        assertEquals(2, h.transports.created().size());

        FakeSocketTransport second = h.transports.latest();
        assertEquals(first.url(), second.url());
        assertTrue(second.url().getQuery().contains("token=secret"));
        assertEquals(1, second.openCalls());
        assertFalse(first.hasListener());

        second.simulateOpen();
        h.drain();
        assertTrue(h.socket.isConnected());
    }

    @Test
    void channelsGetPhxErrorBeforeCloseCallbacksRun() {
        SocketHarness h = new SocketHarness();
        List<String> order = new ArrayList<>();
        h.socket.addChannel(new PhoenixChannel() {
            @Override
            public String topic() {
                return "room:1";
            }

            @Override
            public void triggerEvent(String event, JsonNode payload, OptionalLong ref) {
                order.add("channel " + event);
            }
        });
        h.socket.onClose(reason -> order.add("close " + reason));

        FakeSocketTransport transport = h.connectAndOpen();
        transport.simulateClose("gone");
        h.drain();

        assertEquals(List.of("channel phx_error", "close gone"), order);
    }

    @Test
    void secondCloseBeforeAttemptFiresDoesNotScheduleAnother() {
        SocketHarness h = new SocketHarness();
        FakeSocketTransport transport = h.connectAndOpen();

        transport.simulateClose("first");
        h.drain();
        h.advance(Duration.ofSeconds(2));
        transport.simulateClose("second");
        h.drain();

        assertEquals(1, h.sink.countProtocolEvents(PhoenixProtocolEvent.Kind.RECONNECT_SCHEDULED));
        assertEquals(1, h.scheduler.pendingCount());

        h.advance(SocketHarness.RECONNECT);
        h.advance(SocketHarness.RECONNECT);

        assertEquals(2, h.transports.created().size());
    }

    @Test
    void errorSchedulesReconnectLikeClose() {
        SocketHarness h = new SocketHarness();
        FakeSocketTransport transport = h.connectAndOpen();

        transport.simulateError("handshake rejected");
        h.drain();
        h.advance(SocketHarness.RECONNECT);

        assertEquals(2, h.transports.created().size());
    }

    @Test
    void failedReconnectKeepsRetryingAtFixedDelay() {
        SocketHarness h = new SocketHarness();
        h.connectAndOpen().simulateClose("down");
        h.drain();

        for (int attempt = 1; attempt <= 3; attempt++) {
            h.advance(SocketHarness.RECONNECT);
            assertEquals(attempt + 1, h.transports.created().size());
            h.transports.latest().simulateError("connection refused");
            h.drain();
        }

        assertEquals(4, h.sink.countProtocolEvents(PhoenixProtocolEvent.Kind.RECONNECT_SCHEDULED));
        assertEquals(3, h.sink.countProtocolEvents(PhoenixProtocolEvent.Kind.RECONNECT_ATTEMPT));
    }

    @Test
    void disconnectCancelsPendingReconnect() {
        SocketHarness h = new SocketHarness();
        FakeSocketTransport transport = h.connectAndOpen();
        transport.simulateClose("down");
        h.drain();

        h.socket.disconnect();
        h.drain();
        h.advance(SocketHarness.RECONNECT.multipliedBy(3));

        assertEquals(1, h.transports.created().size());
        assertEquals(0, h.scheduler.pendingCount());
        assertEquals(1, h.sink.countProtocolEvents(PhoenixProtocolEvent.Kind.RECONNECT_CANCELLED));
    }

    @Test
    void staleReconnectTimerFiringAfterCancellationIsNoOp() {
        SocketHarness h = new SocketHarness();
        FakeSocketTransport transport = h.connectAndOpen();
        transport.simulateClose("down");
        h.drain();

        // Timer fires and enqueues its task before the caller's connect runs.
        h.socket.connect();
        h.clock.advance(SocketHarness.RECONNECT);
        h.scheduler.runDueTasks();
        h.drain();

        assertEquals(2, h.transports.created().size());
        assertEquals(0, h.sink.countProtocolEvents(PhoenixProtocolEvent.Kind.RECONNECT_ATTEMPT));
    }

    @Test
    void openCancelsPendingReconnectAndAllowsALaterOne() {
        SocketHarness h = new SocketHarness();
        FakeSocketTransport transport = h.connectAndOpen();
        transport.simulateClose("blip");
        h.drain();

        // The same transport recovers before the timer fires.
        transport.simulateOpen();
        h.drain();
        h.advance(SocketHarness.RECONNECT);
        assertEquals(1, h.transports.created().size());

        transport.simulateClose("down again");
        h.drain();
        h.advance(SocketHarness.RECONNECT);

        assertEquals(2, h.sink.countProtocolEvents(PhoenixProtocolEvent.Kind.RECONNECT_SCHEDULED));
        assertEquals(2, h.transports.created().size());
    }
}
