package com.questrail.phoenix;

import com.questrail.phoenix.config.PhoenixSocketConfig;
import com.questrail.phoenix.internal.exec.QueuedExecutor;
import com.questrail.phoenix.internal.exec.SerialExecutor;
import com.questrail.phoenix.internal.time.SystemWallClock;
import com.questrail.phoenix.observability.RecordingObservabilitySink;
import com.questrail.phoenix.time.DeterministicScheduler;
import com.questrail.phoenix.time.ManualMonotonicClock;
import com.questrail.phoenix.transport.FakeSocketTransport;
import com.questrail.phoenix.transport.FakeSocketTransportFactory;

import java.time.Duration;

/**
 * Wires a {@link PhoenixSocket} to fakes: a queued worker, a manual clock, a
 * deterministic scheduler and fake transports. Nothing runs until the test
 * calls {@link #drain()} or {@link #advance(Duration)}.
 */
final class SocketHarness {

    static final String ENDPOINT = "ws://localhost:4000/socket/websocket";
    static final Duration HEARTBEAT = Duration.ofSeconds(1);
    static final Duration RECONNECT = Duration.ofSeconds(5);

    final ManualMonotonicClock clock = new ManualMonotonicClock();
    final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    final QueuedExecutor worker = new QueuedExecutor();
    final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    final FakeSocketTransportFactory transports = new FakeSocketTransportFactory();
    final PhoenixSocket socket;

    SocketHarness() {
        this(HEARTBEAT);
    }

    SocketHarness(Duration heartbeatInterval) {
        PhoenixSocketConfig config = PhoenixSocketConfig.builder(ENDPOINT)
            .withHeartbeatInterval(heartbeatInterval)
            .withReconnectDelay(RECONNECT)
            .build();

        this.socket = PhoenixSocket.builder(config)
            .withTransportFactory(transports)
            .withExecutor(new SerialExecutor(worker, sink, SystemWallClock.INSTANCE))
            .withScheduler(scheduler, clock)
            .withObservabilitySink(sink)
            .build();
    }

    /**
     * Run every queued worker task.
     */
    void drain() {
        worker.runAll();
    }

    /**
     * Move time forward, fire due timers, then run what they enqueued.
     */
    void advance(Duration delta) {
        clock.advance(delta);
        scheduler.runDueTasks();
        worker.runAll();
    }

    /**
     * Connect and complete the opening handshake on a fresh transport.
     */
    FakeSocketTransport connectAndOpen() {
        socket.connect();
        drain();
        FakeSocketTransport transport = transports.latest();
        transport.simulateOpen();
        drain();
        return transport;
    }
}
