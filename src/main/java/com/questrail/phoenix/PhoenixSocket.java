package com.questrail.phoenix;

import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.phoenix.channel.PhoenixChannel;
import com.questrail.phoenix.codec.EnvelopeCodec;
import com.questrail.phoenix.codec.EnvelopeDecodeException;
import com.questrail.phoenix.codec.JacksonEnvelopeCodec;
import com.questrail.phoenix.config.PhoenixSocketConfig;
import com.questrail.phoenix.internal.exec.SerialExecutor;
import com.questrail.phoenix.internal.time.Cancellable;
import com.questrail.phoenix.internal.time.MonotonicClock;
import com.questrail.phoenix.internal.time.MonotonicScheduler;
import com.questrail.phoenix.internal.time.ScheduledExecutorScheduler;
import com.questrail.phoenix.internal.time.SystemMonotonicClock;
import com.questrail.phoenix.internal.time.SystemWallClock;
import com.questrail.phoenix.internal.time.WallClock;
import com.questrail.phoenix.model.Envelope;
import com.questrail.phoenix.observability.PhoenixErrorEvent;
import com.questrail.phoenix.observability.PhoenixObservabilitySink;
import com.questrail.phoenix.observability.PhoenixProtocolEvent;
import com.questrail.phoenix.observability.PhoenixTransportEvent;
import com.questrail.phoenix.observability.Slf4jPhoenixObservabilitySink;
import com.questrail.phoenix.transport.SocketTransport;
import com.questrail.phoenix.transport.SocketTransportFactory;
import com.questrail.phoenix.transport.SocketTransportListener;
import com.questrail.phoenix.transport.SocketUrls;
import com.questrail.phoenix.transport.TransportState;
import com.questrail.phoenix.transport.netty.NettyWebSocketTransportFactory;

import java.lang.ref.WeakReference;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * PhoenixSocket
 * =============================================================================
 * Connection controller for a Phoenix Channels socket: one transport
 * connection, many logical topics.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Transport lifecycle: connect, disconnect, reconnect</li>
 *   <li>Keep-alive: a heartbeat envelope every {@code heartbeatInterval}</li>
 *   <li>Loss handling: {@code phx_error} to every channel, then one reconnect
 *       attempt after the fixed reconnect delay, repeated for as long as the
 *       connection keeps failing</li>
 *   <li>Routing: inbound envelopes to the channels with a matching topic and
 *       to every message callback</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * <p>Every state change and every callback runs on one {@link SerialExecutor}
 * worker (the <em>serialized context</em>). Transport events, heartbeat and
 * reconnect timers, and the public lifecycle calls only enqueue work:</p>
 * <pre>
 *   transport IO thread ─┐
 *   heartbeat timer   ───┼──▶ SerialExecutor ──▶ state + callbacks
 *   reconnect timer   ───┤
 *   caller threads    ───┘
 * </pre>
 * <p>Fields marked "serialized context" below are read and written only from
 * worker tasks. Registries are copy-on-write lists and may be changed from any
 * thread.</p>
 *
 * <h2>Timers</h2>
 * <p>Heartbeat and reconnect timers are {@link MonotonicScheduler} tasks. Each
 * arming bumps a generation counter; a timer whose generation is stale when its
 * task reaches the worker does nothing. Cancelling is therefore idempotent and
 * harmless when it races the timer firing.</p>
 */
public class PhoenixSocket
{
    private final URI endpoint;
    private final Duration heartbeatInterval;
    private final Duration reconnectDelay;

    private final SocketTransportFactory transportFactory;
    private final EnvelopeCodec codec;
    private final SerialExecutor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final PhoenixObservabilitySink sink;
    private final List<AutoCloseable> ownedResources;

    private final List<PhoenixChannel> channels = new CopyOnWriteArrayList<>();
    private final List<Runnable> openCallbacks = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> closeCallbacks = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> errorCallbacks = new CopyOnWriteArrayList<>();
    private final List<Consumer<Envelope>> messageCallbacks = new CopyOnWriteArrayList<>();
    private volatile WeakReference<PhoenixSocketDelegate> delegate = new WeakReference<>(null);

    private final AtomicLong ref = new AtomicLong(0);
    private final boolean reconnectOnError = true;

    // Written on the serialized context; volatile so isConnected() can read it anywhere.
    private volatile SocketTransport transport;

    // Serialized context.
    private Map<String, String> params = Map.of();
    private boolean canSendHeartbeat;
    private long heartbeatGeneration;
    private Cancellable heartbeatTimer;
    private boolean canReconnect;
    private boolean reconnecting;
    private long reconnectGeneration;
    private Cancellable reconnectTimer;

    private PhoenixSocket(Builder b)
    {
        this.endpoint = b.config.endpoint();
        this.heartbeatInterval = b.config.heartbeatInterval();
        this.reconnectDelay = b.config.reconnectDelay();
        this.transportFactory = b.transportFactory;
        this.codec = b.codec;
        this.executor = b.executor;
        this.scheduler = b.scheduler;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.sink = b.observabilitySink;
        this.ownedResources = List.copyOf(b.ownedResources);
    }

    /**
     * Socket with the default Netty transport, its own worker and timer threads,
     * and SLF4J logging.
     */
    public static PhoenixSocket create(PhoenixSocketConfig config)
    {
        return builder(config).build();
    }

    public static PhoenixSocket create(String endpoint)
    {
        return create(PhoenixSocketConfig.withDefaults(endpoint));
    }

    public static Builder builder(PhoenixSocketConfig config)
    {
        return new Builder(config);
    }

    // -------------------------------------------------------------------------
    // Lifecycle (enqueued onto the serialized context)
    // -------------------------------------------------------------------------

    public void connect()
    {
        connect(Map.of());
    }

    /**
     * Connect with the given params, which are remembered for reconnects and
     * sent as query parameters.
     *
     * <p>Callers must {@link #disconnect()} before connecting again. A connect
     * issued while the current transport is connecting or open is reported and
     * ignored.</p>
     */
    public void connect(Map<String, String> params)
    {
        Objects.requireNonNull(params, "params");
        Map<String, String> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        executor.submit("connect", () -> doConnect(snapshot));
    }

    /**
     * Stop heartbeats, cancel any pending reconnect, and close the transport.
     * No callbacks fire for the closed transport.
     */
    public void disconnect()
    {
        executor.submit("disconnect", this::doDisconnect);
    }

    /**
     * Close the current transport and connect a fresh one with the last-used params.
     */
    public void reconnect()
    {
        executor.submit("reconnect", this::doReconnect);
    }

    /**
     * Encode and send an envelope on the current transport.
     *
     * @return completes once the frame is handed to the transport; completes
     *         exceptionally with {@link IllegalStateException} if there is no
     *         open transport
     */
    public CompletableFuture<Void> push(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        CompletableFuture<Void> result = new CompletableFuture<>();
        boolean accepted = executor.submit("push " + envelope.topic(), () -> {
            try {
                pushNow(envelope);
                result.complete(null);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        if (!accepted) {
            result.completeExceptionally(new IllegalStateException("Socket has been shut down"));
        }
        return result;
    }

    /**
     * Disconnect and release the worker, timer and IO threads this socket
     * created. Resources supplied through the builder are left to the caller.
     */
    public void shutdown()
    {
        disconnect();
        for (AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                sink.onError(new PhoenixErrorEvent(wallClock.now(), "Failed to release socket resource", e));
            }
        }
    }

    // -------------------------------------------------------------------------
    // Accessors (any thread)
    // -------------------------------------------------------------------------

    /**
     * Returns the current ref and advances the counter. Refs never repeat.
     */
    public long makeRef()
    {
        return ref.getAndIncrement();
    }

    /**
     * {@code true} iff a live transport reports {@link TransportState#OPEN}.
     */
    public boolean isConnected()
    {
        return socketState() == TransportState.OPEN;
    }

    /**
     * The live transport's state, or {@link TransportState#CLOSED} when there is none.
     */
    public TransportState socketState()
    {
        SocketTransport t = transport;
        return t == null ? TransportState.CLOSED : t.state();
    }

    public URI endpoint()
    {
        return endpoint;
    }

    // -------------------------------------------------------------------------
    // Registries (any thread)
    // -------------------------------------------------------------------------

    public void onOpen(Runnable callback)
    {
        openCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public void onClose(Consumer<String> callback)
    {
        closeCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public void onError(Consumer<String> callback)
    {
        errorCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public void onMessage(Consumer<Envelope> callback)
    {
        messageCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    /**
     * Register a channel for routing. Registering the same instance twice has no effect.
     */
    public void addChannel(PhoenixChannel channel)
    {
        Objects.requireNonNull(channel, "channel");
        synchronized (channels) {
            if (channels.stream().noneMatch(c -> c == channel)) {
                channels.add(channel);
            }
        }
    }

    /**
     * Stop routing to a channel (matched by identity).
     *
     * @return {@code true} if the channel was registered
     */
    public boolean removeChannel(PhoenixChannel channel)
    {
        Objects.requireNonNull(channel, "channel");
        synchronized (channels) {
            return channels.removeIf(c -> c == channel);
        }
    }

    public List<PhoenixChannel> channels()
    {
        return Collections.unmodifiableList(new ArrayList<>(channels));
    }

    /**
     * Replace the delegate. The socket keeps only a weak reference; pass
     * {@code null} to clear it.
     */
    public void setDelegate(PhoenixSocketDelegate delegate)
    {
        this.delegate = new WeakReference<>(delegate);
    }

    // -------------------------------------------------------------------------
    // Serialized context: lifecycle
    // -------------------------------------------------------------------------

    private void doConnect(Map<String, String> params)
    {
        discardReconnectTimer();

        SocketTransport t = transport;
        if (t != null) {
            TransportState state = t.state();
            if (state == TransportState.OPEN || state == TransportState.CONNECTING) {
                sink.onError(new PhoenixErrorEvent(wallClock.now(),
                        "connect() ignored: transport is already " + state + "; call disconnect() first", null));
                return;
            }
            // A closed or closing transport is never reopened.
            disconnectSocket();
        }

        this.params = params;
        t = transportFactory.create();
        t.setListener(new TransportListener(t));
        transport = t;

        URI target = SocketUrls.withParams(endpoint, params);
        t.setUrl(target);
        sink.onTransportEvent(new PhoenixTransportEvent(
                wallClock.now(), PhoenixTransportEvent.Kind.CONNECTING, target.toString()));
        t.open();
    }

    private void doDisconnect()
    {
        discardHeartbeatTimer();
        discardReconnectTimer();
        disconnectSocket();
    }

    private void doReconnect()
    {
        doDisconnect();
        doConnect(params);
    }

    private void disconnectSocket()
    {
        SocketTransport t = transport;
        if (t == null) {
            return;
        }
        t.setListener(null);
        transport = null;
        t.close();
        sink.onTransportEvent(new PhoenixTransportEvent(
                wallClock.now(), PhoenixTransportEvent.Kind.DISCONNECTED, endpoint.toString()));
    }

    private void pushNow(Envelope envelope)
    {
        SocketTransport t = transport;
        if (t == null) {
            throw new IllegalStateException(
                    "Cannot push to '" + envelope.topic() + "': socket has no transport, call connect() first");
        }
        t.send(codec.encode(envelope));
    }

    // -------------------------------------------------------------------------
    // Serialized context: heartbeat
    // -------------------------------------------------------------------------

    private void startHeartbeat()
    {
        discardHeartbeatTimer();
        canSendHeartbeat = true;
        armHeartbeat(heartbeatGeneration);
    }

    private void armHeartbeat(long generation)
    {
        heartbeatTimer = scheduler.scheduleAfter(heartbeatInterval, clock,
                () -> executor.submit("heartbeat", () -> heartbeatTick(generation)));
    }

    private void heartbeatTick(long generation)
    {
        if (!canSendHeartbeat || generation != heartbeatGeneration) {
            return;
        }
        // Re-arm first so a failed send does not end the loop.
        armHeartbeat(generation);
        sendHeartbeat();
    }

    private void sendHeartbeat()
    {
        SocketTransport t = transport;
        if (t == null || t.state() != TransportState.OPEN) {
            sink.onProtocolEvent(new PhoenixProtocolEvent(
                    wallClock.now(), PhoenixProtocolEvent.Kind.HEARTBEAT_SKIPPED, String.valueOf(socketState())));
            return;
        }
        long heartbeatRef = makeRef();
        pushNow(Envelope.heartbeat(heartbeatRef));
        sink.onProtocolEvent(new PhoenixProtocolEvent(
                wallClock.now(), PhoenixProtocolEvent.Kind.HEARTBEAT_SENT, String.valueOf(heartbeatRef)));
    }

    private void discardHeartbeatTimer()
    {
        canSendHeartbeat = false;
        heartbeatGeneration++;
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel();
            heartbeatTimer = null;
        }
    }

    // -------------------------------------------------------------------------
    // Serialized context: reconnect
    // -------------------------------------------------------------------------

    private void scheduleReconnect()
    {
        reconnecting = true;
        canReconnect = true;
        long generation = ++reconnectGeneration;
        reconnectTimer = scheduler.scheduleAfter(reconnectDelay, clock,
                () -> executor.submit("reconnect timer", () -> reconnectTimerFired(generation)));
        sink.onProtocolEvent(new PhoenixProtocolEvent(
                wallClock.now(), PhoenixProtocolEvent.Kind.RECONNECT_SCHEDULED, reconnectDelay.toString()));
    }

    private void reconnectTimerFired(long generation)
    {
        if (generation != reconnectGeneration) {
            return;
        }
        reconnectTimer = null;
        boolean attempt = canReconnect;
        canReconnect = false;
        reconnecting = false;
        if (attempt) {
            sink.onProtocolEvent(new PhoenixProtocolEvent(
                    wallClock.now(), PhoenixProtocolEvent.Kind.RECONNECT_ATTEMPT, endpoint.toString()));
            doReconnect();
        }
    }

    private void discardReconnectTimer()
    {
        if (reconnecting) {
            sink.onProtocolEvent(new PhoenixProtocolEvent(
                    wallClock.now(), PhoenixProtocolEvent.Kind.RECONNECT_CANCELLED, endpoint.toString()));
        }
        canReconnect = false;
        reconnecting = false;
        reconnectGeneration++;
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    // -------------------------------------------------------------------------
    // Serialized context: transport events
    // -------------------------------------------------------------------------

    private void handleOpen(SocketTransport source)
    {
        if (source != transport) {
            return;
        }
        sink.onTransportEvent(new PhoenixTransportEvent(
                wallClock.now(), PhoenixTransportEvent.Kind.OPENED, endpoint.toString()));

        discardReconnectTimer();
        if (!heartbeatInterval.isZero()) {
            startHeartbeat();
        }

        for (Runnable callback : openCallbacks) {
            invoke("open callback", callback);
        }
        PhoenixSocketDelegate d = delegate.get();
        if (d != null) {
            invoke("delegate socketDidOpen", d::socketDidOpen);
        }
    }

    private void handleClose(SocketTransport source, String reason)
    {
        if (source != transport) {
            return;
        }
        connectionLost(reason);
    }

    private void handleError(SocketTransport source, String message)
    {
        if (source != transport) {
            return;
        }
        sink.onTransportEvent(new PhoenixTransportEvent(
                wallClock.now(), PhoenixTransportEvent.Kind.ERROR, message));

        discardHeartbeatTimer();
        for (Consumer<String> callback : errorCallbacks) {
            invoke("error callback", () -> callback.accept(message));
        }
        PhoenixSocketDelegate d = delegate.get();
        if (d != null) {
            invoke("delegate socketDidReceiveError", () -> d.socketDidReceiveError(message));
        }

        // An error always means the connection is gone.
        connectionLost(message);
    }

    private void connectionLost(String reason)
    {
        sink.onTransportEvent(new PhoenixTransportEvent(
                wallClock.now(), PhoenixTransportEvent.Kind.CLOSED, reason));

        triggerChannelError(reason);

        if (reconnectOnError && !reconnecting) {
            scheduleReconnect();
        }

        discardHeartbeatTimer();

        for (Consumer<String> callback : closeCallbacks) {
            invoke("close callback", () -> callback.accept(reason));
        }
        PhoenixSocketDelegate d = delegate.get();
        if (d != null) {
            invoke("delegate socketDidClose", () -> d.socketDidClose(reason));
        }
    }

    private void triggerChannelError(String reason)
    {
        TextNode payload = TextNode.valueOf(reason);
        for (PhoenixChannel channel : channels) {
            invoke("phx_error delivery to " + channel.topic(),
                    () -> channel.triggerEvent(Envelope.CHANNEL_ERROR_EVENT, payload, OptionalLong.of(0)));
        }
    }

    private void handleMessage(SocketTransport source, String rawMessage)
    {
        if (source != transport) {
            return;
        }

        final Envelope envelope;
        try {
            envelope = codec.decode(rawMessage);
        } catch (EnvelopeDecodeException e) {
            sink.onError(new PhoenixErrorEvent(wallClock.now(), "Dropping malformed envelope: " + e.getMessage(), e));
            return;
        }

        for (PhoenixChannel channel : channels) {
            if (channel.topic().equals(envelope.topic())) {
                invoke("delivery to " + envelope.topic(),
                        () -> channel.triggerEvent(envelope.event(), envelope.payload(), envelope.ref()));
            }
        }

        for (Consumer<Envelope> callback : messageCallbacks) {
            invoke("message callback", () -> callback.accept(envelope));
        }
    }

    /**
     * Runs one user callback; a throwing callback does not prevent the rest.
     */
    private void invoke(String what, Runnable callback)
    {
        try {
            callback.run();
        } catch (RuntimeException e) {
            sink.onError(new PhoenixErrorEvent(wallClock.now(), what + " failed", e));
        }
    }

    // -------------------------------------------------------------------------
    // Transport listener
    // -------------------------------------------------------------------------

    /**
     * Bound to one transport instance. Runs on the transport's IO thread and
     * only enqueues; the bound instance lets the worker drop events from a
     * transport that has since been replaced.
     */
    private final class TransportListener implements SocketTransportListener
    {
        private final SocketTransport source;

        private TransportListener(SocketTransport source)
        {
            this.source = source;
        }

        @Override
        public void didOpen()
        {
            executor.submit("transport opened", () -> handleOpen(source));
        }

        @Override
        public void didReceive(String text)
        {
            executor.submit("inbound message", () -> handleMessage(source, text));
        }

        @Override
        public void didError(String message)
        {
            executor.submit("transport error", () -> handleError(source, message));
        }

        @Override
        public void didClose(int code, String reason, boolean wasClean)
        {
            executor.submit("transport closed", () -> handleClose(source, reason));
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    /**
     * Composition root for a socket. Anything not supplied is created with
     * production defaults and released by {@link PhoenixSocket#shutdown()}.
     */
    public static final class Builder
    {
        private final PhoenixSocketConfig config;
        private SocketTransportFactory transportFactory;
        private EnvelopeCodec codec;
        private SerialExecutor executor;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock;
        private WallClock wallClock;
        private PhoenixObservabilitySink observabilitySink;
        private final List<AutoCloseable> ownedResources = new ArrayList<>();

        private Builder(PhoenixSocketConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withTransportFactory(SocketTransportFactory transportFactory)
        {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder withCodec(EnvelopeCodec codec)
        {
            this.codec = codec;
            return this;
        }

        public Builder withExecutor(SerialExecutor executor)
        {
            this.executor = executor;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock)
        {
            this.scheduler = scheduler;
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(PhoenixObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public PhoenixSocket build()
        {
            ownedResources.clear();

            if (observabilitySink == null) {
                observabilitySink = new Slf4jPhoenixObservabilitySink();
            }
            if (wallClock == null) {
                wallClock = SystemWallClock.INSTANCE;
            }
            if (codec == null) {
                codec = new JacksonEnvelopeCodec();
            }
            if (scheduler == null) {
                ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "phoenix-socket-timer");
                    t.setDaemon(true);
                    return t;
                });
                clock = SystemMonotonicClock.INSTANCE;
                scheduler = new ScheduledExecutorScheduler(timers, clock);
                ownedResources.add(timers::shutdownNow);
            }
            if (executor == null) {
                ExecutorService worker = SerialExecutor.newWorker("phoenix-socket-" + config.endpoint().getHost());
                executor = new SerialExecutor(worker, observabilitySink, wallClock);
                ownedResources.add(() -> {
                    worker.shutdown();
                    if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                        worker.shutdownNow();
                    }
                });
            }
            Objects.requireNonNull(clock, "clock");
            if (transportFactory == null) {
                NettyWebSocketTransportFactory netty = new NettyWebSocketTransportFactory(
                        config.connectTimeout(), config.maxFramePayloadLength());
                transportFactory = netty;
                ownedResources.add(netty);
            }

            return new PhoenixSocket(this);
        }
    }
}
