package com.questrail.iso8583.dispatch;

import com.questrail.iso8583.api.IsoHandler;
import com.questrail.iso8583.api.IsoMessage;
import com.questrail.iso8583.codec.IsoCodecException;
import com.questrail.iso8583.config.DispatchEngineConfig;
import com.questrail.iso8583.core.IsoMessageFactory;
import com.questrail.iso8583.observability.DispatchErrorEvent;
import com.questrail.iso8583.observability.DispatchEvent;
import com.questrail.iso8583.observability.DispatchObservabilitySink;
import com.questrail.iso8583.observability.DispatchStage;
import com.questrail.iso8583.observability.Slf4jDispatchObservabilitySink;
import com.questrail.iso8583.observability.TransportEvent;
import com.questrail.iso8583.schema.FieldSchema;
import com.questrail.iso8583.transport.FramingException;
import com.questrail.iso8583.transport.LengthPrefixFraming;
import com.questrail.iso8583.transport.ServerEndpoint;
import com.questrail.iso8583.transport.ServerEndpointListener;
import com.questrail.iso8583.transport.netty.NettyServerEndpoint;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * IsoDispatchEngine
 * =============================================================================
 * Composition root for serving ISO 8583 requests over TCP.
 *
 * <h2>Architectural Role</h2>
 * This class wires a {@link ServerEndpoint}, an {@link IsoMessageFactory} and a
 * {@link HandlerRegistry} together. It owns no sockets and performs no
 * byte-level field encoding itself.
 *
 * <h2>Request path</h2>
 * <pre>
 *   ServerEndpoint (one frame per connection)
 *        → IsoMessage.parse
 *            → RoutingKey from configured routing fields
 *                → HandlerRegistry.resolve
 *                    → IsoHandler.handle (mutates the message in place)
 *                        → IsoMessage.compose
 *                            → LengthPrefixFraming.frame
 *                                → ServerEndpoint (write, close)
 * </pre>
 *
 * <p>Every failure on this path is reported to the
 * {@link DispatchObservabilitySink} with the {@link DispatchStage} it occurred
 * in, and the connection is closed without a response. Failures never
 * propagate to the accept loop.</p>
 *
 * <h2>Handler contract</h2>
 * A handler receives the parsed request and turns it into the response by
 * mutating it. Handlers for different connections may run concurrently.
 */
public final class IsoDispatchEngine
{
    private final DispatchEngineConfig config;
    private final IsoMessageFactory messageFactory;
    private final HandlerRegistry registry;
    private final DispatchObservabilitySink sink;
    private final ServerEndpoint endpoint;
    private final AtomicBoolean started = new AtomicBoolean();

    private IsoDispatchEngine(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.messageFactory = Objects.requireNonNull(builder.messageFactory, "messageFactory");
        this.sink = Objects.requireNonNull(builder.sink, "sink");
        this.endpoint = (builder.endpoint != null)
                ? builder.endpoint
                : new NettyServerEndpoint(config.bindAddress(), config.idleTimeout());
        this.registry = new HandlerRegistry(config.routingFields().size());

        this.endpoint.setListener(new Listener());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers {@code handler} for requests whose routing field values equal
     * {@code keyParts}, in routing field order.
     *
     * @throws IllegalArgumentException if the number of parts differs from the
     *                                  number of configured routing fields
     */
    public void addHandler(IsoHandler handler, String... keyParts) {
        registry.addHandler(handler, keyParts);
    }

    /**
     * Sets the handler used when no specific handler matches. Replaces any
     * earlier default for this engine only.
     */
    public void addDefaultHandler(IsoHandler handler) {
        registry.setDefaultHandler(handler);
    }

    /**
     * Binds the listener and blocks until {@link #stop()} is called from
     * another thread.
     *
     * @throws com.questrail.iso8583.transport.TransportException if binding fails
     */
    public void run() throws InterruptedException {
        runInBackground();
        endpoint.awaitStopped();
    }

    /**
     * Binds the listener and returns once it accepts connections.
     *
     * @throws com.questrail.iso8583.transport.TransportException if binding fails
     */
    public void runInBackground() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Dispatch engine already started");
        }
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    /**
     * Address the listener is bound to, or {@code null} before it starts.
     */
    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    public DispatchEngineConfig config() {
        return config;
    }

    /**
     * Runs one request payload (without its length header) through decode,
     * route, handle and encode.
     *
     * @return the framed response, or empty if any step failed
     */
    public Optional<byte[]> process(byte[] payload) {
        return process(null, payload);
    }

    Optional<byte[]> process(SocketAddress remote, byte[] payload) {
        IsoMessage message = messageFactory.newMessage();
        try {
            message.parse(LengthPrefixFraming.decodeText(payload));
        } catch (IsoCodecException e) {
            reportError(DispatchStage.DECODE, remote, e);
            return Optional.empty();
        }

        String requestMti = message.getMti();
        RoutingKey key = routingKeyOf(message);

        final HandlerRegistry.Resolution resolution;
        try {
            resolution = registry.resolve(key);
        } catch (HandlerNotFoundException e) {
            sink.onError(new DispatchErrorEvent(Instant.now(), DispatchStage.ROUTE, remote, e.getMessage(), null));
            return Optional.empty();
        }

        try {
            resolution.handler().handle(message);
        } catch (RuntimeException e) {
            reportError(DispatchStage.HANDLE, remote, e);
            return Optional.empty();
        }

        final byte[] response;
        try {
            response = LengthPrefixFraming.frame(message.compose());
        } catch (IsoCodecException | FramingException e) {
            reportError(DispatchStage.ENCODE, remote, e);
            return Optional.empty();
        }

        sink.onDispatch(new DispatchEvent(
                Instant.now(),
                remote,
                key.parts(),
                resolution.usedDefault(),
                requestMti,
                message.getMti()));
        return Optional.of(response);
    }

    private RoutingKey routingKeyOf(IsoMessage message) {
        List<String> parts = new ArrayList<>(config.routingFields().size());
        for (int field : config.routingFields()) {
            parts.add(message.getField(field));
        }
        return new RoutingKey(parts);
    }

    private void reportError(DispatchStage stage, SocketAddress remote, Throwable cause) {
        sink.onError(new DispatchErrorEvent(Instant.now(), stage, remote, describe(cause), cause));
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return (message == null) ? cause.getClass().getSimpleName() : message;
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    private final class Listener implements ServerEndpointListener {
        @Override
        public void onListening(SocketAddress localAddress) {
            sink.onTransportEvent(new TransportEvent(Instant.now(), TransportEvent.Kind.LISTENING, localAddress));
        }

        @Override
        public void onStopped(SocketAddress localAddress) {
            sink.onTransportEvent(new TransportEvent(Instant.now(), TransportEvent.Kind.STOPPED, localAddress));
        }

        @Override
        public Optional<byte[]> onFrame(SocketAddress remote, byte[] payload) {
            return process(remote, payload);
        }

        @Override
        public void onConnectionError(SocketAddress remote, boolean writing, Throwable cause) {
            reportError(writing ? DispatchStage.WRITE : DispatchStage.READ, remote, cause);
        }

        @Override
        public void onAcceptError(Throwable cause) {
            reportError(DispatchStage.ACCEPT, null, cause);
        }
    }

    public static final class Builder {
        private DispatchEngineConfig config;
        private IsoMessageFactory messageFactory;
        private DispatchObservabilitySink sink = new Slf4jDispatchObservabilitySink();
        private ServerEndpoint endpoint;

        public Builder withConfig(DispatchEngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSchema(FieldSchema schema) {
            this.messageFactory = new IsoMessageFactory(schema);
            return this;
        }

        public Builder withMessageFactory(IsoMessageFactory messageFactory) {
            this.messageFactory = messageFactory;
            return this;
        }

        public Builder withObservabilitySink(DispatchObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Overrides the default Netty TCP endpoint built from the config.
         */
        public Builder withEndpoint(ServerEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public IsoDispatchEngine build() {
            if (config == null) {
                throw new IllegalStateException("DispatchEngineConfig is required");
            }
            if (messageFactory == null) {
                throw new IllegalStateException("A field schema or message factory is required");
            }
            return new IsoDispatchEngine(this);
        }
    }
}
