package com.questrail.iso8583.transport.netty;

import com.questrail.iso8583.transport.FramingException;
import com.questrail.iso8583.transport.ReadDeadlineException;
import com.questrail.iso8583.transport.ServerEndpoint;
import com.questrail.iso8583.transport.ServerEndpointListener;
import com.questrail.iso8583.transport.TransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettyServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link ServerEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It never parses
 * ISO 8583 bodies, resolves handlers or composes responses.
 *
 * <h2>Per-connection pipeline</h2>
 * <pre>
 *   LengthPrefixFrameDecoder   (one frame, payload as byte[])
 *     → ConnectionHandler        (read deadline, listener on a dispatch worker, write, close)
 * </pre>
 *
 * <p>The read deadline is a single absolute timer started when the connection
 * becomes active. Trickling bytes does not extend it; only a complete frame
 * cancels it.</p>
 *
 * <p>Listener callbacks for frames run on an unbounded cached worker pool,
 * one task per connection, so a slow handler never stalls an event loop
 * shared with other connections.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 */
public final class NettyServerEndpoint implements ServerEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyServerEndpoint.class);

    private static final String FRAME_DECODER = "frameDecoder";
    private static final String CONNECTION = "connection";

    private final InetSocketAddress bindAddress;
    private final Duration idleTimeout;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ExecutorService dispatchWorkers;
    private final ServerBootstrap bootstrap;

    private volatile ServerEndpointListener listener;
    private volatile Channel channel;

    public NettyServerEndpoint(InetSocketAddress bindAddress, Duration idleTimeout)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");

        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("iso8583-accept"));
        this.workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("iso8583-io"));
        this.dispatchWorkers = Executors.newCachedThreadPool(new DefaultThreadFactory("iso8583-dispatch", true));
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new AcceptErrorHandler())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(FRAME_DECODER, new LengthPrefixFrameDecoder());
                        p.addLast(CONNECTION, new ConnectionHandler());
                    }
                });
    }

    @Override
    public void setListener(ServerEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        ServerEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            releaseResources();
            throw new TransportException("Failed to bind " + bindAddress, f.cause());
        }

        channel = f.channel();
        l.onListening(channel.localAddress());
    }

    @Override
    public void awaitStopped() throws InterruptedException
    {
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Endpoint has not been started");
        }
        ch.closeFuture().await();
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        releaseResources();

        ServerEndpointListener l = listener;
        if (l != null && ch != null) {
            l.onStopped(ch.localAddress());
        }
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return (ch == null) ? null : ch.localAddress();
    }

    @Override
    public String toString()
    {
        return "NettyServerEndpoint[bind=" + bindAddress + ", idleTimeout=" + idleTimeout + "]";
    }

    private void releaseResources()
    {
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        dispatchWorkers.shutdown();
    }

    private ServerEndpointListener requireListener()
    {
        ServerEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("ServerEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * AcceptErrorHandler
     * -------------------------------------------------------------------------
     * Reports accept failures on the listening channel. The event is passed on
     * so Netty's acceptor can back off briefly; the listener stays open.
     */
    private final class AcceptErrorHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            ServerEndpointListener l = listener;
            if (l != null) {
                l.onAcceptError(cause);
            }
            ctx.fireExceptionCaught(cause);
        }
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * Drives one connection through read, dispatch, write and close. One
     * instance per channel.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<byte[]>
    {
        // Guarded by the channel's event loop; set once a frame or failure ends the read phase.
        private boolean readComplete;
        private ScheduledFuture<?> readDeadline;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            readDeadline = ctx.executor().schedule(
                    () -> readDeadlineExpired(ctx), idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, byte[] payload)
        {
            if (readComplete) {
                return;
            }
            readComplete = true;
            cancelReadDeadline();

            ctx.channel().config().setAutoRead(false);

            final SocketAddress remote = ctx.channel().remoteAddress();
            final ServerEndpointListener l = listener;
            try {
                dispatchWorkers.execute(() -> respond(ctx, l, remote, payload));
            } catch (RejectedExecutionException e) {
                log.debug("Dispatch rejected for {}; endpoint is stopping", remote);
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            cancelReadDeadline();
            if (!readComplete) {
                readComplete = true;
                ServerEndpointListener l = listener;
                if (l != null) {
                    l.onConnectionError(ctx.channel().remoteAddress(), false,
                            new FramingException(
                                    "Connection closed before a complete frame was received"));
                }
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (!readComplete) {
                readComplete = true;
                ServerEndpointListener l = listener;
                if (l != null) {
                    Throwable reported = (cause instanceof DecoderException && cause.getCause() != null)
                            ? cause.getCause()
                            : cause;
                    l.onConnectionError(ctx.channel().remoteAddress(), false, reported);
                }
            } else {
                log.debug("Ignoring exception after request was read", cause);
            }
            ctx.close();
        }

        private void readDeadlineExpired(ChannelHandlerContext ctx)
        {
            if (readComplete) {
                return;
            }
            readComplete = true;
            ServerEndpointListener l = listener;
            if (l != null) {
                l.onConnectionError(ctx.channel().remoteAddress(), false, new ReadDeadlineException(idleTimeout));
            }
            ctx.close();
        }

        private void cancelReadDeadline()
        {
            if (readDeadline != null) {
                readDeadline.cancel(false);
                readDeadline = null;
            }
        }

        private void respond(ChannelHandlerContext ctx,
                             ServerEndpointListener l,
                             SocketAddress remote,
                             byte[] payload)
        {
            Optional<byte[]> response;
            try {
                response = l.onFrame(remote, payload);
            } catch (RuntimeException e) {
                log.error("Listener failed processing frame from {}", remote, e);
                response = Optional.empty();
            }

            if (response.isEmpty()) {
                ctx.close();
                return;
            }

            ctx.writeAndFlush(Unpooled.wrappedBuffer(response.get()))
                    .addListener((ChannelFutureListener) future -> {
                        if (!future.isSuccess()) {
                            l.onConnectionError(remote, true, future.cause());
                        }
                        future.channel().close();
                    });
        }
    }
}
