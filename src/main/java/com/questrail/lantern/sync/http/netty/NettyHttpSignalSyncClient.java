package com.questrail.lantern.sync.http.netty;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.lantern.api.ExternalSyncException;
import com.questrail.lantern.config.SignalSyncConfig;
import com.questrail.lantern.sync.SignalReport;
import com.questrail.lantern.sync.SignalSyncClient;
import com.questrail.lantern.sync.SyncReceipt;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;

import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyHttpSignalSyncClient
 * =============================================================================
 * Netty-backed implementation of the {@link SignalSyncClient} port.
 *
 * <h2>Wire format</h2>
 * One HTTP/1.1 {@code POST} per push to {@code host:port/path} with body
 * <pre>
 *   {"data":{"station":&lt;id&gt;,"boost":&lt;value&gt;,"key":"&lt;apiKey&gt;"}}
 * </pre>
 * The connection is closed after the response. Any status code is returned
 * as-is in the {@link SyncReceipt}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * The event loop group is created in the constructor and released by
 * {@link #close()}.
 */
public final class NettyHttpSignalSyncClient implements SignalSyncClient, AutoCloseable
{
    private static final int MAX_RESPONSE_BYTES = 64 * 1024;

    private final SignalSyncConfig config;
    private final ObjectMapper mapper;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyHttpSignalSyncClient(SignalSyncConfig config, ObjectMapper mapper)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.requestTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_RESPONSE_BYTES));
                    }
                });
    }

    public NettyHttpSignalSyncClient(SignalSyncConfig config)
    {
        this(config, new ObjectMapper());
    }

    @Override
    public SyncReceipt push(SignalReport report)
    {
        Objects.requireNonNull(report, "report");

        if (!config.isConfigured()) {
            throw ExternalSyncException.unconfigured("hacking api host or key not set");
        }

        byte[] body = encode(report);
        long timeoutMillis = config.requestTimeout().toMillis();
        CompletableFuture<Integer> status = new CompletableFuture<>();
        Channel channel = null;

        try {
            channel = awaitConnected(
                    bootstrap.connect(config.host(), config.port()),
                    timeoutMillis,
                    config.host() + ":" + config.port());
            channel.pipeline().addLast(new ResponseHandler(status));

            FullHttpRequest request = new DefaultFullHttpRequest(
                    HttpVersion.HTTP_1_1, HttpMethod.POST, config.path(), Unpooled.wrappedBuffer(body));
            request.headers()
                    .set(HttpHeaderNames.HOST, config.host())
                    .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                    .setInt(HttpHeaderNames.CONTENT_LENGTH, body.length)
                    .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

            channel.writeAndFlush(request).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    status.completeExceptionally(f.cause());
                }
            });

            return new SyncReceipt(status.get(timeoutMillis, TimeUnit.MILLISECONDS));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExternalSyncException.transport("interrupted while pushing station " + report.stationId(), e);
        }
        catch (ExecutionException e) {
            throw ExternalSyncException.transport("push of station " + report.stationId() + " failed", e.getCause());
        }
        catch (TimeoutException e) {
            throw ExternalSyncException.transport("push of station " + report.stationId() + " timed out", e);
        }
        finally {
            if (channel != null) {
                channel.close();
            }
        }
    }

    /**
     * Waits for {@code connect} to finish. On timeout the attempt is cancelled
     * and its channel closed, so a connection completing late is not leaked.
     */
    static Channel awaitConnected(ChannelFuture connect, long timeoutMillis, String target)
            throws InterruptedException
    {
        if (!connect.await(timeoutMillis)) {
            connect.cancel(true);
            connect.channel().close();
            throw ExternalSyncException.transport("connect to " + target + " timed out", null);
        }
        if (!connect.isSuccess()) {
            throw ExternalSyncException.transport("connect to " + target + " failed", connect.cause());
        }
        return connect.channel();
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private byte[] encode(SignalReport report)
    {
        ObjectNode root = mapper.createObjectNode();
        root.putObject("data")
                .put("station", report.stationId())
                .put("boost", report.boost())
                .put("key", config.apiKey());
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw ExternalSyncException.transport("could not encode report for station " + report.stationId(), e);
        }
    }

    /**
     * Completes the pending push with the response status, or with the
     * failure that closed the channel first.
     */
    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse>
    {
        private final CompletableFuture<Integer> status;

        private ResponseHandler(CompletableFuture<Integer> status)
        {
            this.status = status;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response)
        {
            status.complete(response.status().code());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            status.completeExceptionally(new ClosedChannelException());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            status.completeExceptionally(cause);
            ctx.close();
        }
    }
}
