package tsproxy.server;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;

import io.netty.bootstrap.AbstractBootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpContentCompressor;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.cors.CorsConfig;
import io.netty.handler.codec.http.cors.CorsConfigBuilder;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import tsproxy.common.configuration.CorsProperties;
import tsproxy.common.configuration.HttpProperties;
import tsproxy.common.configuration.ServerProperties;
import tsproxy.netty.http.HttpQueryRequestHandler;
import tsproxy.netty.http.HttpRequestDecoder;
import tsproxy.netty.http.HttpVersionRequestHandler;
import tsproxy.netty.http.TsProxyExceptionHandler;
import tsproxy.server.cache.QueryOrchestrator;

public class Server {

    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private final ApplicationContext applicationContext;
    private final QueryOrchestrator orchestrator;
    private final ServerProperties serverProperties;
    private final HttpProperties httpProperties;

    private int shutdownQuietPeriod;
    private EventLoopGroup httpWorkerGroup = null;
    private EventLoopGroup httpBossGroup = null;
    private EventExecutorGroup queryGroup = null;
    protected Channel httpChannelHandle = null;

    public Server(ApplicationContext applicationContext, QueryOrchestrator orchestrator,
            ServerProperties serverProperties, HttpProperties httpProperties) {
        this.applicationContext = applicationContext;
        this.orchestrator = orchestrator;
        this.serverProperties = serverProperties;
        this.httpProperties = httpProperties;
    }

    public void start() {
        log.info("Starting {}", this.getClass().getSimpleName());
        try {
            shutdownQuietPeriod = serverProperties.getShutdownQuietPeriod();
            httpWorkerGroup = new NioEventLoopGroup();
            httpBossGroup = new NioEventLoopGroup();
            queryGroup = new DefaultEventExecutorGroup(httpProperties.getQueryThreads());

            log.info("Creating http server");
            final int httpPort = httpProperties.getPort();
            final String httpIp = httpProperties.getIp();
            final ServerBootstrap httpServer = new ServerBootstrap();
            httpServer.group(httpBossGroup, httpWorkerGroup);
            httpServer.channel(NioServerSocketChannel.class);
            httpServer.handler(new LoggingHandler());
            httpServer.childHandler(setupHttpChannelHandler());
            httpServer.option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);
            httpServer.option(ChannelOption.SO_BACKLOG, 128);
            httpServer.childOption(ChannelOption.SO_KEEPALIVE, true);
            httpChannelHandle = bind(httpServer, httpIp, httpPort);
            final InetSocketAddress address = (InetSocketAddress) httpChannelHandle.localAddress();
            log.info("TsProxyServer started. Listening on {}:{} for HTTP traffic",
                    address.getAddress().getHostAddress(), address.getPort());
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            if (null != applicationContext) {
                SpringApplication.exit(applicationContext, () -> 1);
            } else {
                throw new IllegalStateException("Unable to start " + this.getClass().getSimpleName(), e);
            }
        }
    }

    public void shutdown() {
        if (httpChannelHandle != null) {
            log.info("Closing httpChannelHandle");
            try {
                httpChannelHandle.close().get();
            } catch (final Exception e) {
                log.error("Channel:" + httpChannelHandle.config() + " -> " + e.getMessage(), e);
            }
        }

        List<Future<?>> groupFutures = new ArrayList<>();
        if (httpBossGroup != null) {
            log.info("Shutting down httpBossGroup");
            groupFutures.add(httpBossGroup.shutdownGracefully(shutdownQuietPeriod, 10, TimeUnit.SECONDS));
        }
        if (httpWorkerGroup != null) {
            log.info("Shutting down httpWorkerGroup");
            groupFutures.add(httpWorkerGroup.shutdownGracefully(shutdownQuietPeriod, 10, TimeUnit.SECONDS));
        }
        if (queryGroup != null) {
            log.info("Shutting down queryGroup");
            groupFutures.add(queryGroup.shutdownGracefully(shutdownQuietPeriod, 10, TimeUnit.SECONDS));
        }
        groupFutures.parallelStream().forEach(f -> {
            try {
                f.get();
            } catch (final Exception e) {
                log.error("Group:" + f.toString() + " -> " + e.getMessage(), e);
            }
        });
        log.info("{} shut down.", this.getClass().getSimpleName());
    }

    /**
     * @return the port the http server is bound to, useful when configured with port 0
     */
    public int getHttpPort() {
        return ((InetSocketAddress) httpChannelHandle.localAddress()).getPort();
    }

    protected void setupHttpSocketChannel(SocketChannel ch) {
        ch.pipeline().addLast("http", new HttpServerCodec());
        ch.pipeline().addLast("decompressor", new HttpContentDecompressor());
        ch.pipeline().addLast("aggregator", new HttpObjectAggregator(httpProperties.getMaxContentLength()));
        ch.pipeline().addLast("compressor", new HttpContentCompressor());
        CorsProperties corsProperties = httpProperties.getCors();
        if (corsProperties.isEnabled()) {
            final CorsConfigBuilder ccb;
            if (corsProperties.isAllowAnyOrigin()) {
                ccb = CorsConfigBuilder.forAnyOrigin();
            } else {
                ccb = CorsConfigBuilder.forOrigins(corsProperties.getAllowedOrigins().stream().toArray(String[]::new));
            }
            if (corsProperties.isAllowNullOrigin()) {
                ccb.allowNullOrigin();
            }
            corsProperties.getAllowedMethods().stream().map(HttpMethod::valueOf).forEach(ccb::allowedRequestMethods);
            corsProperties.getAllowedHeaders().forEach(ccb::allowedRequestHeaders);
            CorsConfig cors = ccb.build();
            log.trace("Cors configuration: {}", cors);
            ch.pipeline().addLast("cors", new CorsHandler(cors));
        }
        ch.pipeline().addLast("queryDecoder", new HttpRequestDecoder());
        ch.pipeline().addLast("version", new HttpVersionRequestHandler());
        ch.pipeline().addLast(queryGroup, "query", new HttpQueryRequestHandler(orchestrator));
        ch.pipeline().addLast("error", new TsProxyExceptionHandler());
    }

    protected ChannelHandler setupHttpChannelHandler() {
        return new ChannelInitializer<SocketChannel>() {

            @Override
            protected void initChannel(SocketChannel ch) {
                setupHttpSocketChannel(ch);
            }
        };
    }

    protected Channel bind(AbstractBootstrap<?, ?> server, String ip, int port) {
        Channel channel = null;
        long start = System.currentTimeMillis();
        long now = start;
        int attempts = 0;
        while (channel == null && ((now - start) < 30000) && attempts < 10) {
            try {
                log.trace("Binding to port:" + ip + ":" + port + " attempt " + ++attempts);
                channel = server.bind(ip, port).sync().channel();
            } catch (Throwable t) {
                log.error(t.getMessage() + " Binding to port:" + ip + ":" + port);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            now = System.currentTimeMillis();
        }
        if (channel == null) {
            throw new IllegalStateException("Failed to bind to port:" + ip + ":" + port);
        }
        log.trace("Successfully bound to port:" + ip + ":" + port + " in " + attempts + " attempts (" + (now - start)
                + "ms)");
        return channel;
    }
}
