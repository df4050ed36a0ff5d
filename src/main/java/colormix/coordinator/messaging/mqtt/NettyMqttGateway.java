package colormix.coordinator.messaging.mqtt;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.messaging.MessageHandler;
import colormix.coordinator.messaging.MessagingException;
import colormix.coordinator.messaging.MessagingGateway;
import colormix.coordinator.messaging.Subscription;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * MQTT over TCP (optionally TLS) gateway built on Netty's MQTT codec.
 *
 * Reconnects with exponential backoff (1s doubling to 30s) and re-subscribes
 * after every reconnect. Publishing never blocks: while the session is down
 * messages are dropped with a warning, so callers on the worker thread keep
 * making progress.
 */
public final class NettyMqttGateway implements MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(NettyMqttGateway.class);

    static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final CoordinatorConfig config;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    private volatile Channel channel;
    private volatile MqttClientHandler handler;
    private volatile boolean sessionUp = false;
    private volatile boolean closed = false;
    private volatile Duration backoff = INITIAL_BACKOFF;

    public NettyMqttGateway(CoordinatorConfig config) {
        this.config = config;
        this.group = new NioEventLoopGroup(1);

        SslContext sslContext = null;
        if (config.mqttTls()) {
            try {
                sslContext = SslContextBuilder.forClient().build();
            } catch (SSLException e) {
                throw new MessagingException("Failed to create TLS context", e);
            }
        }
        final SslContext ssl = sslContext;

        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), config.mqttHost(), config.mqttPort()));
                        }
                        int keepAlive = config.mqttKeepAliveSeconds();
                        p.addLast(new IdleStateHandler(0, Math.max(1, keepAlive / 2), 0, TimeUnit.SECONDS));
                        p.addLast(MqttEncoder.INSTANCE);
                        p.addLast(new MqttDecoder());
                        MqttClientHandler h = new MqttClientHandler(
                                config.mqttClientId(),
                                config.mqttUsername(),
                                config.mqttPassword(),
                                keepAlive,
                                NettyMqttGateway.this::topicFilters,
                                new SessionListener());
                        handler = h;
                        p.addLast(h);
                    }
                });
    }

    @Override
    public void connect() {
        if (closed) {
            throw new MessagingException("gateway is closed");
        }
        doConnect();
    }

    private void doConnect() {
        if (closed) {
            return;
        }
        log.info("Connecting to MQTT broker {}:{}", config.mqttHost(), config.mqttPort());
        bootstrap.connect(config.mqttHost(), config.mqttPort()).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                channel.closeFuture().addListener(f -> scheduleReconnect());
            } else {
                log.warn("MQTT connect failed: {}", future.cause() != null ? future.cause().getMessage() : "unknown");
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        sessionUp = false;
        if (closed || group.isShuttingDown()) {
            return;
        }
        Duration delay = backoff;
        backoff = nextBackoff(delay);
        log.info("Reconnecting to MQTT broker in {}ms", delay.toMillis());
        group.schedule(this::doConnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    static Duration nextBackoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : doubled;
    }

    @Override
    public void subscribe(Collection<String> topicFilters, MessageHandler messageHandler) {
        List<String> filters = new ArrayList<>(topicFilters);
        subscriptions.add(new Subscription(filters, messageHandler));

        Channel ch = channel;
        MqttClientHandler h = handler;
        if (sessionUp && ch != null && h != null) {
            ch.eventLoop().execute(() -> h.subscribeLate(ch.pipeline().context(h), filters));
        }
    }

    private List<String> topicFilters() {
        List<String> all = new ArrayList<>();
        for (Subscription sub : subscriptions) {
            for (String filter : sub.topicFilters()) {
                if (!all.contains(filter)) {
                    all.add(filter);
                }
            }
        }
        return all;
    }

    @Override
    public void publish(String topic, String payload) {
        if (closed) {
            throw new MessagingException("gateway is closed");
        }
        Channel ch = channel;
        if (!sessionUp || ch == null || !ch.isActive()) {
            log.warn("MQTT session down, dropping message on {}", topic);
            return;
        }
        ch.writeAndFlush(MqttClientHandler.publishMessage(topic, payload)).addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("MQTT publish to {} failed: {}", topic, f.cause().getMessage());
            }
        });
    }

    @Override
    public boolean isConnected() {
        return sessionUp && !closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        sessionUp = false;
        try {
            Channel ch = channel;
            if (ch != null) {
                ch.close().syncUninterruptibly();
            }
        } finally {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            log.info("MQTT gateway closed");
        }
    }

    private void dispatch(String topic, String payload) {
        for (Subscription sub : subscriptions) {
            if (!sub.accepts(topic)) {
                continue;
            }
            try {
                sub.handler().onMessage(topic, payload);
            } catch (Exception e) {
                log.error("Handler failed for message on {}", topic, e);
            }
        }
    }

    private final class SessionListener implements MqttClientHandler.Listener {
        @Override
        public void onSessionUp() {
            sessionUp = true;
            backoff = INITIAL_BACKOFF;
        }

        @Override
        public void onMessage(String topic, String payload) {
            dispatch(topic, payload);
        }

        @Override
        public void onSessionDown(Throwable cause) {
            if (sessionUp) {
                log.warn("MQTT session lost");
            }
            sessionUp = false;
        }
    }
}
