package colormix.coordinator.messaging.mqtt;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.mqtt.*;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * MQTT 3.1.1 client session on one connection.
 *
 * On channel activation sends CONNECT; after a successful CONNACK subscribes to
 * every topic filter known at that moment (so subscriptions survive
 * reconnects). Inbound PUBLISH payloads are forwarded to the {@link Listener};
 * QoS 1 publishes are acknowledged. Writer idleness triggers PINGREQ.
 */
public class MqttClientHandler extends SimpleChannelInboundHandler<MqttMessage> {

    private static final Logger log = LoggerFactory.getLogger(MqttClientHandler.class);

    /** Session callbacks, invoked on the channel's event loop. */
    public interface Listener {
        void onSessionUp();

        void onMessage(String topic, String payload);

        void onSessionDown(Throwable cause);
    }

    private final String clientId;
    private final String username;
    private final String password;
    private final int keepAliveSeconds;
    private final Supplier<List<String>> topicFilters;
    private final Listener listener;
    private final AtomicInteger messageIds = new AtomicInteger(1);

    private volatile boolean sessionUp = false;

    public MqttClientHandler(String clientId, String username, String password, int keepAliveSeconds,
            Supplier<List<String>> topicFilters, Listener listener) {
        this.clientId = clientId;
        this.username = username;
        this.password = password;
        this.keepAliveSeconds = keepAliveSeconds;
        this.topicFilters = topicFilters;
        this.listener = listener;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        MqttMessageBuilders.ConnectBuilder connect = MqttMessageBuilders.connect()
                .clientId(clientId)
                .protocolVersion(MqttVersion.MQTT_3_1_1)
                .cleanSession(true)
                .keepAlive(keepAliveSeconds);
        if (username != null && !username.isBlank()) {
            connect.username(username);
            if (password != null) {
                connect.password(password.getBytes(StandardCharsets.UTF_8));
            }
        }
        ctx.writeAndFlush(connect.build());
        log.debug("MQTT CONNECT sent as {}", clientId);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
        MqttMessageType type = msg.fixedHeader().messageType();
        switch (type) {
            case CONNACK -> handleConnAck(ctx, (MqttConnAckMessage) msg);
            case PUBLISH -> handlePublish(ctx, (MqttPublishMessage) msg);
            case SUBACK -> log.debug("MQTT subscription acknowledged");
            case PINGRESP -> log.trace("MQTT PINGRESP");
            default -> log.debug("Ignoring MQTT {}", type);
        }
    }

    private void handleConnAck(ChannelHandlerContext ctx, MqttConnAckMessage msg) {
        MqttConnectReturnCode code = msg.variableHeader().connectReturnCode();
        if (code != MqttConnectReturnCode.CONNECTION_ACCEPTED) {
            log.error("MQTT broker refused connection: {}", code);
            ctx.close();
            return;
        }

        List<String> topics = topicFilters.get();
        if (!topics.isEmpty()) {
            MqttMessageBuilders.SubscribeBuilder subscribe = MqttMessageBuilders.subscribe()
                    .messageId(nextMessageId());
            for (String topic : topics) {
                subscribe.addSubscription(MqttQoS.AT_MOST_ONCE, topic);
            }
            ctx.writeAndFlush(subscribe.build());
            log.info("MQTT session up, subscribing to {}", topics);
        } else {
            log.info("MQTT session up");
        }

        sessionUp = true;
        listener.onSessionUp();
    }

    private void handlePublish(ChannelHandlerContext ctx, MqttPublishMessage msg) {
        String topic = msg.variableHeader().topicName();
        String payload = msg.payload().toString(StandardCharsets.UTF_8);

        if (msg.fixedHeader().qosLevel() == MqttQoS.AT_LEAST_ONCE) {
            MqttFixedHeader header = new MqttFixedHeader(MqttMessageType.PUBACK, false, MqttQoS.AT_MOST_ONCE,
                    false, 0);
            ctx.writeAndFlush(new MqttPubAckMessage(header,
                    MqttMessageIdVariableHeader.from(msg.variableHeader().packetId())));
        }

        listener.onMessage(topic, payload);
    }

    /**
     * Subscribe on a live session to filters registered after CONNACK.
     */
    public void subscribeLate(ChannelHandlerContext ctx, List<String> topics) {
        if (!sessionUp || topics.isEmpty()) {
            return;
        }
        MqttMessageBuilders.SubscribeBuilder subscribe = MqttMessageBuilders.subscribe()
                .messageId(nextMessageId());
        for (String topic : topics) {
            subscribe.addSubscription(MqttQoS.AT_MOST_ONCE, topic);
        }
        ctx.writeAndFlush(subscribe.build());
    }

    /**
     * Build a QoS 0 PUBLISH for the given topic.
     */
    public static MqttPublishMessage publishMessage(String topic, String payload) {
        return MqttMessageBuilders.publish()
                .topicName(topic)
                .qos(MqttQoS.AT_MOST_ONCE)
                .retained(false)
                .payload(Unpooled.copiedBuffer(payload, StandardCharsets.UTF_8))
                .build();
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
            MqttFixedHeader header = new MqttFixedHeader(MqttMessageType.PINGREQ, false, MqttQoS.AT_MOST_ONCE,
                    false, 0);
            ctx.writeAndFlush(new MqttMessage(header));
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        sessionUp = false;
        listener.onSessionDown(null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("MQTT channel error: {}", cause.getMessage());
        ctx.close();
    }

    public boolean isSessionUp() {
        return sessionUp;
    }

    private int nextMessageId() {
        int id = messageIds.getAndIncrement();
        if (id > 0xFFFF) {
            messageIds.set(2);
            id = 1;
        }
        return id;
    }
}
