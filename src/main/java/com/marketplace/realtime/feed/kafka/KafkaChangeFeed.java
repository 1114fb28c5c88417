package com.marketplace.realtime.feed.kafka;

import com.marketplace.realtime.config.RealtimeProperties;
import com.marketplace.realtime.feed.ChangeFeed;
import com.marketplace.realtime.feed.ChannelHandle;
import com.marketplace.realtime.feed.ChannelListener;
import com.marketplace.realtime.feed.ChannelRequest;
import com.marketplace.realtime.feed.ChannelStatus;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.event.ConsumerFailedToStartEvent;
import org.springframework.kafka.event.ConsumerStartedEvent;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ChangeFeed} over Debezium topics. Each channel runs its own listener
 * container in a private consumer group, so every channel sees every record of
 * its table published after it subscribed. Container lifecycle events become
 * channel statuses.
 */
@Component
@ConditionalOnProperty(prefix = "app.realtime", name = "feed", havingValue = "kafka", matchIfMissing = true)
public class KafkaChangeFeed implements ChangeFeed {

    private static final Logger log = LoggerFactory.getLogger(KafkaChangeFeed.class);

    private final ConsumerFactory<String, String> consumerFactory;
    private final CdcEnvelopeParser parser;
    private final RealtimeProperties.Kafka properties;

    public KafkaChangeFeed(ConsumerFactory<String, String> consumerFactory,
                           CdcEnvelopeParser parser,
                           RealtimeProperties realtimeProperties) {
        this.consumerFactory = consumerFactory;
        this.parser = parser;
        this.properties = realtimeProperties.getKafka();
    }

    @Override
    public ChannelHandle subscribe(ChannelRequest request, ChannelListener listener) {
        String topic = request.isPresence() ? properties.getHeartbeatTopic() : properties.topicFor(request.table());

        ContainerProperties containerProperties = new ContainerProperties(topic);
        containerProperties.setGroupId("realtime-" + request.channelName() + "-" + UUID.randomUUID());
        containerProperties.setMonitorInterval(
                (int) Math.max(1, properties.getNonResponsiveTimeout().toSeconds() / 2));
        containerProperties.setNoPollThreshold(
                Math.max(1f, (float) properties.getNonResponsiveTimeout().toMillis() / containerProperties.getPollTimeout()));
        containerProperties.setMessageListener((MessageListener<String, String>) record -> deliver(request, listener, record));

        KafkaMessageListenerContainer<String, String> container =
                new KafkaMessageListenerContainer<>(consumerFactory, containerProperties);
        container.setBeanName("realtime-" + request.channelName());
        container.setApplicationEventPublisher(event -> onContainerEvent(request, listener, event));

        log.info("Opening channel {} on topic {}", request.channelName(), topic);
        try {
            container.start();
        } catch (RuntimeException e) {
            log.error("Could not start consumer for channel {}", request.channelName(), e);
            listener.onStatus(ChannelStatus.CHANNEL_ERROR, e);
        }
        return new KafkaChannel(request.channelName(), container);
    }

    private void deliver(ChannelRequest request, ChannelListener listener, ConsumerRecord<String, String> record) {
        if (request.isPresence()) {
            return;
        }
        parser.parse(record.value(), request.table())
                .filter(request::accepts)
                .ifPresent(listener::onEvent);
    }

    private void onContainerEvent(ChannelRequest request, ChannelListener listener, Object event) {
        if (event instanceof ConsumerStartedEvent) {
            listener.onStatus(ChannelStatus.SUBSCRIBED, null);
        } else if (event instanceof ConsumerStoppedEvent stopped) {
            if (stopped.getReason() == ConsumerStoppedEvent.Reason.NORMAL) {
                listener.onStatus(ChannelStatus.CLOSED, null);
            } else {
                log.warn("Consumer of channel {} stopped: {}", request.channelName(), stopped.getReason());
                listener.onStatus(ChannelStatus.CHANNEL_ERROR, null);
            }
        } else if (event instanceof ConsumerFailedToStartEvent) {
            listener.onStatus(ChannelStatus.CHANNEL_ERROR, null);
        } else if (event instanceof NonResponsiveConsumerEvent nonResponsive) {
            log.warn("Consumer of channel {} has not polled for {} ms",
                    request.channelName(), nonResponsive.getTimeSinceLastPoll());
            listener.onStatus(ChannelStatus.TIMED_OUT, null);
        }
    }

    private static final class KafkaChannel implements ChannelHandle {

        private final String channelName;
        private final KafkaMessageListenerContainer<String, String> container;
        private final AtomicBoolean closed = new AtomicBoolean();

        private KafkaChannel(String channelName, KafkaMessageListenerContainer<String, String> container) {
            this.channelName = channelName;
            this.container = container;
        }

        @Override
        public String channelName() {
            return channelName;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                container.stop(false);
            }
        }
    }
}
