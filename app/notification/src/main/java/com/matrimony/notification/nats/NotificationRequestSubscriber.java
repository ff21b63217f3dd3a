/*
 * どこで: Notification NATS 購読
 * 何を: 通知依頼 (JSON) を JetStream から購読し enqueue へ渡す
 * なぜ: 依頼元サービスが HTTP を待たずに非同期で通知を依頼できるようにするため
 */
package com.matrimony.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.matrimony.common.event.NotificationRequestedEvent;
import com.matrimony.notification.config.NotificationNatsProperties;
import com.matrimony.notification.service.NotificationEventPermanentException;
import com.matrimony.notification.service.NotificationRequestHandler;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationRequestSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(NotificationRequestSubscriber.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;
    private final NotificationRequestHandler requestHandler;
    private final NotificationNatsProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public NotificationRequestSubscriber(Connection connection,
            NotificationRequestHandler requestHandler,
            NotificationNatsProperties properties,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.requestHandler = requestHandler;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    properties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            logger.info("notification request subscriber started subject={} stream={} durable={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        try {
            NotificationRequestedEvent event =
                    objectMapper.readValue(message.getData(), NotificationRequestedEvent.class);
            boolean enqueued = requestHandler.handle(event);
            logger.debug("notification request handled eventId={} enqueued={}", event.eventId(), enqueued);
            message.ack();
        } catch (IOException ex) {
            // JSON 破損は再配信で回復しない
            logger.warn("failed to parse notification request payload", ex);
            termSilently(message);
        } catch (NotificationEventPermanentException ex) {
            logger.warn("permanent failure while handling notification request", ex);
            termSilently(message);
        } catch (DataAccessException ex) {
            logger.warn("temporary failure while handling notification request", ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            // 不明な例外はデータロス回避のため再配信に倒す
            logger.warn("failed to handle notification request", ex);
            nakSilently(message);
        }
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        // Nats-Msg-Id による重複排除のため duplicate window 付きで stream を用意する
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
                    && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack nats message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term nats message", ex);
        }
    }
}
