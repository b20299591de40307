package com.sentchat.socket.relay;

import com.sentchat.core.msg.Channels;
import com.sentchat.core.util.BytesUtils;
import com.sentchat.core.util.JsonUtils;
import com.sentchat.socket.config.SocketConfig;
import com.sentchat.socket.coordinator.IBroadcastCoordinator;
import com.sentchat.socket.metrics.MetricsService;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.receiver.ReceiverRecord;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Room relay over a shared Kafka topic.
 * <p>
 * Records are keyed by room id, so one room's events stay on one partition and keep
 * their order. Every node reads the whole topic in its own consumer group starting at
 * the latest offset; events that happened while a node was down are not replayed,
 * matching the at-most-once delivery of local broadcasts.
 * </p>
 */
public class KafkaRoomRelay implements IRoomRelay {
    private static final Logger log = LoggerFactory.getLogger(KafkaRoomRelay.class);

    private static final int DEFAULT_PARTITIONS = 6;
    private static final short REPLICATION_FACTOR = 1;    // Replication factor (1 for dev, 3+ for prod)

    private final SocketConfig config;
    private final IBroadcastCoordinator coordinator;
    private final MetricsService metricsService;

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private Disposable consumer;

    public KafkaRoomRelay(SocketConfig config, IBroadcastCoordinator coordinator, MetricsService metricsService) {
        this.config = config;
        this.coordinator = coordinator;
        this.metricsService = metricsService;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka room relay initialized (topic {})", Channels.ROOM_RELAY_TOPIC);
    }

    @Override
    public Mono<Void> start() {
        String nodeId = config.getNodeId();
        return createTopicIfNotExists(Channels.ROOM_RELAY_TOPIC, DEFAULT_PARTITIONS, REPLICATION_FACTOR)
            .publishOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "socket-relay-" + nodeId);
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(Collections.singleton(Channels.ROOM_RELAY_TOPIC));

                // concatMap keeps per-partition order through to the coordinator mailbox
                consumer = KafkaReceiver.create(receiverOptions).receive()
                    .concatMap(record -> replay(nodeId, record))
                    .onErrorContinue((err, obj) -> log.error("Error in room relay consumer loop", err))
                    .subscribe();

                log.info("Node {} consuming room relay topic {}", nodeId, Channels.ROOM_RELAY_TOPIC);
            });
    }

    @Override
    public Mono<Void> publish(String roomId, String payload) {
        return Mono.defer(() -> {
            String json = JsonUtils.writeValueAsString(new RelayRecord(config.getNodeId(), roomId, payload));
            ProducerRecord<String, String> record = new ProducerRecord<>(Channels.ROOM_RELAY_TOPIC, roomId, json);

            return sender.send(Mono.just(SenderRecord.create(record, roomId)))
                .doOnNext(result -> log.debug("Relayed room {} event to {}", roomId, result.recordMetadata()))
                .then();
        });
    }

    @Override
    public Mono<Void> stop() {
        if (consumer != null) {
            consumer.dispose();
        }
        sender.close();
        adminClient.close();
        log.info("Kafka room relay stopped");
        return Mono.empty();
    }

    private Mono<Void> replay(String nodeId, ReceiverRecord<String, String> record) {
        try {
            RelayRecord relayed = JsonUtils.readValue(record.value(), RelayRecord.class);
            if (nodeId.equals(relayed.getOriginNode())) {
                record.receiverOffset().acknowledge();
                return Mono.empty();
            }
            return coordinator.broadcast(relayed.getRoomId(), relayed.getPayload(), null)
                .doOnNext(delivered -> {
                    metricsService.recordDeliverRelay();
                    log.debug("Relayed event from {} reached {} members of room {}",
                        relayed.getOriginNode(), delivered, relayed.getRoomId());
                })
                .doFinally(signal -> record.receiverOffset().acknowledge())
                .then();
        } catch (Exception e) {
            log.error("Failed to decode room relay record (size {})", BytesUtils.getBytesLength(record.value()), e);
            record.receiverOffset().acknowledge(); // Acknowledge to skip bad messages
            return Mono.empty();
        }
    }

    /**
     * Creates the relay topic if it doesn't already exist. Idempotent.
     */
    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }
}
