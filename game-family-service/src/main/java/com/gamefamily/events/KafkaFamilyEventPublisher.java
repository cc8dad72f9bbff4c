package com.gamefamily.events;

import com.gamefamily.config.KafkaTopicsProperties;
import com.gamefamily.tenant.TenantContext;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Publishes family events to Kafka as JSON envelopes keyed by character id.
 * Sends are not awaited; a failed send is logged and dropped.
 */
@Service
public class KafkaFamilyEventPublisher implements FamilyEventSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaFamilyEventPublisher.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaTopicsProperties topics;
    private final Clock clock;

    public KafkaFamilyEventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                                     KafkaTopicsProperties topics,
                                     Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
        this.clock = clock;
    }

    @Override
    public void linkCreated(long seniorId, long juniorId) {
        publish(topics.getStatus(), seniorId, FamilyEventType.LINK_CREATED,
            new FamilyEvent.LinkCreated(seniorId, juniorId, now()));
    }

    @Override
    public void linkBroken(long characterId, long seniorId, long juniorId, String reason) {
        publish(topics.getStatus(), characterId, FamilyEventType.LINK_BROKEN,
            new FamilyEvent.LinkBroken(seniorId, juniorId, reason, now()));
    }

    @Override
    public void treeDissolved(long seniorId, List<Long> affectedIds, String reason) {
        publish(topics.getStatus(), seniorId, FamilyEventType.TREE_DISSOLVED,
            new FamilyEvent.TreeDissolved(seniorId, List.copyOf(affectedIds), reason, now()));
    }

    @Override
    public void repGained(long characterId, long amount, int dailyRep, String source) {
        publish(topics.getReputation(), characterId, FamilyEventType.REP_GAINED,
            new FamilyEvent.RepGained(amount, dailyRep, source, now()));
    }

    @Override
    public void repRedeemed(long characterId, long amount, String reason) {
        publish(topics.getReputation(), characterId, FamilyEventType.REP_REDEEMED,
            new FamilyEvent.RepRedeemed(amount, reason, now()));
    }

    @Override
    public void repReset(int affectedCount, Instant resetTime) {
        publish(topics.getReputation(), 0L, FamilyEventType.REP_RESET,
            new FamilyEvent.RepReset(affectedCount, resetTime));
    }

    @Override
    public void repError(long characterId, String errorCode, String errorMessage, long amount) {
        publish(topics.getErrors(), characterId, FamilyEventType.REP_ERROR,
            new FamilyEvent.RepError(errorCode, errorMessage, amount, now()));
    }

    @Override
    public void linkError(long seniorId, long juniorId, String errorCode, String errorMessage) {
        publish(topics.getErrors(), seniorId, FamilyEventType.LINK_ERROR,
            new FamilyEvent.LinkError(seniorId, juniorId, errorCode, errorMessage, now()));
    }

    private <B> void publish(String topic, long characterId, FamilyEventType type, B body) {
        String transactionId = UUID.randomUUID().toString();
        FamilyEvent<B> event = new FamilyEvent<>(transactionId, characterId, type, body);

        ProducerRecord<String, Object> record = new ProducerRecord<>(topic, String.valueOf(characterId), event);
        record.headers().add(new RecordHeader("event_type", type.name().getBytes(StandardCharsets.UTF_8)));
        record.headers().add(new RecordHeader("transaction_id", transactionId.getBytes(StandardCharsets.UTF_8)));
        TenantContext.current().ifPresent(tenantId ->
            record.headers().add(new RecordHeader(TenantContext.HEADER, tenantId.toString().getBytes(StandardCharsets.UTF_8))));

        try {
            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish {} event for character {} to {}", type, characterId, topic, ex);
                } else {
                    log.debug("Published {} event for character {} to {}", type, characterId, topic);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to hand {} event for character {} to Kafka", type, characterId, e);
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
