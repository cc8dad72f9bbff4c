package com.gamefamily.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamefamily.model.ActivityType;
import com.gamefamily.model.FamilyOperationException;
import com.gamefamily.service.FamilyService;
import com.gamefamily.tenant.TenantContext;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies family commands from the command topic. Business rejections are already published as
 * error events by {@link FamilyService}, so they are logged and the record is consumed; anything
 * else propagates to the container's error handler.
 */
@Component
public class FamilyCommandConsumer {

    private static final Logger log = LoggerFactory.getLogger(FamilyCommandConsumer.class);

    static final String ADD_JUNIOR = "ADD_JUNIOR";
    static final String REMOVE_MEMBER = "REMOVE_MEMBER";
    static final String BREAK_LINK = "BREAK_LINK";
    static final String AWARD_REP = "AWARD_REP";
    static final String DEDUCT_REP = "DEDUCT_REP";
    static final String REDEEM_REP = "REDEEM_REP";
    static final String REGISTER_KILL_ACTIVITY = "REGISTER_KILL_ACTIVITY";
    static final String REGISTER_EXPEDITION_ACTIVITY = "REGISTER_EXPEDITION_ACTIVITY";

    private static final String DEFAULT_REASON = "command";

    private final FamilyService familyService;
    private final ObjectMapper objectMapper;

    public FamilyCommandConsumer(FamilyService familyService, ObjectMapper objectMapper) {
        this.familyService = familyService;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(topics = "${family.kafka.topics.commands}", groupId = "${spring.kafka.consumer.group-id:game-family-service}")
    public void consume(ConsumerRecord<String, String> record) {
        Optional<UUID> tenantId = tenantOf(record);
        if (tenantId.isEmpty()) {
            log.warn("Dropping command without a valid {} header: partition={}, offset={}",
                TenantContext.HEADER, record.partition(), record.offset());
            return;
        }

        FamilyCommand command;
        try {
            command = objectMapper.readValue(record.value(), FamilyCommand.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable command: partition={}, offset={}", record.partition(), record.offset(), e);
            return;
        }

        MDC.put("transactionId", String.valueOf(command.transactionId()));
        MDC.put("commandType", String.valueOf(command.type()));
        TenantContext.set(tenantId.get());
        try {
            log.debug("Handling {} for character {}", command.type(), command.characterId());
            dispatch(command, tenantId.get());
        } catch (FamilyOperationException e) {
            log.warn("Command {} for character {} rejected with {}: {}",
                command.type(), command.characterId(), e.code(), e.getMessage());
        } finally {
            TenantContext.clear();
            MDC.remove("transactionId");
            MDC.remove("commandType");
        }
    }

    private void dispatch(FamilyCommand command, UUID tenantId) {
        long characterId = command.characterId();
        String type = command.type() == null ? "" : command.type();

        switch (type) {
            case ADD_JUNIOR -> familyService.addJunior(characterId, command.longField("juniorId"),
                command.worldId(),
                command.intField("seniorLevel"), command.intField("seniorMap"),
                command.intField("juniorLevel"), command.intField("juniorMap"));
            case REMOVE_MEMBER -> familyService.removeMember(characterId, command.textField("reason", DEFAULT_REASON));
            case BREAK_LINK -> familyService.breakLink(characterId, command.textField("reason", DEFAULT_REASON));
            case AWARD_REP -> familyService.awardRep(characterId, command.longField("amount"),
                command.textField("source", null));
            case DEDUCT_REP, REDEEM_REP -> familyService.deductRep(characterId, command.longField("amount"),
                command.textField("reason", DEFAULT_REASON));
            case REGISTER_KILL_ACTIVITY -> familyService.registerActivity(characterId,
                ActivityType.MOB_KILL.code(), command.longField("killCount"));
            case REGISTER_EXPEDITION_ACTIVITY -> familyService.registerActivity(characterId,
                ActivityType.EXPEDITION.code(), command.longField("coinReward"));
            default -> log.warn("Ignoring unknown command type '{}' for character {} in tenant {}",
                type, characterId, tenantId);
        }
    }

    private static Optional<UUID> tenantOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(TenantContext.HEADER);
        if (header == null || header.value() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(new String(header.value(), StandardCharsets.UTF_8).trim()));
        } catch (IllegalArgumentException e) {
            log.warn("Malformed {} header: {}", TenantContext.HEADER, e.getMessage());
            return Optional.empty();
        }
    }
}
