package com.gamefamily.service;

import com.gamefamily.events.FamilyEventSink;
import com.gamefamily.model.BatchResetResult;
import com.gamefamily.model.FamilyErrorCode;
import com.gamefamily.model.FamilyLink;
import com.gamefamily.model.FamilyMember;
import com.gamefamily.model.FamilyOperationException;
import com.gamefamily.model.LinkChange;
import com.gamefamily.model.LinkResult;
import com.gamefamily.model.RepAward;
import com.gamefamily.model.ReputationView;
import com.gamefamily.model.SubtreeDissolution;
import com.gamefamily.model.SubtreeDissolutionException;
import com.gamefamily.repository.FamilyMemberRepository;
import com.gamefamily.tenant.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for REST, Kafka and the reset scheduler. Makes sure members exist before linking,
 * delegates every state change to {@link RelationshipProcessor} and reports the outcome as events.
 */
@Service
public class FamilyService {

    private static final Logger log = LoggerFactory.getLogger(FamilyService.class);

    static final String DEFAULT_AWARD_SOURCE = "award";

    private final FamilyMemberRepository memberRepository;
    private final RelationshipProcessor processor;
    private final FamilyEventSink events;
    private final Clock clock;

    public FamilyService(FamilyMemberRepository memberRepository,
                         RelationshipProcessor processor,
                         FamilyEventSink events,
                         Clock clock) {
        this.memberRepository = memberRepository;
        this.processor = processor;
        this.events = events;
        this.clock = clock;
    }

    // ========== MEMBERS ==========

    /**
     * Return the member, creating it when absent. An existing member whose level, world or map changed
     * is updated in place.
     */
    public FamilyMember ensureMemberExists(long characterId, UUID tenantId, int level, int world, int mapId) {
        return TenantContext.callAs(tenantId, () -> storage(() -> {
            Optional<FamilyMember> existing = memberRepository.findByCharacterId(characterId);
            if (existing.isPresent()) {
                return sync(existing.get(), level, world, mapId);
            }
            try {
                FamilyMember created = memberRepository.save(newMember(characterId, tenantId, level, world, mapId));
                log.info("Created family member {} (level {}, world {})", characterId, level, world);
                return created;
            } catch (DuplicateKeyException e) {
                log.debug("Member {} was created concurrently, re-reading", characterId);
                FamilyMember winner = memberRepository.findByCharacterId(characterId)
                    .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.ALREADY_EXISTS,
                        "character is registered under another tenant", e, characterId));
                return sync(winner, level, world, mapId);
            }
        }, characterId));
    }

    public FamilyMember createMember(long characterId, UUID tenantId, int level, int world, int mapId) {
        return TenantContext.callAs(tenantId, () -> storage(() -> {
            if (memberRepository.existsByCharacterId(characterId)) {
                throw new FamilyOperationException(FamilyErrorCode.ALREADY_EXISTS, characterId);
            }
            try {
                FamilyMember created = memberRepository.save(newMember(characterId, tenantId, level, world, mapId));
                log.info("Created family member {} (level {}, world {})", characterId, level, world);
                return created;
            } catch (DuplicateKeyException e) {
                throw new FamilyOperationException(FamilyErrorCode.ALREADY_EXISTS,
                    FamilyErrorCode.ALREADY_EXISTS.defaultMessage(), e, characterId);
            }
        }, characterId));
    }

    public FamilyMember getMember(long characterId) {
        return storage(() -> processor.getMember(characterId), characterId);
    }

    public List<FamilyMember> getFamilyTree(long characterId) {
        return storage(() -> processor.getFamilyTree(characterId), characterId);
    }

    public ReputationView getReputation(long characterId) {
        return ReputationView.of(getMember(characterId));
    }

    // ========== LINKS ==========

    /**
     * Link {@code juniorId} under {@code seniorId}, registering either character first if needed.
     * Both are registered in the current tenant on {@code world}.
     */
    public LinkResult addJunior(long seniorId, long juniorId, int world,
                                int seniorLevel, int seniorMap, int juniorLevel, int juniorMap) {
        UUID tenantId = TenantContext.require();
        try {
            ensureMemberExists(seniorId, tenantId, seniorLevel, world, seniorMap);
            ensureMemberExists(juniorId, tenantId, juniorLevel, world, juniorMap);
            LinkResult result = storage(() -> processor.link(seniorId, juniorId), seniorId, juniorId);
            events.linkCreated(seniorId, juniorId);
            return result;
        } catch (FamilyOperationException e) {
            log.warn("Could not link junior {} to senior {}: {}", juniorId, seniorId, e.getMessage());
            events.linkError(seniorId, juniorId, e.code().name(), e.getMessage());
            throw e;
        }
    }

    public LinkChange breakLink(long characterId, String reason) {
        try {
            LinkChange change = storage(() -> processor.unlink(characterId), characterId);
            publishBrokenLinks(characterId, change.brokenLinks(), reason);
            return change;
        } catch (FamilyOperationException e) {
            log.warn("Could not break links of {}: {}", characterId, e.getMessage());
            events.linkError(characterId, 0L, e.code().name(), e.getMessage());
            throw e;
        }
    }

    public LinkChange removeMember(long characterId, String reason) {
        try {
            LinkChange change = storage(() -> processor.remove(characterId), characterId);
            publishBrokenLinks(characterId, change.brokenLinks(), reason);
            log.info("Removed family member {} ({})", characterId, reason);
            return change;
        } catch (FamilyOperationException e) {
            log.warn("Could not remove member {}: {}", characterId, e.getMessage());
            events.linkError(characterId, 0L, e.code().name(), e.getMessage());
            throw e;
        }
    }

    /**
     * @throws SubtreeDissolutionException when the dissolution stopped partway; already removed
     *                                     members stay removed
     */
    public SubtreeDissolution dissolveSubtree(long seniorId, String reason) {
        try {
            SubtreeDissolution dissolution = storage(() -> processor.dissolveSubtree(seniorId), seniorId);
            events.treeDissolved(seniorId, dissolution.removedIds(), reason);
            return dissolution;
        } catch (FamilyOperationException e) {
            log.warn("Could not dissolve subtree of {}: {}", seniorId, e.getMessage());
            events.linkError(seniorId, 0L, e.code().name(), e.getMessage());
            throw e;
        }
    }

    // ========== REPUTATION ==========

    public FamilyMember awardRep(long characterId, long amount, String source) {
        String effectiveSource = source == null || source.isBlank() ? DEFAULT_AWARD_SOURCE : source;
        try {
            FamilyMember member = storage(() -> processor.awardRep(characterId, amount), characterId);
            events.repGained(characterId, amount, member.dailyRep(), effectiveSource);
            return member;
        } catch (FamilyOperationException e) {
            log.warn("Could not award {} rep to {}: {}", amount, characterId, e.getMessage());
            events.repError(characterId, e.code().name(), e.getMessage(), amount);
            throw e;
        }
    }

    public FamilyMember deductRep(long characterId, long amount, String reason) {
        try {
            FamilyMember member = storage(() -> processor.deductRep(characterId, amount), characterId);
            events.repRedeemed(characterId, amount, reason);
            return member;
        } catch (FamilyOperationException e) {
            log.warn("Could not deduct {} rep from {}: {}", amount, characterId, e.getMessage());
            events.repError(characterId, e.code().name(), e.getMessage(), amount);
            throw e;
        }
    }

    /**
     * Credit the junior's senior for an activity tally.
     *
     * @return the award, or empty when the tally was worth nothing
     */
    public Optional<RepAward> registerActivity(long juniorId, String activityType, long value) {
        try {
            Optional<RepAward> award = storage(() -> processor.processActivity(juniorId, activityType, value), juniorId);
            award.filter(a -> a.amount() > 0).ifPresent(a -> events.repGained(
                a.member().characterId(), a.amount(), a.member().dailyRep(), a.source()));
            return award;
        } catch (FamilyOperationException e) {
            log.warn("Could not register {} activity for {}: {}", activityType, juniorId, e.getMessage());
            events.repError(juniorId, e.code().name(), e.getMessage(), value);
            throw e;
        }
    }

    public BatchResetResult resetDailyRep() {
        try {
            BatchResetResult result = storage(processor::resetDailyRep);
            events.repReset(result.affectedCount(), result.resetTime());
            return result;
        } catch (FamilyOperationException e) {
            log.error("Daily reputation reset failed", e);
            events.repError(0L, e.code().name(), e.getMessage(), 0L);
            throw e;
        }
    }

    // ========== INTERNALS ==========

    private FamilyMember newMember(long characterId, UUID tenantId, int level, int world, int mapId) {
        return FamilyMember.builder(characterId, tenantId, level, world, mapId, clock).build();
    }

    private FamilyMember sync(FamilyMember member, int level, int world, int mapId) {
        if (member.level() == level && member.world() == world && member.mapId() == mapId) {
            return member;
        }
        log.debug("Syncing member {} to level {}, world {}, map {}", member.characterId(), level, world, mapId);
        return memberRepository.save(member.toBuilder()
            .level(level)
            .world(world)
            .mapId(mapId)
            .touch(clock)
            .build());
    }

    private void publishBrokenLinks(long characterId, List<FamilyLink> brokenLinks, String reason) {
        for (FamilyLink link : brokenLinks) {
            events.linkBroken(characterId, link.seniorId(), link.juniorId(), reason);
        }
    }

    /**
     * Run {@code work}, reporting storage failures as a retryable {@code TRANSACTION_FAILED}.
     */
    private static <T> T storage(Supplier<T> work, Long... characterIds) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure for characters {}", List.of(characterIds), e);
            throw new FamilyOperationException(FamilyErrorCode.TRANSACTION_FAILED,
                FamilyErrorCode.TRANSACTION_FAILED.defaultMessage(), e, characterIds);
        }
    }
}
