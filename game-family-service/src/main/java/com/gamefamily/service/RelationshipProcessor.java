package com.gamefamily.service;

import com.gamefamily.model.ActivityType;
import com.gamefamily.model.BatchResetResult;
import com.gamefamily.model.FamilyErrorCode;
import com.gamefamily.model.FamilyLink;
import com.gamefamily.model.FamilyMember;
import com.gamefamily.model.FamilyOperationException;
import com.gamefamily.model.LinkChange;
import com.gamefamily.model.LinkResult;
import com.gamefamily.model.RepAward;
import com.gamefamily.model.SubtreeDissolution;
import com.gamefamily.model.SubtreeDissolutionException;
import com.gamefamily.repository.FamilyMemberRepository;
import com.gamefamily.util.FamilyValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Atomic state transitions over one member or a senior/junior pair.
 *
 * <p>Every public mutation except {@link #dissolveSubtree} runs in its own transaction and reads the
 * rows it will rewrite with a row lock, so a concurrent transition on the same member waits instead
 * of acting on a stale copy. Rows of more than one member are locked in ascending character id
 * order. Both sides of a link are always written in the same transaction.
 */
@Service
public class RelationshipProcessor {

    private static final Logger log = LoggerFactory.getLogger(RelationshipProcessor.class);

    private static final int MAX_LOCK_ATTEMPTS = 3;

    private final FamilyMemberRepository memberRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public RelationshipProcessor(FamilyMemberRepository memberRepository,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock) {
        this.memberRepository = memberRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    // ========== READS ==========

    public FamilyMember getMember(long characterId) {
        return memberRepository.findByCharacterId(characterId)
            .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.MEMBER_NOT_FOUND, characterId));
    }

    /**
     * The member followed by its senior, its juniors and its siblings (the senior's other juniors).
     */
    public List<FamilyMember> getFamilyTree(long characterId) {
        FamilyMember member = getMember(characterId);

        Map<Long, FamilyMember> tree = new LinkedHashMap<>();
        tree.put(member.characterId(), member);

        if (member.hasSenior()) {
            memberRepository.findByCharacterId(member.seniorId())
                .ifPresent(senior -> tree.putIfAbsent(senior.characterId(), senior));
        }
        for (FamilyMember junior : memberRepository.findBySeniorId(characterId)) {
            tree.putIfAbsent(junior.characterId(), junior);
        }
        if (member.hasSenior()) {
            for (FamilyMember sibling : memberRepository.findBySeniorId(member.seniorId())) {
                tree.putIfAbsent(sibling.characterId(), sibling);
            }
        }
        return List.copyOf(tree.values());
    }

    // ========== LINKS ==========

    public LinkResult link(long seniorId, long juniorId) {
        log.info("Linking junior {} to senior {}", juniorId, seniorId);
        if (seniorId == juniorId) {
            throw new FamilyOperationException(FamilyErrorCode.SELF_REFERENCE, seniorId);
        }

        return inTransaction(() -> {
            // Lock in id order so opposing links on the same pair cannot deadlock.
            Map<Long, Optional<FamilyMember>> locked = lockInOrder(List.of(seniorId, juniorId));

            FamilyMember senior = locked.get(seniorId)
                .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.SENIOR_NOT_FOUND, seniorId, juniorId));
            if (senior.hasJunior(juniorId)) {
                throw new FamilyOperationException(FamilyErrorCode.JUNIOR_ALREADY_LINKED, seniorId, juniorId);
            }
            if (!senior.canAddJunior()) {
                throw new FamilyOperationException(FamilyErrorCode.SENIOR_FULL, seniorId, juniorId);
            }

            FamilyMember junior = locked.get(juniorId)
                .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.JUNIOR_NOT_FOUND, seniorId, juniorId));
            if (junior.hasSenior()) {
                throw new FamilyOperationException(FamilyErrorCode.JUNIOR_ALREADY_LINKED, seniorId, juniorId);
            }
            if (!FamilyValidator.isLevelDifferenceAllowed(senior.level(), junior.level())) {
                throw new FamilyOperationException(FamilyErrorCode.LEVEL_GAP_TOO_LARGE, seniorId, juniorId);
            }
            if (!FamilyValidator.isSameLocation(senior.world(), senior.mapId(), junior.world(), junior.mapId())) {
                throw new FamilyOperationException(FamilyErrorCode.LOCATION_MISMATCH, seniorId, juniorId);
            }

            FamilyMember updatedSenior = memberRepository.save(senior.toBuilder()
                .addJunior(juniorId)
                .touch(clock)
                .build());
            FamilyMember updatedJunior = memberRepository.save(junior.toBuilder()
                .seniorId(seniorId)
                .touch(clock)
                .build());
            return new LinkResult(updatedSenior, updatedJunior);
        });
    }

    /**
     * Break every link the member takes part in, on both sides.
     */
    public LinkChange unlink(long characterId) {
        log.info("Breaking family links of {}", characterId);

        return withRelativesLocked(characterId, RelationshipProcessor::linkedIds, (member, locked) -> {
            if (!member.hasSenior() && !member.hasJuniors()) {
                throw new FamilyOperationException(FamilyErrorCode.NO_LINK_TO_BREAK, characterId);
            }

            List<FamilyMember> updated = new ArrayList<>();
            List<FamilyLink> broken = new ArrayList<>();
            detachNeighbours(member, locked, updated, broken);

            updated.add(memberRepository.save(member.toBuilder()
                .clearSeniorId()
                .clearJuniors()
                .touch(clock)
                .build()));
            return new LinkChange(characterId, updated, broken);
        });
    }

    /**
     * Detach the member from its senior and juniors, then delete it.
     */
    public LinkChange remove(long characterId) {
        log.info("Removing family member {}", characterId);

        return withRelativesLocked(characterId, RelationshipProcessor::linkedIds, (member, locked) -> {
            List<FamilyMember> updated = new ArrayList<>();
            List<FamilyLink> broken = new ArrayList<>();
            detachNeighbours(member, locked, updated, broken);

            memberRepository.deleteByCharacterId(characterId);
            return new LinkChange(characterId, updated, broken);
        });
    }

    /**
     * Remove each direct junior of {@code seniorId}, then the senior itself. Each removal commits on
     * its own; if one fails the earlier ones stay committed and are reported in the exception.
     *
     * @throws SubtreeDissolutionException if any removal after the first lookup fails
     */
    public SubtreeDissolution dissolveSubtree(long seniorId) {
        log.info("Dissolving family subtree of {}", seniorId);
        FamilyMember senior = getMember(seniorId);

        List<Long> removed = new ArrayList<>();
        List<FamilyMember> updated = new ArrayList<>();
        List<FamilyLink> broken = new ArrayList<>();
        try {
            for (Long juniorId : senior.juniorIds()) {
                if (!memberRepository.existsByCharacterId(juniorId)) {
                    log.warn("Junior {} of {} no longer exists, skipping", juniorId, seniorId);
                    continue;
                }
                LinkChange change = remove(juniorId);
                removed.add(juniorId);
                updated.addAll(change.updatedMembers());
                broken.addAll(change.brokenLinks());
            }
            LinkChange change = remove(seniorId);
            removed.add(seniorId);
            updated.addAll(change.updatedMembers());
            broken.addAll(change.brokenLinks());
        } catch (RuntimeException e) {
            log.error("Dissolution of subtree {} stopped after removing {}", seniorId, removed, e);
            throw new SubtreeDissolutionException(seniorId,
                new SubtreeDissolution(seniorId, removed, updated, distinct(broken)), e);
        }
        return new SubtreeDissolution(seniorId, removed, updated, distinct(broken));
    }

    // ========== REPUTATION ==========

    public FamilyMember awardRep(long characterId, long amount) {
        log.info("Awarding {} rep to {}", amount, characterId);
        FamilyValidator.validateAmount(characterId, amount);

        return inTransaction(() -> credit(lockExisting(characterId), amount));
    }

    public FamilyMember deductRep(long characterId, long amount) {
        log.info("Deducting {} rep from {}", amount, characterId);
        FamilyValidator.validateAmount(characterId, amount);

        return inTransaction(() -> {
            FamilyMember member = lockExisting(characterId);
            if (member.rep() < amount) {
                throw new FamilyOperationException(FamilyErrorCode.INSUFFICIENT_REP, characterId);
            }
            return memberRepository.save(member.toBuilder()
                .subtractRep(amount)
                .touch(clock)
                .build());
        });
    }

    /**
     * Zero the daily counter of every member in one statement.
     */
    public BatchResetResult resetDailyRep() {
        return inTransaction(() -> {
            Instant resetTime = clock.instant();
            int affected = memberRepository.resetDailyRep(resetTime);
            log.info("Reset daily rep of {} members", affected);
            return new BatchResetResult(affected, resetTime);
        });
    }

    /**
     * Credit the junior's senior with {@code amount}, halved when the junior outlevels the senior.
     */
    public RepAward awardRepToSenior(long juniorId, long amount, String source) {
        FamilyValidator.validateAmount(juniorId, amount);

        return withRelativesLocked(juniorId, RelationshipProcessor::seniorIds, (junior, locked) -> {
            if (!junior.hasSenior()) {
                throw new FamilyOperationException(FamilyErrorCode.NO_SENIOR, juniorId);
            }
            long seniorId = junior.seniorId();
            FamilyMember senior = locked.get(seniorId)
                .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.SENIOR_NOT_FOUND, seniorId, juniorId));

            long finalAmount = amount;
            if (junior.level() > senior.level()) {
                finalAmount = amount / 2;
                log.info("Junior {} (level {}) outlevels senior {} (level {}), halving {} rep to {}",
                    juniorId, junior.level(), seniorId, senior.level(), amount, finalAmount);
            }
            if (finalAmount == 0) {
                return new RepAward(senior, 0, source);
            }
            return new RepAward(credit(senior, finalAmount), finalAmount, source);
        });
    }

    /**
     * Convert a junior's activity tally into rep for its senior.
     *
     * @return the award, or empty when the tally is worth no rep
     */
    public Optional<RepAward> processActivity(long juniorId, String activityType, long value) {
        ActivityType type = ActivityType.fromCode(activityType);
        if (value < 0) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_AMOUNT,
                "activity value cannot be negative", juniorId);
        }

        long amount = type.reputationFor(value);
        log.debug("Activity {} x{} by {} is worth {} rep", type.code(), value, juniorId, amount);
        if (amount == 0) {
            return Optional.empty();
        }
        return Optional.of(awardRepToSenior(juniorId, amount, type.source()));
    }

    // ========== INTERNALS ==========

    private FamilyMember credit(FamilyMember member, long amount) {
        if (!member.canReceiveRep(amount)) {
            throw new FamilyOperationException(FamilyErrorCode.REP_CAP_EXCEEDED, member.characterId());
        }
        return memberRepository.save(member.toBuilder()
            .addRep(amount)
            .addDailyRep(amount)
            .touch(clock)
            .build());
    }

    /**
     * Rewrite the member's senior and juniors so none of them refers to it any more.
     * The member's own row is left to the caller.
     */
    private void detachNeighbours(FamilyMember member, Map<Long, Optional<FamilyMember>> locked,
                                  List<FamilyMember> updated, List<FamilyLink> broken) {
        long characterId = member.characterId();

        if (member.hasSenior()) {
            long seniorId = member.seniorId();
            locked.get(seniorId).ifPresentOrElse(
                senior -> updated.add(memberRepository.save(senior.toBuilder()
                    .removeJunior(characterId)
                    .touch(clock)
                    .build())),
                () -> log.warn("Senior {} of {} is missing, clearing dangling reference", seniorId, characterId));
            broken.add(new FamilyLink(seniorId, characterId));
        }

        for (Long juniorId : member.juniorIds()) {
            Optional<FamilyMember> junior = locked.get(juniorId);
            if (junior.isPresent() && Long.valueOf(characterId).equals(junior.get().seniorId())) {
                updated.add(memberRepository.save(junior.get().toBuilder()
                    .clearSeniorId()
                    .touch(clock)
                    .build()));
            } else {
                log.warn("Junior {} of {} is missing or points elsewhere, clearing dangling reference", juniorId, characterId);
            }
            broken.add(new FamilyLink(characterId, juniorId));
        }
    }

    /**
     * Run {@code work} in one transaction with the member and the relatives named by {@code relatives}
     * locked in ascending id order. The relatives are chosen from an unlocked read, so if the locked
     * member turns out to name a relative that was not locked the transaction is abandoned and
     * the whole step is tried again.
     */
    private <T> T withRelativesLocked(long characterId,
                                      Function<FamilyMember, List<Long>> relatives,
                                      BiFunction<FamilyMember, Map<Long, Optional<FamilyMember>>, T> work) {
        for (int attempt = 1; ; attempt++) {
            FamilyMember snapshot = getMember(characterId);
            Optional<T> result = inTransaction(() -> {
                Map<Long, Optional<FamilyMember>> locked = lockInOrder(relatives.apply(snapshot));
                FamilyMember member = locked.get(characterId)
                    .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.MEMBER_NOT_FOUND, characterId));
                if (!locked.keySet().containsAll(relatives.apply(member))) {
                    return Optional.<T>empty();
                }
                return Optional.of(work.apply(member, locked));
            });
            if (result.isPresent()) {
                return result.get();
            }
            if (attempt == MAX_LOCK_ATTEMPTS) {
                throw new FamilyOperationException(FamilyErrorCode.TRANSACTION_FAILED,
                    "links kept changing while locking", characterId);
            }
            log.debug("Links of {} changed before they were locked, retrying", characterId);
        }
    }

    private static List<Long> linkedIds(FamilyMember member) {
        List<Long> ids = new ArrayList<>(seniorIds(member));
        ids.addAll(member.juniorIds());
        return ids;
    }

    private static List<Long> seniorIds(FamilyMember member) {
        return member.hasSenior()
            ? List.of(member.characterId(), member.seniorId())
            : List.of(member.characterId());
    }

    private FamilyMember lockExisting(long characterId) {
        return memberRepository.findByCharacterIdForUpdate(characterId)
            .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.MEMBER_NOT_FOUND, characterId));
    }

    private Map<Long, Optional<FamilyMember>> lockInOrder(List<Long> characterIds) {
        Map<Long, Optional<FamilyMember>> locked = new LinkedHashMap<>();
        characterIds.stream()
            .distinct()
            .sorted()
            .forEach(id -> locked.put(id, memberRepository.findByCharacterIdForUpdate(id)));
        return locked;
    }

    private static List<FamilyLink> distinct(List<FamilyLink> links) {
        Set<FamilyLink> unique = new LinkedHashSet<>(links);
        return List.copyOf(unique);
    }

    private <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
