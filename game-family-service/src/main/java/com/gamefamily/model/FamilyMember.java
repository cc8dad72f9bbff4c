package com.gamefamily.model;

import com.gamefamily.util.FamilyValidator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One character's family state. Instances are immutable and always valid: the compact constructor
 * runs the same checks as {@link Builder#build()}, so changes go through {@link #toBuilder()}.
 */
public record FamilyMember(
    Long id,
    long characterId,
    UUID tenantId,
    Long seniorId,
    List<Long> juniorIds,
    long rep,
    int dailyRep,
    int level,
    int world,
    int mapId,
    Instant createdAt,
    Instant updatedAt
) {
    public FamilyMember {
        FamilyValidator.validateCharacterId(characterId);
        FamilyValidator.validateTenantId(characterId, tenantId);
        FamilyValidator.validateLevel(characterId, level);
        FamilyValidator.validateJuniorSet(characterId, juniorIds);
        FamilyValidator.validateSenior(characterId, seniorId);
        FamilyValidator.validateReputation(characterId, rep, dailyRep);
        juniorIds = List.copyOf(juniorIds);
    }

    public static Builder builder(long characterId, UUID tenantId, int level, int world, int mapId, Clock clock) {
        Instant now = clock.instant();
        return new Builder()
            .characterId(characterId)
            .tenantId(tenantId)
            .level(level)
            .world(world)
            .mapId(mapId)
            .createdAt(now)
            .updatedAt(now);
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .characterId(characterId)
            .tenantId(tenantId)
            .seniorId(seniorId)
            .juniorIds(juniorIds)
            .rep(rep)
            .dailyRep(dailyRep)
            .level(level)
            .world(world)
            .mapId(mapId)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public boolean hasSenior() {
        return seniorId != null;
    }

    public boolean hasJuniors() {
        return !juniorIds.isEmpty();
    }

    public boolean hasJunior(long juniorId) {
        return juniorIds.contains(juniorId);
    }

    public boolean canAddJunior() {
        return juniorIds.size() < FamilyValidator.MAX_JUNIORS;
    }

    public boolean canReceiveRep(long amount) {
        return FamilyValidator.isWithinDailyRepCap(dailyRep, amount);
    }

    public int remainingDailyRep() {
        return FamilyValidator.DAILY_REP_CAP - dailyRep;
    }

    /**
     * Fluent, mutable staging area for a new {@link FamilyMember}. Arithmetic helpers do not check
     * limits themselves; {@link #build()} rejects any result that breaks an invariant.
     */
    public static final class Builder {

        private Long id;
        private long characterId;
        private UUID tenantId;
        private Long seniorId;
        private List<Long> juniorIds = new ArrayList<>();
        private long rep;
        private int dailyRep;
        private int level;
        private int world;
        private int mapId;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder characterId(long characterId) {
            this.characterId = characterId;
            return this;
        }

        public Builder tenantId(UUID tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder seniorId(Long seniorId) {
            this.seniorId = seniorId;
            return this;
        }

        public Builder clearSeniorId() {
            this.seniorId = null;
            return this;
        }

        public Builder juniorIds(List<Long> juniorIds) {
            this.juniorIds = juniorIds == null ? null : new ArrayList<>(juniorIds);
            return this;
        }

        public Builder addJunior(long juniorId) {
            this.juniorIds.add(juniorId);
            return this;
        }

        public Builder removeJunior(long juniorId) {
            this.juniorIds.remove(Long.valueOf(juniorId));
            return this;
        }

        public Builder clearJuniors() {
            this.juniorIds = new ArrayList<>();
            return this;
        }

        public Builder rep(long rep) {
            this.rep = rep;
            return this;
        }

        public Builder addRep(long amount) {
            try {
                this.rep = Math.addExact(this.rep, amount);
            } catch (ArithmeticException e) {
                throw new FamilyOperationException(FamilyErrorCode.INVALID_AMOUNT,
                    "rep total would overflow", e, characterId);
            }
            return this;
        }

        public Builder subtractRep(long amount) {
            this.rep = Math.max(0, this.rep - amount);
            return this;
        }

        public Builder dailyRep(int dailyRep) {
            this.dailyRep = dailyRep;
            return this;
        }

        public Builder addDailyRep(long amount) {
            this.dailyRep = (int) Math.min(Integer.MAX_VALUE, this.dailyRep + amount);
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder world(int world) {
            this.world = world;
            return this;
        }

        public Builder mapId(int mapId) {
            this.mapId = mapId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder touch(Clock clock) {
            this.updatedAt = clock.instant();
            return this;
        }

        public FamilyMember build() {
            return new FamilyMember(id, characterId, tenantId, seniorId, juniorIds, rep, dailyRep,
                level, world, mapId, createdAt, updatedAt);
        }
    }
}
