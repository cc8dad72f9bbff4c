package com.gamefamily.util;

import com.gamefamily.model.FamilyErrorCode;
import com.gamefamily.model.FamilyOperationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Stateless checks shared by the member builder and the relationship processor.
 * The {@code validate*} methods throw; the {@code is*} methods answer a question and leave the
 * choice of error to the caller.
 */
public final class FamilyValidator {

    public static final int MAX_JUNIORS = 2;
    public static final int DAILY_REP_CAP = 5000;
    public static final int MAX_LEVEL_DIFFERENCE = 20;

    private FamilyValidator() {
    }

    public static void validateJuniorSet(long characterId, List<Long> juniorIds) {
        if (juniorIds == null) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER, "junior ids must not be null", characterId);
        }
        if (juniorIds.size() > MAX_JUNIORS) {
            throw new FamilyOperationException(FamilyErrorCode.TOO_MANY_JUNIORS, characterId);
        }
        Set<Long> seen = new HashSet<>();
        for (Long juniorId : juniorIds) {
            if (juniorId == null) {
                throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER, "junior id must not be null", characterId);
            }
            if (juniorId == characterId) {
                throw new FamilyOperationException(FamilyErrorCode.SELF_REFERENCE, characterId);
            }
            if (!seen.add(juniorId)) {
                throw new FamilyOperationException(FamilyErrorCode.DUPLICATE_JUNIOR, characterId, juniorId);
            }
        }
    }

    public static void validateSenior(long characterId, Long seniorId) {
        if (seniorId != null && seniorId == characterId) {
            throw new FamilyOperationException(FamilyErrorCode.SELF_REFERENCE, characterId);
        }
    }

    public static void validateCharacterId(long characterId) {
        if (characterId <= 0) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER, "invalid character id " + characterId);
        }
    }

    public static void validateTenantId(long characterId, UUID tenantId) {
        if (tenantId == null) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER, "tenant id is required", characterId);
        }
    }

    public static void validateLevel(long characterId, int level) {
        if (level <= 0) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER, "invalid level " + level, characterId);
        }
    }

    public static void validateReputation(long characterId, long rep, int dailyRep) {
        if (rep < 0) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER, "rep cannot be negative", characterId);
        }
        if (dailyRep < 0 || dailyRep > DAILY_REP_CAP) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER,
                "daily rep must be between 0 and " + DAILY_REP_CAP, characterId);
        }
    }

    public static void validateAmount(long characterId, long amount) {
        if (amount <= 0) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_AMOUNT,
                "amount must be positive, was " + amount, characterId);
        }
    }

    public static boolean isWithinDailyRepCap(int current, long additional) {
        return additional <= DAILY_REP_CAP - (long) current;
    }

    public static boolean isLevelDifferenceAllowed(int levelA, int levelB) {
        return Math.abs(levelA - levelB) <= MAX_LEVEL_DIFFERENCE;
    }

    public static boolean isSameLocation(int worldA, int mapA, int worldB, int mapB) {
        return worldA == worldB && mapA == mapB;
    }
}
