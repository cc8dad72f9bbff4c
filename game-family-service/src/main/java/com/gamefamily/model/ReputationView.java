package com.gamefamily.model;

import com.gamefamily.util.FamilyValidator;

public record ReputationView(
    long characterId,
    long rep,
    int dailyRep,
    int dailyRepLimit,
    int remainingDailyRep
) {
    public static ReputationView of(FamilyMember member) {
        return new ReputationView(
            member.characterId(),
            member.rep(),
            member.dailyRep(),
            FamilyValidator.DAILY_REP_CAP,
            member.remainingDailyRep()
        );
    }
}
