package com.gamefamily.model;

import java.util.Arrays;

/**
 * Junior activities that earn reputation for the junior's senior.
 */
public enum ActivityType {

    /** 2 rep per 5 kills; partial groups of 5 earn nothing. */
    MOB_KILL("mob_kill", "mob_kills") {
        @Override
        public long reputationFor(long value) {
            return (value / 5) * 2;
        }
    },

    /** 10 rep per expedition coin. */
    EXPEDITION("expedition", "expedition") {
        @Override
        public long reputationFor(long value) {
            try {
                return Math.multiplyExact(value, 10L);
            } catch (ArithmeticException e) {
                throw new FamilyOperationException(FamilyErrorCode.INVALID_AMOUNT,
                    "expedition coin tally too large: " + value, e);
            }
        }
    };

    private final String code;
    private final String source;

    ActivityType(String code, String source) {
        this.code = code;
        this.source = source;
    }

    public abstract long reputationFor(long value);

    public String code() {
        return code;
    }

    public String source() {
        return source;
    }

    public static ActivityType fromCode(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new FamilyOperationException(FamilyErrorCode.INVALID_ACTIVITY_TYPE,
                "invalid activity type: " + code));
    }
}
