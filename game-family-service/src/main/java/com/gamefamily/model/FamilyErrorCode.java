package com.gamefamily.model;

/**
 * Every way a family operation can fail.
 * Callers branch on the code (or its {@link Category}) rather than on message text.
 */
public enum FamilyErrorCode {

    SELF_REFERENCE(Category.VALIDATION, "cannot reference self as senior or junior"),
    TOO_MANY_JUNIORS(Category.VALIDATION, "cannot have more than 2 juniors"),
    DUPLICATE_JUNIOR(Category.VALIDATION, "duplicate junior id"),
    INVALID_MEMBER(Category.VALIDATION, "member record is invalid"),
    INVALID_AMOUNT(Category.VALIDATION, "amount must be positive"),
    INVALID_ACTIVITY_TYPE(Category.VALIDATION, "invalid activity type"),

    SENIOR_FULL(Category.CONFLICT, "senior already has maximum number of juniors"),
    JUNIOR_ALREADY_LINKED(Category.CONFLICT, "junior is already linked to a senior"),
    LEVEL_GAP_TOO_LARGE(Category.CONFLICT, "level difference exceeds maximum allowed"),
    LOCATION_MISMATCH(Category.CONFLICT, "members must be on the same map to link"),
    REP_CAP_EXCEEDED(Category.CONFLICT, "daily reputation cap exceeded"),
    INSUFFICIENT_REP(Category.CONFLICT, "insufficient reputation for operation"),
    NO_LINK_TO_BREAK(Category.CONFLICT, "no family link exists to break"),
    NO_SENIOR(Category.CONFLICT, "junior has no senior to award reputation to"),
    ALREADY_EXISTS(Category.CONFLICT, "family member already exists"),

    MEMBER_NOT_FOUND(Category.NOT_FOUND, "family member not found"),
    SENIOR_NOT_FOUND(Category.NOT_FOUND, "senior member not found"),
    JUNIOR_NOT_FOUND(Category.NOT_FOUND, "junior member not found"),

    TRANSACTION_FAILED(Category.FAILURE, "transaction failed"),
    DISSOLUTION_INCOMPLETE(Category.FAILURE, "family subtree was only partially dissolved");

    public enum Category {
        VALIDATION,
        CONFLICT,
        NOT_FOUND,
        FAILURE
    }

    private final Category category;
    private final String defaultMessage;

    FamilyErrorCode(Category category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public Category category() {
        return category;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
