package com.gamefamily.model;

import java.util.List;

/**
 * Raised when a subtree dissolution stops partway. Removals that already committed stay committed;
 * the caller gets the work done so far and can retry the remainder.
 */
public class SubtreeDissolutionException extends FamilyOperationException {

    private final SubtreeDissolution completed;

    public SubtreeDissolutionException(long seniorId, SubtreeDissolution completed, Throwable cause) {
        super(FamilyErrorCode.DISSOLUTION_INCOMPLETE,
            "Dissolution of subtree " + seniorId + " stopped after removing " + completed.removedIds()
                + ": " + cause.getMessage(),
            cause, seniorId);
        this.completed = completed;
    }

    public SubtreeDissolution completed() {
        return completed;
    }

    public List<Long> removedIds() {
        return completed.removedIds();
    }
}
