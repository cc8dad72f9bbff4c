package com.gamefamily.model;

import java.util.Arrays;
import java.util.List;

public class FamilyOperationException extends RuntimeException {

    private final FamilyErrorCode code;
    private final List<Long> characterIds;

    public FamilyOperationException(FamilyErrorCode code, Long... characterIds) {
        this(code, code.defaultMessage(), null, characterIds);
    }

    public FamilyOperationException(FamilyErrorCode code, String message, Long... characterIds) {
        this(code, message, null, characterIds);
    }

    public FamilyOperationException(FamilyErrorCode code, String message, Throwable cause, Long... characterIds) {
        super(message, cause);
        this.code = code;
        this.characterIds = characterIds == null ? List.of() : Arrays.stream(characterIds)
            .filter(id -> id != null)
            .toList();
    }

    public FamilyErrorCode code() {
        return code;
    }

    /**
     * Character ids the failure refers to, in the order the operation named them.
     */
    public List<Long> characterIds() {
        return characterIds;
    }
}
