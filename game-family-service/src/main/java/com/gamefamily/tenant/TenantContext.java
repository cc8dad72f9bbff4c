package com.gamefamily.tenant;

import com.gamefamily.model.FamilyErrorCode;
import com.gamefamily.model.FamilyOperationException;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Tenant of the work running on the current thread. Every member lookup is scoped by it.
 * Set by the HTTP interceptor and the Kafka consumer; cleared when the request or message ends.
 */
public final class TenantContext {

    public static final String HEADER = "TENANT_ID";

    private static final ThreadLocal<UUID> CURRENT = new ThreadLocal<>();

    private TenantContext() {
    }

    public static void set(UUID tenantId) {
        CURRENT.set(tenantId);
    }

    public static Optional<UUID> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static UUID require() {
        UUID tenantId = CURRENT.get();
        if (tenantId == null) {
            throw new FamilyOperationException(FamilyErrorCode.INVALID_MEMBER, "no tenant bound to the current request");
        }
        return tenantId;
    }

    public static void clear() {
        CURRENT.remove();
    }

    /**
     * Run {@code work} with {@code tenantId} bound, restoring whatever was bound before.
     */
    public static <T> T callAs(UUID tenantId, Supplier<T> work) {
        UUID previous = CURRENT.get();
        CURRENT.set(tenantId);
        try {
            return work.get();
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
