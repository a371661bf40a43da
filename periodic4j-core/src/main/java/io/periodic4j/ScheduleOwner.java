package io.periodic4j;

import io.periodic4j.core.OwnerKey;

/**
 * Capability of an entity that can own schedule entries.
 *
 * <p>The owner's type tag and primary key together identify it in associations. The type tag must
 * match the {@link OwnerResolver#ownerType()} registered for this type.
 */
public interface ScheduleOwner {

    long ownerId();

    default String ownerType() {
        return getClass().getSimpleName();
    }

    default OwnerKey ownerKey() {
        return new OwnerKey(ownerType(), ownerId());
    }
}
