package io.periodic4j.core;

import java.util.Objects;

/**
 * Identity of an owner for association lookups: its type tag plus its primary key.
 */
public record OwnerKey(
        String discriminator,
        long discriminatorId
) {

    public OwnerKey {
        Objects.requireNonNull(discriminator, "discriminator must not be null");
        if (discriminator.isBlank()) {
            throw new IllegalArgumentException("discriminator must not be blank");
        }
    }
}
