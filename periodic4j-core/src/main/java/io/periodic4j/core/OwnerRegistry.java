package io.periodic4j.core;

import io.periodic4j.OwnerResolver;
import io.periodic4j.ScheduleOwner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps owner type tags to the resolvers that fetch them. Built once at start-up.
 */
public class OwnerRegistry {

    private static final Logger log = LoggerFactory.getLogger(OwnerRegistry.class);

    private final Map<String, OwnerResolver<?>> resolversByType;

    public OwnerRegistry(List<OwnerResolver<?>> resolvers) {
        this.resolversByType = resolvers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        OwnerResolver::ownerType,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate OwnerResolver type: " + a.ownerType());
                        }
                ));
    }

    public Optional<OwnerResolver<?>> find(String ownerType) {
        if (ownerType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(resolversByType.get(ownerType));
    }

    public boolean isRegistered(String ownerType) {
        return ownerType != null && resolversByType.containsKey(ownerType);
    }

    /**
     * Fetch the owner behind {@code key}. Empty when its type is unregistered or the row is gone.
     */
    public Optional<ScheduleOwner> resolve(OwnerKey key) {
        if (key == null) {
            return Optional.empty();
        }
        Optional<OwnerResolver<?>> resolver = find(key.discriminator());
        if (resolver.isEmpty()) {
            log.debug("No OwnerResolver registered for type={}", key.discriminator());
            return Optional.empty();
        }

        Optional<ScheduleOwner> owner = resolver.get().findById(key.discriminatorId()).map(ScheduleOwner.class::cast);
        if (owner.isEmpty()) {
            log.debug("Owner not found type={} id={}", key.discriminator(), key.discriminatorId());
        }
        return owner;
    }
}
