package io.periodic4j;

import java.util.Optional;

/**
 * Fetches owners of one type by primary key. Register one per owner type.
 */
public interface OwnerResolver<T extends ScheduleOwner> {

    String ownerType();

    Optional<T> findById(long id);
}
