package io.periodic4j.core;

/**
 * Which association {@code disableTasks} removes from each matched entry.
 */
public enum DetachPolicy {

    /**
     * Remove the disabling owner's own association, the one the entry was matched through.
     */
    OWNER,

    /**
     * Remove the first association in the entry's collection, whichever owner holds it.
     * Only safe while every entry has exactly one owner.
     */
    FIRST_FOUND
}
