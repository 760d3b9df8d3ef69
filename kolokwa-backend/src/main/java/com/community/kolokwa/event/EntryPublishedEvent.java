package com.community.kolokwa.event;

/**
 * An entry became visible in the dictionary, or a published entry's text changed.
 * Listeners run after the originating transaction commits.
 */
public record EntryPublishedEvent(Long entryId) {
}
