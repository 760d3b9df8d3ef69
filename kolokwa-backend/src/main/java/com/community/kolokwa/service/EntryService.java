package com.community.kolokwa.service;

import com.community.kolokwa.dto.EntryDTO;

import java.util.List;

public interface EntryService {

    /**
     * Entry detail with score, rank and the viewer's vote. Rejected entries are only
     * visible to their contributor and to staff.
     * @param viewerId may be null for anonymous readers
     */
    EntryDTO getEntry(Long entryId, Long viewerId);

    /**
     * Verified entries ordered by score.
     * @param count number of results, clamped to 1..100
     * @param sortOrder "asc" or "desc" (default "desc")
     */
    List<EntryDTO> getEntryRanking(Integer count, String sortOrder);

    /**
     * Review queue: pending entries, newest first.
     */
    List<EntryDTO> getPendingEntries(Integer count);
}
