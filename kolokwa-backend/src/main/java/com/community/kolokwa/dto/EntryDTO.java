package com.community.kolokwa.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Entry as shown to readers, with its computed score.
 */
@Data
public class EntryDTO {

    private Long entryId;

    private String koloquaText;

    private String englishTranslation;

    private String literalTranslation;

    private String entryType;

    private String contextExplanation;

    private String exampleSentenceKoloqua;

    private String exampleSentenceEnglish;

    private String culturalNotes;

    private String pronunciationGuide;

    private String regionSpecific;

    private Long contributorId;

    private String status;

    private Integer upvotes;

    private Integer downvotes;

    private Integer verificationCount;

    // upvotes - downvotes + 2 * verification_count
    private Integer score;

    // position among verified entries, null for other statuses
    private Integer rank;

    // caller's own vote: 1, -1 or null
    private Integer userVote;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime verifiedAt;
}
