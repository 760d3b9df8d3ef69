package com.community.kolokwa.service;

import com.community.kolokwa.dto.EntryDTO;
import com.community.kolokwa.entity.DictionaryEntry;

final class EntryMapper {

    private EntryMapper() {
    }

    static EntryDTO toDTO(DictionaryEntry entry) {
        EntryDTO dto = new EntryDTO();
        dto.setEntryId(entry.getId());
        dto.setKoloquaText(entry.getKoloquaText());
        dto.setEnglishTranslation(entry.getEnglishTranslation());
        dto.setLiteralTranslation(entry.getLiteralTranslation());
        dto.setEntryType(entry.getEntryType().getCode());
        dto.setContextExplanation(entry.getContextExplanation());
        dto.setExampleSentenceKoloqua(entry.getExampleSentenceKoloqua());
        dto.setExampleSentenceEnglish(entry.getExampleSentenceEnglish());
        dto.setCulturalNotes(entry.getCulturalNotes());
        dto.setPronunciationGuide(entry.getPronunciationGuide());
        dto.setRegionSpecific(entry.getRegionSpecific());
        dto.setContributorId(entry.getContributorId());
        dto.setStatus(entry.getStatus().getCode());
        dto.setUpvotes(entry.getUpvotes());
        dto.setDownvotes(entry.getDownvotes());
        dto.setVerificationCount(entry.getVerificationCount());
        dto.setScore(entry.calculateScore());
        dto.setCreatedAt(entry.getCreatedAt());
        dto.setUpdatedAt(entry.getUpdatedAt());
        dto.setVerifiedAt(entry.getVerifiedAt());
        return dto;
    }
}
