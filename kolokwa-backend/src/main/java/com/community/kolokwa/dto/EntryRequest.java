package com.community.kolokwa.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of entry submission and editing. Accepts camelCase and snake_case field names.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntryRequest {

    @NotBlank(message = "Kolokwa text is required")
    @Size(max = 255)
    @JsonAlias("koloqua_text")
    private String koloquaText;

    @NotBlank(message = "English translation is required")
    @Size(max = 2000)
    @JsonAlias("english_translation")
    private String englishTranslation;

    @Size(max = 2000)
    @JsonAlias("literal_translation")
    private String literalTranslation;

    /** word | phrase | idiom | proverb; defaults to word */
    @JsonAlias("entry_type")
    private String entryType;

    @Size(max = 2000)
    @JsonAlias("context_explanation")
    private String contextExplanation;

    @Size(max = 1000)
    @JsonAlias("example_sentence_koloqua")
    private String exampleSentenceKoloqua;

    @Size(max = 1000)
    @JsonAlias("example_sentence_english")
    private String exampleSentenceEnglish;

    @Size(max = 2000)
    @JsonAlias("cultural_notes")
    private String culturalNotes;

    @Size(max = 255)
    @JsonAlias("pronunciation_guide")
    private String pronunciationGuide;

    @Size(max = 100)
    @JsonAlias("region_specific")
    private String regionSpecific;
}
