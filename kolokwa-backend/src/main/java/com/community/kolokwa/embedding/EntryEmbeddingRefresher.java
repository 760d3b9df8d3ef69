package com.community.kolokwa.embedding;

import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryEmbedding;
import com.community.kolokwa.entity.EntryStatus;
import com.community.kolokwa.event.EntryPublishedEvent;
import com.community.kolokwa.repository.DictionaryEntryRepository;
import com.community.kolokwa.repository.EntryEmbeddingRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.StringJoiner;

/**
 * Rebuilds an entry's search vector once the publishing transaction has committed.
 * Failures are logged and dropped here; the committed verification stands.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntryEmbeddingRefresher {

    private final EmbeddingService embeddingService;
    private final DictionaryEntryRepository entryRepository;
    private final EntryEmbeddingRepository embeddingRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onEntryPublished(EntryPublishedEvent event) {
        if (!embeddingService.isAvailable()) {
            log.debug("Embedding disabled, entry {} not indexed", event.entryId());
            return;
        }
        try {
            refresh(event.entryId());
        } catch (RuntimeException | JsonProcessingException ex) {
            log.warn("Could not refresh embedding of entry {}: {}", event.entryId(), ex.getMessage(), ex);
        }
    }

    private void refresh(Long entryId) throws JsonProcessingException {
        DictionaryEntry entry = entryRepository.findById(entryId).orElse(null);
        if (entry == null || entry.getStatus() != EntryStatus.VERIFIED) {
            return;
        }
        float[] vector = embeddingService.embed(buildText(entry));

        EntryEmbedding embedding = embeddingRepository.findById(entryId)
                .orElseGet(() -> EntryEmbedding.builder().entryId(entryId).build());
        embedding.setModel(embeddingService.modelName());
        embedding.setDimensions(vector.length);
        embedding.setVectorJson(objectMapper.writeValueAsString(vector));
        embedding.setUpdatedAt(LocalDateTime.now(clock));
        embeddingRepository.save(embedding);
        log.debug("Entry {} embedded ({} dimensions)", entryId, vector.length);
    }

    static String buildText(DictionaryEntry entry) {
        StringJoiner text = new StringJoiner(" | ");
        text.add(entry.getKoloquaText());
        text.add(entry.getEnglishTranslation());
        if (entry.getLiteralTranslation() != null) {
            text.add(entry.getLiteralTranslation());
        }
        if (entry.getContextExplanation() != null) {
            text.add(entry.getContextExplanation());
        }
        if (entry.getExampleSentenceKoloqua() != null) {
            text.add(entry.getExampleSentenceKoloqua());
        }
        return text.toString();
    }
}
