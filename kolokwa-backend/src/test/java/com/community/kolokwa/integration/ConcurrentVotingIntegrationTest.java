package com.community.kolokwa.integration;

import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.support.IntegrationTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Parallel writers on one entry serialize on its row lock; no update is lost.
 */
@Slf4j
@DisplayName("Concurrent writers")
class ConcurrentVotingIntegrationTest extends IntegrationTestSupport {

    private static final int VOTERS = 8;

    @Test
    @DisplayName("Parallel upvotes are all counted and all rewarded")
    void parallelVotes() throws Exception {
        createMember(1L, "Contributor");
        for (int i = 0; i < VOTERS; i++) {
            createMember(100L + i, "Voter " + i);
        }
        long entryId = submit(1L, "Plenty people").getEntryId();

        ExecutorService executor = Executors.newFixedThreadPool(VOTERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < VOTERS; i++) {
                long voterId = 100L + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return vote(entryId, voterId, 1);
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        DictionaryEntry entry = entryRepository.findById(entryId).orElseThrow();
        log.info("Entry {} after parallel voting: +{} -{}", entryId, entry.getUpvotes(), entry.getDownvotes());
        assertThat(entry.getUpvotes()).isEqualTo(VOTERS);
        assertThat(voteRepository.countByEntryIdAndVoteType(entryId, 1)).isEqualTo(VOTERS);
        assertThat(transactions(1L, TransactionType.VOTE_RECEIVED)).hasSize(VOTERS);
        assertThat(reload(1L).getPoints()).isEqualTo(ledgerBalance(1L));
    }

    @Test
    @DisplayName("Parallel verifications cross the threshold exactly once")
    void parallelVerifications() throws Exception {
        createMember(1L, "Contributor");
        for (int i = 0; i < 5; i++) {
            createMember(200L + i, "Verifier " + i);
        }
        long entryId = submit(1L, "Da lie").getEntryId();

        ExecutorService executor = Executors.newFixedThreadPool(5);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 5; i++) {
                long verifierId = 200L + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return verify(entryId, verifierId, "accurate");
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(entryRepository.findById(entryId).orElseThrow().getVerificationCount()).isEqualTo(5);
        assertThat(transactions(1L, TransactionType.CONTRIBUTION_VERIFIED)).hasSize(1);
        assertThat(reload(1L).getPoints()).isEqualTo(ledgerBalance(1L));
    }
}
