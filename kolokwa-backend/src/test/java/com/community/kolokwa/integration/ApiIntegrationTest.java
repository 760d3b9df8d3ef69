package com.community.kolokwa.integration;

import com.community.kolokwa.support.IntegrationTestSupport;
import com.community.kolokwa.util.ReconciliationStatusManager;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST layer: envelope, status mapping and the reconciliation lock.
 */
@DisplayName("REST API")
class ApiIntegrationTest extends IntegrationTestSupport {

    private static final String MEMBER = "X-Member-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ReconciliationStatusManager statusManager;

    @BeforeEach
    void setUpMembers() {
        createMember(1L, "Contributor");
        createMember(2L, "Reader");
        createMember(99L, "Moderator", true);
    }

    private long postEntry(String text) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/entries")
                        .header(MEMBER, 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"koloqua_text\": \"" + text + "\", \"english_translation\": \"meaning\", \"entry_type\": \"phrase\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.entryType").value("phrase"))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("data").path("entryId").asLong();
    }

    @Test
    @DisplayName("Submit, vote, verify and read back through the API")
    void happyPath() throws Exception {
        long entryId = postEntry("How da body");

        mockMvc.perform(post("/api/entries/{id}/vote", entryId)
                        .header(MEMBER, 2L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote_type\": 1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.upvotes").value(1))
                .andExpect(jsonPath("$.data.userVote").value(1));

        mockMvc.perform(post("/api/entries/{id}/verify", entryId)
                        .header(MEMBER, 2L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verification_type\": \"accurate\", \"comments\": \"correct\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Thank you for your verification!"))
                .andExpect(jsonPath("$.data.verificationCount").value(1));

        mockMvc.perform(get("/api/entries/{id}", entryId).header(MEMBER, 2L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.score").value(3))
                .andExpect(jsonPath("$.data.userVote").value(1));

        mockMvc.perform(get("/api/entries/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].entryId").value(entryId));

        mockMvc.perform(get("/api/members/{id}/stats", 1L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.contributionsCount").value(1))
                .andExpect(jsonPath("$.data.levelInfo.currentLevel").value("beginner"))
                .andExpect(jsonPath("$.data.badges[0].badgeKey").value("first_steps"));

        mockMvc.perform(get("/api/members/leaderboard").param("count", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].rank").value(1))
                .andExpect(jsonPath("$.data[0].memberId").value(1));

        mockMvc.perform(get("/api/badges"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(11));
    }

    @Test
    @DisplayName("Domain errors map to HTTP statuses")
    void errorMapping() throws Exception {
        long entryId = postEntry("Wetin");

        // self-verification
        mockMvc.perform(post("/api/entries/{id}/verify", entryId)
                        .header(MEMBER, 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verification_type\": \"accurate\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value(403));

        // duplicate
        mockMvc.perform(post("/api/entries")
                        .header(MEMBER, 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"koloqua_text\": \"wetin\", \"english_translation\": \"what\"}"))
                .andExpect(status().isConflict());

        // bean validation
        mockMvc.perform(post("/api/entries")
                        .header(MEMBER, 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"koloqua_text\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));

        // unknown polarity
        mockMvc.perform(post("/api/entries/{id}/vote", entryId)
                        .header(MEMBER, 2L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote_type\": 5}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/entries/{id}", 123456L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.data").doesNotExist());

        // no acting member
        mockMvc.perform(post("/api/entries/{id}/vote", entryId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vote_type\": 1}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/admin/reconcile").header(MEMBER, 2L))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Rejected entries are hidden from everyone but the contributor and staff")
    void rejectedVisibility() throws Exception {
        long entryId = postEntry("Hidden");
        mockMvc.perform(post("/api/entries/{id}/moderate", entryId)
                        .header(MEMBER, 99L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"rejected\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/entries/{id}", entryId).header(MEMBER, 2L)).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/entries/{id}", entryId)).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/entries/{id}", entryId).header(MEMBER, 1L)).andExpect(status().isOk());
        mockMvc.perform(get("/api/entries/{id}", entryId).header(MEMBER, 99L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("rejected"));
    }

    @Test
    @DisplayName("Mutations get 423 while reconciliation runs, reads do not")
    void reconciliationLock() throws Exception {
        long entryId = postEntry("Locked");

        assertThat(statusManager.tryStart()).isTrue();
        try {
            mockMvc.perform(post("/api/entries/{id}/vote", entryId)
                            .header(MEMBER, 2L)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"vote_type\": 1}"))
                    .andExpect(status().is(423))
                    .andExpect(jsonPath("$.code").value(423));

            mockMvc.perform(get("/api/entries/{id}", entryId)).andExpect(status().isOk());
        } finally {
            statusManager.finish();
        }

        mockMvc.perform(post("/api/admin/reconcile").param("dry_run", "true").header(MEMBER, 99L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.dryRun").value(true));
        assertThat(voteRepository.count()).isZero();
    }
}
