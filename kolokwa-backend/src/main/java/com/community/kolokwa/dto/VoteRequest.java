package com.community.kolokwa.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteRequest {

    // 1 = upvote, -1 = downvote
    @NotNull(message = "Vote type is required")
    @JsonAlias("vote_type")
    private Integer voteType;
}
