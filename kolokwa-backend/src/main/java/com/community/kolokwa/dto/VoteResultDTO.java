package com.community.kolokwa.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteResultDTO {

    private Integer upvotes;

    private Integer downvotes;

    // +1, -1, or null once the vote was toggled off
    private Integer userVote;
}
