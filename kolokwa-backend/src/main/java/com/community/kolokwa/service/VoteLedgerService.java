package com.community.kolokwa.service;

import com.community.kolokwa.dto.VoteResultDTO;
import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryVote;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.entity.VoteType;
import com.community.kolokwa.repository.EntryVoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * One vote per (entry, voter). Repeating a vote takes it back, the opposite vote flips it.
 * The caller holds the entry lock and the voter and contributor locks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class VoteLedgerService {

    private final EntryVoteRepository voteRepository;
    private final RewardService rewardService;
    private final Clock clock;

    /**
     * Records a vote and moves the points it is worth.
     * <p>
     * Points per case, voter and contributor:
     * <ul>
     *   <li>new vote: voter +1 (vote), contributor +1 or -1 (vote_received)</li>
     *   <li>same vote again: voter unchanged, contributor gives back the earlier amount (vote_removed)</li>
     *   <li>opposite vote: voter unchanged, contributor +2 or -2 (vote_changed)</li>
     * </ul>
     * The contributor side is skipped when the voter is the contributor. Vote grants carry no
     * idempotency key: a toggle or a flip is a new event.
     *
     * @param entry       locked entry, counters are updated in place
     * @param voter       locked voter
     * @param contributor locked contributor, null when the entry has none
     * @param voteType    requested polarity
     * @return counters after the vote and the voter's current vote (null after a toggle-off)
     */
    public VoteResultDTO castVote(DictionaryEntry entry, Member voter, Member contributor, VoteType voteType) {
        LocalDateTime now = LocalDateTime.now(clock);
        // the contributor is only rewarded for votes by other members
        Member rewarded = contributor != null && !contributor.getMemberId().equals(voter.getMemberId())
                ? contributor : null;
        String text = entry.getKoloquaText();

        EntryVote existing = voteRepository.findByEntryIdAndVoterId(entry.getId(), voter.getMemberId()).orElse(null);
        Integer userVote;

        if (existing == null) {
            // 1. new vote
            voteRepository.save(EntryVote.builder()
                    .entryId(entry.getId())
                    .voterId(voter.getMemberId())
                    .voteType(voteType.getValue())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            adjust(entry, voteType, 1);
            rewardService.award(voter, RewardRule.VOTE_CAST, "Voted on '" + text + "'", null);
            if (rewarded != null) {
                rewardService.awardPoints(rewarded, voteType.getValue(), TransactionType.VOTE_RECEIVED,
                        "Your entry '" + text + "' received a vote");
            }
            userVote = voteType.getValue();
        } else if (existing.getVoteType() == voteType.getValue()) {
            // 2. same vote again: take it back
            voteRepository.delete(existing);
            adjust(entry, voteType, -1);
            if (rewarded != null) {
                rewardService.awardPoints(rewarded, -voteType.getValue(), TransactionType.VOTE_REMOVED,
                        "A vote on your entry '" + text + "' was removed");
            }
            userVote = null;
        } else {
            // 3. flip
            existing.setVoteType(voteType.getValue());
            existing.setUpdatedAt(now);
            voteRepository.save(existing);
            adjust(entry, voteType.opposite(), -1);
            adjust(entry, voteType, 1);
            if (rewarded != null) {
                rewardService.awardPoints(rewarded, 2 * voteType.getValue(), TransactionType.VOTE_CHANGED,
                        "A vote on your entry '" + text + "' changed");
            }
            userVote = voteType.getValue();
        }

        entry.setUpdatedAt(now);
        log.debug("Entry {} votes now +{} / -{} (voter {})", entry.getId(), entry.getUpvotes(),
                entry.getDownvotes(), voter.getMemberId());
        return new VoteResultDTO(entry.getUpvotes(), entry.getDownvotes(), userVote);
    }

    private void adjust(DictionaryEntry entry, VoteType type, int delta) {
        if (type == VoteType.UPVOTE) {
            entry.setUpvotes(clamp(entry, "upvotes", entry.getUpvotes() + delta));
        } else {
            entry.setDownvotes(clamp(entry, "downvotes", entry.getDownvotes() + delta));
        }
    }

    private int clamp(DictionaryEntry entry, String counter, int value) {
        if (value < 0) {
            log.warn("Entry {} {} counter drifted below zero, clamped; reconciliation will repair it",
                    entry.getId(), counter);
            return 0;
        }
        return value;
    }
}
