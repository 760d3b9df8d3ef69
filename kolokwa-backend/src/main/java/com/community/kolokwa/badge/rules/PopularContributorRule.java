package com.community.kolokwa.badge.rules;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.repository.DictionaryEntryRepository;
import org.springframework.stereotype.Component;

/**
 * popular_contributor: 3 entries with at least 10 upvotes each
 */
@Component
public class PopularContributorRule implements SpecialBadgeRule {

    static final int UPVOTES = 10;
    static final int ENTRIES = 3;

    private final DictionaryEntryRepository entryRepository;

    public PopularContributorRule(DictionaryEntryRepository entryRepository) {
        this.entryRepository = entryRepository;
    }

    @Override
    public String getBadgeKey() {
        return "popular_contributor";
    }

    @Override
    public boolean qualifies(Member member) {
        return entryRepository.countByContributorIdAndUpvotesGreaterThanEqual(member.getMemberId(), UPVOTES) >= ENTRIES;
    }
}
