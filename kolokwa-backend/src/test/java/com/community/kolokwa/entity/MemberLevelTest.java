package com.community.kolokwa.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MemberLevelTest {

    @Test
    void testFromPoints_Boundaries() {
        assertEquals(MemberLevel.BEGINNER, MemberLevel.fromPoints(-20));
        assertEquals(MemberLevel.BEGINNER, MemberLevel.fromPoints(99));
        assertEquals(MemberLevel.CONTRIBUTOR, MemberLevel.fromPoints(100));
        assertEquals(MemberLevel.EXPERT, MemberLevel.fromPoints(500));
        assertEquals(MemberLevel.MASTER, MemberLevel.fromPoints(2499));
        assertEquals(MemberLevel.LEGEND, MemberLevel.fromPoints(2500));
        assertEquals(MemberLevel.CHAMPION, MemberLevel.fromPoints(5000));
        assertEquals(MemberLevel.CHAMPION, MemberLevel.fromPoints(1_000_000));
    }

    @Test
    void testNext() {
        assertEquals(MemberLevel.CONTRIBUTOR, MemberLevel.BEGINNER.next());
        assertEquals(MemberLevel.CHAMPION, MemberLevel.LEGEND.next());
        assertNull(MemberLevel.CHAMPION.next());
    }

    @Test
    void testProgressPercent() {
        assertEquals(0.0, MemberLevel.BEGINNER.progressPercent(0));
        assertEquals(50.0, MemberLevel.BEGINNER.progressPercent(50));
        // 100..500
        assertEquals(25.0, MemberLevel.CONTRIBUTOR.progressPercent(200));
        assertEquals(0.0, MemberLevel.BEGINNER.progressPercent(-5));
        assertEquals(100.0, MemberLevel.CHAMPION.progressPercent(6000));
    }

    @Test
    void testCodes() {
        assertEquals("champion", MemberLevel.CHAMPION.getCode());
        assertEquals("Kolokwa Champion", MemberLevel.CHAMPION.getDisplayName());
    }
}
