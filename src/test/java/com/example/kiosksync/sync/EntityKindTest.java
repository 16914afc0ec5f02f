package com.example.kiosksync.sync;

import com.example.kiosksync.error.ReservedIdentifierException;
import com.example.kiosksync.model.Avatar;
import com.example.kiosksync.model.Cohort;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityKindTest {

    @Test
    void testNewId_AvatarUsesPlainSlug() {
        assertEquals("prof-smith", EntityKind.AVATAR.newId("Prof Smith", 1_700_000_000_000L));
    }

    @Test
    void testNewId_CohortGetsTimeSuffix() {
        long now = 1_700_000_000_000L;
        assertEquals("fall-mba-" + Long.toString(now, 36), EntityKind.COHORT.newId("Fall MBA", now));
    }

    @Test
    void testNewId_ReservedTokenRejected() {
        ReservedIdentifierException e = assertThrows(ReservedIdentifierException.class,
                () -> EntityKind.AVATAR.newId("New", 1L));
        assertEquals("new", e.getId());
    }

    @Test
    void testNewId_EmptySlugRejected() {
        assertThrows(ReservedIdentifierException.class, () -> EntityKind.AVATAR.newId("???", 1L));
    }

    @Test
    void testKeys() {
        assertEquals("avatars/prof-smith/prof-smith.json", EntityKind.AVATAR.objectKey("prof-smith"));
        assertEquals("avatars/version.json", EntityKind.AVATAR.manifestKey());
        assertEquals("cohort:record:c1", EntityKind.COHORT.cacheKey("c1"));
    }

    @Test
    void testInitialize_CohortDefaults() {
        Cohort cohort = Cohort.builder().name("Fall MBA").build();

        EntityKind.COHORT.initialize(cohort);

        assertNotNull(cohort.getAccessCode());
        assertTrue(cohort.getAccessCode().matches("[ABCDEFGHJKLMNPQRSTUVWXYZ23456789]{6}"));
        assertTrue(cohort.getActive());
        assertFalse(cohort.getPublished());
        assertTrue(cohort.getStudents().isEmpty());
    }

    @Test
    void testInitialize_KeepsExplicitValues() {
        Avatar avatar = Avatar.builder().name("A").published(true).build();

        EntityKind.AVATAR.initialize(avatar);

        assertTrue(avatar.getPublished());
    }
}
