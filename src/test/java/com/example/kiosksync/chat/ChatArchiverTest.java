package com.example.kiosksync.chat;

import com.example.kiosksync.error.DuplicateEntityException;
import com.example.kiosksync.error.InvalidRequestException;
import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.model.*;
import com.example.kiosksync.store.ObjectStore;
import com.example.kiosksync.support.InMemoryObjectStore;
import com.example.kiosksync.support.TestClock;
import com.example.kiosksync.support.TestMappers;
import com.example.kiosksync.sync.VersionClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ChatArchiverTest {

    private InMemoryObjectStore store;
    private ObjectMapper mapper;
    private VersionClock clock;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        mapper = TestMappers.json();
        clock = new VersionClock(new TestClock(Instant.parse("2025-03-01T10:00:00Z")));
    }

    private ChatArchiver archiver(boolean compression) {
        return new ChatArchiver(store, mapper, new SessionIndexStore(store, mapper, 5), new GzipCodec(),
                clock, compression, 100);
    }

    private static ChatSession session(String id, String avatarId, String userId, long start) {
        ActiveChatSession active = ActiveChatSession.builder()
                .sessionId(id)
                .avatarId(avatarId)
                .avatarName(avatarId)
                .userId(userId)
                .messages(new ArrayList<>(List.of(
                        ChatMessage.user("Hello ünïcode ✓", start),
                        ChatMessage.assistant("Hi", start + 1_000L))))
                .build();
        return ChatSession.of(active, Instant.ofEpochMilli(start + 2_000L));
    }

    private static ChatSaveRequest request(String id) {
        return ChatSaveRequest.builder()
                .sessionId(id)
                .avatarId("prof-smith")
                .avatarName("Prof Smith")
                .messages(List.of(ChatMessage.user("Hi", 1_000L)))
                .build();
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void testSaveThenGet_MessagesIdentical(boolean compression) {
        // Given
        ChatArchiver archiver = archiver(compression);
        ChatSession original = session("s1", "prof-smith", null, 1_000L);

        // When
        archiver.save(original);
        ChatSession loaded = archiver.get("s1").get();

        // Then
        assertEquals(original.getMessages(), loaded.getMessages());
        assertEquals(original.getMetadata(), loaded.getMetadata());
        String expectedKey = compression ? "chats/s1.json.gz" : "chats/s1.json";
        assertTrue(store.exists(expectedKey));
        assertEquals(compression ? ObjectStore.GZIP : ObjectStore.JSON, store.get(expectedKey).get().getContentType());
    }

    @Test
    void testGet_FallsBackToUncompressedLegacyKey() {
        // Given: written before compression was switched on
        archiver(false).save(session("legacy", "a", null, 1_000L));

        // When
        ChatSession loaded = archiver(true).get("legacy").get();

        // Then
        assertEquals(2, loaded.getMetadata().getMessageCount());
        assertTrue(archiver(true).exists("legacy"));
    }

    @Test
    void testGet_MissingIsEmpty() {
        assertTrue(archiver(true).get("nope").isEmpty());
        assertFalse(archiver(true).exists("nope"));
    }

    @Test
    void testSave_IndexSortedNewestFirstAndDeduplicated() {
        ChatArchiver archiver = archiver(true);
        archiver.save(session("old", "a", null, 1_000L));
        archiver.save(session("newest", "a", null, 9_000L));
        archiver.save(session("middle", "a", null, 5_000L));
        archiver.save(session("old", "a", null, 1_000L));

        List<String> ids = archiver.list(SessionFilter.all()).stream()
                .map(ChatSessionMetadata::getSessionId)
                .collect(Collectors.toList());

        assertEquals(List.of("newest", "middle", "old"), ids);
    }

    @Test
    void testList_FiltersAndLimit() {
        // Given
        ChatArchiver archiver = archiver(true);
        archiver.save(session("s1", "a", "u1", 1_000L));
        archiver.save(session("s2", "a", "u2", 2_000L));
        archiver.save(session("s3", "b", "u1", 3_000L));
        archiver.save(session("s4", "a", "u1", 4_000L));

        // When / Then
        assertEquals(List.of("s4", "s2", "s1"), ids(archiver.list(SessionFilter.builder().avatarId("a").build())));
        assertEquals(List.of("s4", "s3", "s1"), ids(archiver.list(SessionFilter.builder().userId("u1").build())));
        assertEquals(List.of("s4", "s3"), ids(archiver.list(SessionFilter.builder()
                .startDate(Instant.ofEpochMilli(3_000L)).build())));
        assertEquals(List.of("s2", "s1"), ids(archiver.list(SessionFilter.builder()
                .endDate(Instant.ofEpochMilli(3_000L)).build())));
        assertEquals(List.of("s4"), ids(archiver.list(SessionFilter.builder().limit(1).build())));
    }

    private static List<String> ids(List<ChatSessionMetadata> metadata) {
        return metadata.stream().map(ChatSessionMetadata::getSessionId).collect(Collectors.toList());
    }

    @Test
    void testDelete_RemovesBothVariantsAndIndexEntry() {
        // Given
        archiver(false).save(session("s1", "a", null, 1_000L));
        ChatArchiver archiver = archiver(true);
        archiver.save(session("s1", "a", null, 1_000L));

        // When
        archiver.delete("s1");

        // Then
        assertFalse(store.exists("chats/s1.json"));
        assertFalse(store.exists("chats/s1.json.gz"));
        assertTrue(archiver.list(SessionFilter.all()).isEmpty());
    }

    @Test
    void testDelete_MissingIsNotFound() {
        assertThrows(NotFoundException.class, () -> archiver(true).delete("ghost"));
    }

    @Test
    void testAccept_BuildsMetadataFromMessages() {
        ChatSession saved = archiver(true).accept(request("1700000000000_abc123def"));

        assertEquals(1, saved.getMetadata().getMessageCount());
        assertEquals(1_000L, saved.getMetadata().getStartTime());
        assertTrue(archiver(true).exists("1700000000000_abc123def"));
    }

    @Test
    void testAccept_DuplicateRejected() {
        ChatArchiver archiver = archiver(true);
        archiver.accept(request("s1"));

        assertThrows(DuplicateEntityException.class, () -> archiver.accept(request("s1")));
    }

    @Test
    void testAccept_InvalidRequestsRejected() {
        ChatArchiver archiver = archiver(true);

        ChatSaveRequest badId = request("../etc/passwd");
        ChatSaveRequest noAvatar = request("s1");
        noAvatar.setAvatarId(null);
        ChatSaveRequest emptyContent = request("s2");
        emptyContent.setMessages(List.of(ChatMessage.user("", 1L)));
        ChatSaveRequest tooLong = request("s3");
        tooLong.setMessages(List.of(ChatMessage.user("x".repeat(10_001), 1L)));

        assertThrows(InvalidRequestException.class, () -> archiver.accept(badId));
        assertThrows(InvalidRequestException.class, () -> archiver.accept(noAvatar));
        assertThrows(InvalidRequestException.class, () -> archiver.accept(emptyContent));
        assertThrows(InvalidRequestException.class, () -> archiver.accept(tooLong));
        assertTrue(store.keys().isEmpty());
    }

    @Test
    void testAcceptKiosk_StripsIdentityAndDefaultsLocation() {
        // Given
        ChatSaveRequest request = request("k1");
        request.setKioskMode(true);
        request.setUserId("someone");

        // When
        ChatSession saved = archiver(true).acceptKiosk(request);

        // Then
        assertNull(saved.getMetadata().getUserId());
        assertEquals("kiosk", saved.getMetadata().getLocation());
        assertTrue(saved.getMetadata().isKioskMode());
    }

    @Test
    void testAcceptKiosk_RejectsNonKioskAndTooManyMessages() {
        ChatArchiver archiver = archiver(true);
        ChatSaveRequest notKiosk = request("k1");
        ChatSaveRequest tooMany = request("k2");
        tooMany.setKioskMode(true);
        List<ChatMessage> messages = new ArrayList<>();
        for (int i = 0; i < 101; i++) messages.add(ChatMessage.user("m" + i, 1_000L + i));
        tooMany.setMessages(messages);

        assertThrows(InvalidRequestException.class, () -> archiver.acceptKiosk(notKiosk));
        assertThrows(InvalidRequestException.class, () -> archiver.acceptKiosk(tooMany));
    }

    @Test
    void testRebuildIndex_ScansBothVariants() {
        // Given
        archiver(false).save(session("plain", "a", null, 1_000L));
        archiver(true).save(session("packed", "a", null, 2_000L));
        store.delete(SessionIndexStore.KEY);

        // When
        int indexed = archiver(true).rebuildIndex();

        // Then
        assertEquals(2, indexed);
        assertEquals(List.of("packed", "plain"), ids(archiver(true).list(SessionFilter.all())));
    }
}
