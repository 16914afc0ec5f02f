package com.example.kiosksync.controller;

import com.example.kiosksync.chat.ChatArchiver;
import com.example.kiosksync.error.InvalidRequestException;
import com.example.kiosksync.error.NotFoundException;
import com.example.kiosksync.model.ChatSaveRequest;
import com.example.kiosksync.model.ChatSession;
import com.example.kiosksync.model.ChatSessionMetadata;
import com.example.kiosksync.model.SessionFilter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatArchiver archiver;

    public ChatController(ChatArchiver archiver) {
        this.archiver = archiver;
    }

    @PostMapping("/save")
    public ResponseEntity<Map<String, Object>> save(@RequestBody ChatSaveRequest request) {
        return ResponseEntity.ok(saved(archiver.accept(request)));
    }

    @PostMapping("/save-kiosk")
    public ResponseEntity<Map<String, Object>> saveKiosk(@RequestBody ChatSaveRequest request) {
        return ResponseEntity.ok(saved(archiver.acceptKiosk(request)));
    }

    @GetMapping("/get")
    public ResponseEntity<ChatSession> get(@RequestParam String sessionId) {
        return ResponseEntity.ok(archiver.get(sessionId)
                .orElseThrow(() -> new NotFoundException("chat session", sessionId)));
    }

    @GetMapping("/list")
    public ResponseEntity<List<ChatSessionMetadata>> list(@RequestParam(required = false) String avatarId,
                                                          @RequestParam(required = false) String userId,
                                                          @RequestParam(required = false) String startDate,
                                                          @RequestParam(required = false) String endDate,
                                                          @RequestParam(required = false) Integer limit) {
        SessionFilter filter = SessionFilter.builder()
                .avatarId(avatarId)
                .userId(userId)
                .startDate(parseDate("startDate", startDate))
                .endDate(parseDate("endDate", endDate))
                .limit(limit)
                .build();
        return ResponseEntity.ok(archiver.list(filter));
    }

    @PostMapping("/delete")
    public ResponseEntity<Map<String, Object>> delete(@RequestBody Map<String, String> body) {
        String sessionId = body.get("sessionId");
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidRequestException("Missing required field: sessionId");
        }
        archiver.delete(sessionId);
        return ResponseEntity.ok(Map.of("success", true, "sessionId", sessionId));
    }

    @PostMapping("/rebuild-index")
    public ResponseEntity<Map<String, Object>> rebuildIndex() {
        int indexed = archiver.rebuildIndex();
        return ResponseEntity.ok(Map.of("success", true, "indexed", indexed));
    }

    private static Map<String, Object> saved(ChatSession session) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("sessionId", session.getMetadata().getSessionId());
        result.put("messageCount", session.getMetadata().getMessageCount());
        result.put("message", "Chat session saved successfully");
        return result;
    }

    // ISO-8601 instant or epoch millis
    private static Instant parseDate(String name, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochMilli(Long.parseLong(value));
            }
            return Instant.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidRequestException("Invalid " + name + ": " + value);
        }
    }
}
