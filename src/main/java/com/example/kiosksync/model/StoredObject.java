package com.example.kiosksync.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One object of the durable backing store. {@code revision} starts at 1 and is bumped by every
 * write; conditional writes compare against it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document("objects")
public class StoredObject {
    @Id
    private String key;
    private byte[] body;
    private String contentType;
    private long revision;
    private long size;
    private Instant lastModified;
}
