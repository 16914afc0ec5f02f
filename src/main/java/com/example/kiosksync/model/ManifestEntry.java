package com.example.kiosksync.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManifestEntry {
    private long version;
    private boolean published;
}
