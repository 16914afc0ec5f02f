package com.example.kiosksync.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatus {
    private int total;
    private int dirty;
    private int synced;
}
