package com.example.kiosksync.model;

import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileResult {
    private List<String> needsUpdate = new ArrayList<>();
    private List<String> conflicts = new ArrayList<>();
    private Map<String, ManifestEntry> serverVersions = new LinkedHashMap<>();
}
