package com.example.kiosksync.sync;

import java.util.Locale;

public final class Slugs {

    private Slugs() {}

    /**
     * "Prof. Jane  Smith!" &rarr; "prof-jane-smith".
     */
    public static String slugify(String name) {
        if (name == null) return "";
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "-")
                .replaceAll("[^a-z0-9-]", "")
                .replaceAll("-+", "-")
                .replaceAll("^-+|-+$", "");
    }
}
