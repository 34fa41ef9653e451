package com.demo.retryengine.provider;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Upstream AI services whose calls go through a retry executor.
 * The id is the lower-case key used in configuration, logs and metric tags.
 */
public enum ServiceProvider {
    CURSOR("cursor"),   // Cursor agent API
    CLAUDE("claude");   // Claude API

    private final String id;

    ServiceProvider(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ServiceProvider> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(provider -> provider.id.equals(normalized))
            .findFirst();
    }
}
