package com.plazaintel.comparisons.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plazaintel.comparisons.model.RemoteIndexEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Label → download location of every historical period, read from a JSON
 * manifest:
 *
 *   { "index": { "2023-05": { "download_url": "...", "name": "plazas_2023_05.csv" } } }
 *
 * A bare label map without the "index" wrapper is accepted too. Entries that
 * carry none of download_url / view_url / url are dropped at load.
 *
 * The loaded map is swapped in whole, so readers never see a half-built index.
 */
@Slf4j
public class RemoteIndex {

    static final String[] LOCATOR_FIELDS = {"download_url", "view_url", "url"};

    private final ObjectMapper objectMapper;
    private final Path manifest;

    private volatile Map<String, RemoteIndexEntry> entries = Map.of();
    private volatile boolean loaded;

    public RemoteIndex(ObjectMapper objectMapper, Path manifest) {
        this.objectMapper = objectMapper;
        this.manifest = manifest;
    }

    /**
     * Re-read the manifest. On any failure the previous index stays in place.
     *
     * @return true if the manifest was read
     */
    public boolean reload() {
        if (!Files.exists(manifest)) {
            log.warn("Remote index manifest not found: {}", manifest);
            return false;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(manifest.toFile());
        } catch (IOException e) {
            log.error("Failed to read remote index manifest {}: {}", manifest, e.getMessage(), e);
            return false;
        }

        JsonNode index = selectIndex(root);
        Map<String, RemoteIndexEntry> fresh = new TreeMap<>();
        int discarded = 0;

        Iterator<Map.Entry<String, JsonNode>> fields = index.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            RemoteIndexEntry entry = toEntry(field.getKey(), field.getValue());
            if (entry == null) {
                discarded++;
            } else {
                fresh.put(entry.label(), entry);
            }
        }

        this.entries = Collections.unmodifiableMap(fresh);
        this.loaded = true;

        if (discarded > 0) {
            log.info("Remote index loaded: {} entries ({} without locator discarded)", fresh.size(), discarded);
        } else {
            log.info("Remote index loaded: {} entries", fresh.size());
        }
        return true;
    }

    public Optional<RemoteIndexEntry> lookup(String label) {
        return Optional.ofNullable(entries.get(label));
    }

    public SortedSet<String> labels() {
        return new TreeSet<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isLoaded() {
        return loaded;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode selectIndex(JsonNode root) {
        if (root == null || !root.isObject()) {
            log.warn("Remote index manifest is not a JSON object: {}", manifest);
            return objectMapper.createObjectNode();
        }
        if (root.has("index")) {
            JsonNode index = root.get("index");
            return index.isObject() ? index : objectMapper.createObjectNode();
        }
        Iterator<String> names = root.fieldNames();
        String first = names.hasNext() ? names.next() : "";
        if (first.length() == 7 && first.charAt(4) == '-') {
            return root;
        }
        log.warn("Remote index manifest has an unexpected structure: {}", manifest);
        return objectMapper.createObjectNode();
    }

    private static RemoteIndexEntry toEntry(String label, JsonNode value) {
        if (value == null || !value.isObject()) return null;

        boolean hasLocatorField = false;
        String locator = "";
        for (String field : LOCATOR_FIELDS) {
            if (!value.has(field)) continue;
            hasLocatorField = true;
            String candidate = value.get(field).asText("");
            if (!candidate.isBlank()) {
                locator = candidate;
                break;
            }
        }
        if (!hasLocatorField) return null;

        JsonNode name = value.get("name");
        return new RemoteIndexEntry(label, locator, name == null || name.isNull() ? null : name.asText());
    }
}
