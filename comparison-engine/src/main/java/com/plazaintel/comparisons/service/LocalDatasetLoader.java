package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.TabularDataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the host's local dataset (the file the protected periods come from).
 */
@Slf4j
@RequiredArgsConstructor
public class LocalDatasetLoader {

    private final DatasetParser parser;
    private final Path path;

    /**
     * @return the parsed table, or an empty one when the file does not exist
     */
    public TabularDataset load() {
        if (!Files.exists(path)) {
            log.warn("Local dataset not found at {}, no protected periods", path);
            return TabularDataset.empty();
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            TabularDataset dataset = parser.parse(bytes, path.getFileName().toString());
            log.info("Local dataset {} read: {} rows, {} columns", path, dataset.size(), dataset.columns().size());
            return dataset;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read local dataset " + path, e);
        }
    }

    public Path path() {
        return path;
    }
}
