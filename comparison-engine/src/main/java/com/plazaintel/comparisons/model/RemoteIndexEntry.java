package com.plazaintel.comparisons.model;

/**
 * One manifest entry, e.g. "2023-05" → {download_url, "plazas_2023_05.parquet"}.
 * The locator may be blank; the fetcher reports that as NO_LOCATOR.
 */
public record RemoteIndexEntry(String label, String locator, String name) {

    public boolean hasLocator() {
        return locator != null && !locator.isBlank();
    }
}
