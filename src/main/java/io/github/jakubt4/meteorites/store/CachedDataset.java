package io.github.jakubt4.meteorites.store;

import io.github.jakubt4.meteorites.model.Meteorite;

import java.util.List;

public record CachedDataset(List<Meteorite> records, CacheMetadata metadata) {

    public CachedDataset {
        records = List.copyOf(records);
    }
}
