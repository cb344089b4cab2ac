package com.gigateer.ingestor.support;

import com.gigateer.ingestor.domain.model.SourceConfig;
import com.gigateer.ingestor.domain.ports.SourceConfigProvider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Source configuration held in a map, in insertion order.
 */
public class MapConfigProvider implements SourceConfigProvider {

    private final Map<String, SourceConfig> configs = new LinkedHashMap<>();

    public MapConfigProvider put(SourceConfig config) {
        configs.put(config.sourceId(), config);
        return this;
    }

    @Override
    public Optional<SourceConfig> find(String sourceId) {
        return Optional.ofNullable(configs.get(sourceId));
    }

    @Override
    public Set<String> sourceIds() {
        return configs.keySet();
    }
}
