package com.gigateer.ingestor.domain.ports;

import com.gigateer.ingestor.domain.model.SourceConfig;

import java.util.Optional;
import java.util.Set;

/**
 * Supplies the effective settings of each configured source.
 */
public interface SourceConfigProvider {

    Optional<SourceConfig> find(String sourceId);

    Set<String> sourceIds();
}
