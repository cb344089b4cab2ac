package com.gigateer.ingestor.domain.ports;

import com.gigateer.ingestor.domain.model.ErrorLogEntry;

import java.util.List;

/**
 * Append-only store of run failures.
 */
public interface ErrorLogRepository {

    void append(ErrorLogEntry entry);

    List<ErrorLogEntry> findByRunId(String runId);
}
