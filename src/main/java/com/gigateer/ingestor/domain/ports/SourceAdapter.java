package com.gigateer.ingestor.domain.ports;

import com.gigateer.ingestor.domain.exception.FetchException;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.SourceConfig;

import java.util.stream.Stream;

/**
 * Port for extracting raw gig listings from one venue's website.
 * One implementation per source.
 */
public interface SourceAdapter {

    /**
     * Gets the source this adapter handles.
     *
     * @return Source identifier (e.g., "bristol-the-croft")
     */
    String getSourceId();

    /**
     * Fetches the current listings. The returned stream is lazy, finite and
     * can be consumed once; records come in scrape order.
     *
     * @param config effective settings for the source
     * @return raw records, possibly including extraction failures
     * @throws FetchException if the source cannot be reached at all
     */
    Stream<RawRecord> fetchListings(SourceConfig config) throws FetchException;
}
