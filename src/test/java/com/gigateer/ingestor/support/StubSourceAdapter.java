package com.gigateer.ingestor.support;

import com.gigateer.ingestor.domain.exception.FetchException;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.SourceConfig;
import com.gigateer.ingestor.domain.ports.SourceAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Adapter returning canned records, or failing on demand.
 */
public class StubSourceAdapter implements SourceAdapter {

    private final String sourceId;
    private Supplier<Stream<RawRecord>> listings = Stream::empty;
    private String fetchError;

    public StubSourceAdapter(String sourceId) {
        this.sourceId = sourceId;
    }

    public StubSourceAdapter returning(RawRecord... records) {
        List<RawRecord> copy = new ArrayList<>(List.of(records));
        this.listings = copy::stream;
        return this;
    }

    public StubSourceAdapter returning(Supplier<Stream<RawRecord>> listings) {
        this.listings = listings;
        return this;
    }

    public StubSourceAdapter failingWith(String message) {
        this.fetchError = message;
        return this;
    }

    @Override
    public String getSourceId() {
        return sourceId;
    }

    @Override
    public Stream<RawRecord> fetchListings(SourceConfig config) throws FetchException {
        if (fetchError != null) {
            throw new FetchException(sourceId, fetchError);
        }
        return listings.get();
    }
}
