package com.gigateer.ingestor.domain.exception;

import com.gigateer.ingestor.domain.model.ErrorStage;

/**
 * A raw record could not be turned into a gig. Only that record is dropped.
 */
public class NormalizationException extends IngestionException {

    public enum Kind {
        MISSING_FIELD,
        INVALID_DATE,
        INVALID_VENUE
    }

    private final Kind kind;

    public NormalizationException(Kind kind, String message) {
        super(ErrorStage.NORMALIZE, message);
        this.kind = kind;
    }

    public static NormalizationException missingField(String field) {
        return new NormalizationException(Kind.MISSING_FIELD, "Missing required field: " + field);
    }

    public static NormalizationException invalidDate(String field, String value) {
        return new NormalizationException(Kind.INVALID_DATE,
            String.format("Unparseable %s date: \"%s\"", field, value));
    }

    public static NormalizationException invalidVenue(String value) {
        return new NormalizationException(Kind.INVALID_VENUE,
            String.format("Venue name \"%s\" has no canonical form", value));
    }

    public Kind getErrorKind() {
        return kind;
    }

    @Override
    public String getKind() {
        return kind.name();
    }
}
