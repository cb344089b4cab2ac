package com.gigateer.ingestor.infrastructure.scraper;

import java.io.IOException;

/**
 * Retrieves the HTML of a listing page.
 */
@FunctionalInterface
public interface HtmlFetcher {

    String fetch(String url) throws IOException;
}
