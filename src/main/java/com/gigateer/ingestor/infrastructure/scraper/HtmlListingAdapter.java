package com.gigateer.ingestor.infrastructure.scraper;

import com.gigateer.ingestor.domain.exception.FetchException;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.SourceConfig;
import com.gigateer.ingestor.domain.ports.SourceAdapter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Base for adapters that read one HTML listing page and turn each event
 * card on it into a {@link RawRecord}.
 *
 * <p>The page is fetched eagerly; cards are extracted lazily as the
 * returned stream is consumed. A card that cannot be read becomes an
 * extraction failure instead of ending the stream.
 */
public abstract class HtmlListingAdapter implements SourceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(HtmlListingAdapter.class);
    private static final int MAX_SNIPPET_LENGTH = 1000;

    protected static final Map<String, String> HTML_HEADERS = Map.of(
        "accept", "text/html,application/xhtml+xml",
        "accept-language", "en-GB,en;q=0.9",
        "user-agent", "Mozilla/5.0 (compatible; GigateerIngestor/0.1; +https://gigateer.com)"
    );

    private final HtmlFetcher fetcher;

    protected HtmlListingAdapter(HtmlFetcher fetcher) {
        this.fetcher = fetcher;
    }

    protected HtmlListingAdapter() {
        this(url -> HttpClientUtil.getHtml(url, HTML_HEADERS));
    }

    /**
     * CSS selector matching one element per listed event.
     */
    protected abstract String cardSelector();

    /**
     * Reads one event card. May throw any runtime exception for a card it
     * cannot make sense of.
     */
    protected abstract RawRecord extract(Element card);

    @Override
    public Stream<RawRecord> fetchListings(SourceConfig config) throws FetchException {
        String url = config.listingUrl();
        if (url == null || url.isBlank()) {
            throw new FetchException(getSourceId(), "No listing URL configured");
        }

        String html;
        try {
            html = fetcher.fetch(url);
        } catch (IOException e) {
            throw new FetchException(getSourceId(), "GET " + url + " failed: " + e.getMessage(), e);
        }

        Document page = Jsoup.parse(html, url);
        Elements cards = page.select(cardSelector());
        logger.info("Source {}: found {} event cards on {}", getSourceId(), cards.size(), url);
        return cards.stream().map(this::extractSafely);
    }

    private RawRecord extractSafely(Element card) {
        try {
            return extract(card);
        } catch (RuntimeException e) {
            logger.warn("Source {}: could not read event card: {}", getSourceId(), e.getMessage());
            String snippet = card.outerHtml();
            if (snippet.length() > MAX_SNIPPET_LENGTH) {
                snippet = snippet.substring(0, MAX_SNIPPET_LENGTH);
            }
            return RawRecord.failed(getSourceId(), Map.of("html", snippet), e.getMessage());
        }
    }

    /**
     * Trimmed text of the first match, or null.
     */
    protected static String text(Element root, String selector) {
        Element element = root.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Absolute URL from the attribute of the first match, or null.
     */
    protected static String absoluteUrl(Element root, String selector, String attribute) {
        Element element = root.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String url = element.absUrl(attribute);
        return url.isEmpty() ? null : url;
    }

    protected static String joinNonNull(String separator, String... parts) {
        StringBuilder joined = new StringBuilder();
        for (String part : parts) {
            if (part == null) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append(separator);
            }
            joined.append(part);
        }
        return joined.length() > 0 ? joined.toString() : null;
    }
}
