package com.gigateer.ingestor.infrastructure.scraper;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Utility for fetching venue listing pages.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;
    private static final long DEFAULT_TIMEOUT_MS = 30_000L;

    private HttpClientUtil() {
    }

    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    public static String getHtml(String url, Map<String, String> headers) throws IOException {
        return getHtml(url, headers, DEFAULT_TIMEOUT_MS);
    }

    /**
     * Makes a GET request and returns the body as text.
     *
     * @throws IOException on connection failure, timeout or a non-2xx status
     */
    public static String getHtml(String url, Map<String, String> headers, long timeoutMs) throws IOException {
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMs))
            .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
            .build();

        try (CloseableHttpClient httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build()) {
            HttpGet request = new HttpGet(url);
            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String responseBody;
                try {
                    responseBody = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
                } catch (ParseException e) {
                    throw new IOException("Failed to read response from " + url, e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("GET {} failed with status {}", url, statusCode);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }
                return responseBody;
            }
        }
    }
}
