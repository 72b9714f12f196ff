package dev.titlecrawl.parser;

import java.time.Instant;

/**
 * Provenance stamped onto every record extracted from a page.
 *
 * @param pageIndex 1-based page index
 * @param url the exact URL that was fetched
 * @param scrapedAt extraction time shared by all records of the page
 */
public record PageContext(int pageIndex, String url, Instant scrapedAt) {}
