package dev.titlecrawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * One extracted title entry. Records are plain values: two records with the same content are
 * interchangeable and nothing in the crawler deduplicates them.
 *
 * @param title the display title, never blank
 * @param year the release year as text, or null when the source omits it
 * @param rating the aggregate rating as numeric-like text, or null
 * @param page the 1-based index of the listing page the record was found on
 * @param sourceUrl the exact page URL that was fetched
 * @param scrapedAtUtc ISO-8601 UTC instant of extraction
 */
@JsonPropertyOrder({"title", "year", "rating", "page", "source_url", "scraped_at_utc"})
public record TitleRecord(
		@JsonProperty("title") String title,
		@JsonProperty("year") String year,
		@JsonProperty("rating") String rating,
		@JsonProperty("page") int page,
		@JsonProperty("source_url") String sourceUrl,
		@JsonProperty("scraped_at_utc") String scrapedAtUtc) {

	private static final Pattern NUMERIC = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");

	/**
	 * Build a record from raw extracted values, trimming text fields and dropping a rating that
	 * is not numeric-like.
	 */
	public static TitleRecord of(
			String title, String year, String rating, int page, String sourceUrl, Instant scrapedAt) {
		return new TitleRecord(
				trimToNull(title),
				trimToNull(year),
				normalizeRating(rating),
				page,
				sourceUrl,
				scrapedAt.toString());
	}

	/** Check required fields are present and optional fields are well-formed */
	public boolean isValid() {
		if (title == null || title.isBlank()) {
			return false;
		}
		if (page < 1 || sourceUrl == null || sourceUrl.isBlank() || scrapedAtUtc == null) {
			return false;
		}
		return rating == null || NUMERIC.matcher(rating).matches();
	}

	static String normalizeRating(String rating) {
		String value = trimToNull(rating);
		if (value == null || !NUMERIC.matcher(value).matches()) {
			return null;
		}
		return value;
	}

	private static String trimToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}
