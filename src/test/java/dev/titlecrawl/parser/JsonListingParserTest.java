package dev.titlecrawl.parser;

import static org.assertj.core.api.Assertions.*;

import dev.titlecrawl.model.TitleRecord;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JsonListingParserTest {

	private static final PageContext CONTEXT =
			new PageContext(3, "https://listing.test/search?page=3&per_page=2", Instant.parse("2024-03-01T12:00:00Z"));

	private final JsonListingParser parser = new JsonListingParser();

	@Test
	void testParsesNestedEdges() throws Exception {
		// Given
		String payload =
				"""
				{"data": {"advancedTitleSearch": {
				  "edges": [
				    {"node": {"title": {"titleText": {"text": "Heat"}, "releaseYear": {"year": 1995},
				                        "ratingsSummary": {"aggregateRating": 8.3}}}},
				    {"node": {"titleText": {"text": "Ronin"}, "releaseYear": {"year": 1998},
				              "ratingsSummary": {"aggregateRating": null}}}
				  ],
				  "pageInfo": {"hasNextPage": true, "endCursor": "abc"}}}}
				""";

		// When
		ParsedPage page = parser.parse(payload, CONTEXT);

		// Then
		assertThat(page.hasMorePages()).isTrue();
		assertThat(page.skippedItems()).isZero();
		assertThat(page.records())
				.extracting(TitleRecord::title, TitleRecord::year, TitleRecord::rating)
				.containsExactly(tuple("Heat", "1995", "8.3"), tuple("Ronin", "1998", null));

		TitleRecord first = page.records().get(0);
		assertThat(first.page()).isEqualTo(3);
		assertThat(first.sourceUrl()).isEqualTo(CONTEXT.url());
		assertThat(first.scrapedAtUtc()).isEqualTo("2024-03-01T12:00:00Z");
	}

	@Test
	void testParsesPlainItems() throws Exception {
		String payload =
				"""
				{"items": [{"title": "Alien", "year": "1979", "rating": "8.5"}],
				 "pageInfo": {"hasNextPage": false}}
				""";

		ParsedPage page = parser.parse(payload, CONTEXT);

		assertThat(page.hasMorePages()).isFalse();
		assertThat(page.records()).extracting(TitleRecord::title).containsExactly("Alien");
		assertThat(page.records().get(0).rating()).isEqualTo("8.5");
	}

	@Test
	void testItemsWithoutTitleAreSkipped() throws Exception {
		String payload =
				"""
				{"items": [{"year": 2001}, {"title": "  "}, "junk", {"title": "Memento", "rating": "n/a"}],
				 "pageInfo": {"hasNextPage": true}}
				""";

		ParsedPage page = parser.parse(payload, CONTEXT);

		assertThat(page.skippedItems()).isEqualTo(3);
		assertThat(page.records()).hasSize(1);
		assertThat(page.records().get(0).rating()).isNull();
	}

	@Test
	void testEmptyItemArrayIsValid() throws Exception {
		ParsedPage page = parser.parse("{\"edges\": [], \"pageInfo\": {\"hasNextPage\": false}}", CONTEXT);

		assertThat(page.records()).isEmpty();
		assertThat(page.hasMorePages()).isFalse();
	}

	@Test
	void testMalformedPayloadsAreRejected() {
		assertThatThrownBy(() -> parser.parse("", CONTEXT)).isInstanceOf(PageParseException.class);
		assertThatThrownBy(() -> parser.parse("{\"edges\": [", CONTEXT))
				.isInstanceOf(PageParseException.class)
				.hasMessageContaining("Invalid JSON on page 3");
		assertThatThrownBy(() -> parser.parse("\"just a string\"", CONTEXT))
				.isInstanceOf(PageParseException.class);
	}

	@Test
	void testMissingStructureIsRejected() {
		assertThatThrownBy(() -> parser.parse("{\"pageInfo\": {\"hasNextPage\": true}}", CONTEXT))
				.isInstanceOf(PageParseException.class)
				.hasMessageContaining("No item array");
		assertThatThrownBy(() -> parser.parse("{\"items\": []}", CONTEXT))
				.isInstanceOf(PageParseException.class)
				.hasMessageContaining("hasNextPage");
		assertThatThrownBy(() -> parser.parse("{\"items\": [], \"pageInfo\": {\"hasNextPage\": \"yes\"}}", CONTEXT))
				.isInstanceOf(PageParseException.class);
	}
}
