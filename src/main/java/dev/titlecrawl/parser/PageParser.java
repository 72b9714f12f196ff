package dev.titlecrawl.parser;

/** Turns a fetched listing payload into records. Implementations are pure and thread-safe. */
public interface PageParser {

	/**
	 * Parse one page.
	 *
	 * @param payload the raw response body
	 * @param context where the payload came from
	 * @return the extracted records and whether the source has more pages
	 * @throws PageParseException if the payload is not a listing document
	 */
	ParsedPage parse(String payload, PageContext context) throws PageParseException;
}
