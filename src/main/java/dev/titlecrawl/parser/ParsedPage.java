package dev.titlecrawl.parser;

import dev.titlecrawl.model.TitleRecord;
import java.util.List;

/**
 * Records extracted from one page.
 *
 * @param records the records in source order, possibly empty
 * @param hasMorePages whether the source reports further pages
 * @param skippedItems items that were dropped for lacking a usable title
 */
public record ParsedPage(List<TitleRecord> records, boolean hasMorePages, int skippedItems) {

	public ParsedPage {
		records = List.copyOf(records);
	}

	public static ParsedPage empty(boolean hasMorePages) {
		return new ParsedPage(List.of(), hasMorePages, 0);
	}
}
