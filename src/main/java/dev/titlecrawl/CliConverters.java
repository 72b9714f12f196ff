package dev.titlecrawl;

import dev.titlecrawl.crawler.CrawlConfig;
import java.util.Locale;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/** Converters for option values that usually arrive through environment variables */
public final class CliConverters {

	private CliConverters() {}

	/** Accepts true/1/yes/on and false/0/no/off, case insensitive */
	public static class BooleanFlag implements ITypeConverter<Boolean> {
		@Override
		public Boolean convert(String value) {
			return switch (value.trim().toLowerCase(Locale.ROOT)) {
				case "true", "1", "yes", "on" -> true;
				case "false", "0", "no", "off" -> false;
				default -> throw new TypeConversionException(
						"'" + value + "' is not a boolean (use true/false, yes/no or 1/0)");
			};
		}
	}

	/** A page count where all, unlimited or anything below 1 means no limit */
	public static class PageLimit implements ITypeConverter<Integer> {
		@Override
		public Integer convert(String value) {
			String trimmed = value.trim().toLowerCase(Locale.ROOT);
			if (trimmed.isEmpty() || trimmed.equals("all") || trimmed.equals("unlimited")) {
				return CrawlConfig.UNLIMITED;
			}
			try {
				int pages = Integer.parseInt(trimmed);
				return pages < 1 ? CrawlConfig.UNLIMITED : pages;
			} catch (NumberFormatException e) {
				throw new TypeConversionException("'" + value + "' is not a page count (use a number, all or unlimited)");
			}
		}
	}
}
