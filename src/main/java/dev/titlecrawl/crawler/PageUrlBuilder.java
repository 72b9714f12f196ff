package dev.titlecrawl.crawler;

/**
 * Derives the URL of a listing page from the base URL and page size. The base URL may carry
 * {@code {page}}, {@code {perPage}} and {@code {offset}} placeholders; without any of them the page
 * and page size are appended as {@code page} and {@code per_page} query parameters.
 */
public class PageUrlBuilder {
	private static final String PAGE = "{page}";
	private static final String PER_PAGE = "{perPage}";
	private static final String OFFSET = "{offset}";

	private final String baseUrl;
	private final int perPage;
	private final boolean templated;

	public PageUrlBuilder(String baseUrl, int perPage) {
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new IllegalArgumentException("Base URL is required");
		}
		if (perPage < 1) {
			throw new IllegalArgumentException("Page size must be positive: " + perPage);
		}
		this.baseUrl = baseUrl.trim();
		this.perPage = perPage;
		this.templated =
				this.baseUrl.contains(PAGE) || this.baseUrl.contains(PER_PAGE) || this.baseUrl.contains(OFFSET);
	}

	public String urlFor(int pageIndex) {
		if (pageIndex < 1) {
			throw new IllegalArgumentException("Page index must be 1 or more: " + pageIndex);
		}
		if (templated) {
			long offset = (long) (pageIndex - 1) * perPage;
			return baseUrl.replace(PAGE, Integer.toString(pageIndex))
					.replace(PER_PAGE, Integer.toString(perPage))
					.replace(OFFSET, Long.toString(offset));
		}

		// keep any fragment at the end
		String url = baseUrl;
		String fragment = "";
		int hash = url.indexOf('#');
		if (hash >= 0) {
			fragment = url.substring(hash);
			url = url.substring(0, hash);
		}
		String separator = url.indexOf('?') < 0 ? "?" : (url.endsWith("?") || url.endsWith("&") ? "" : "&");
		return url + separator + "page=" + pageIndex + "&per_page=" + perPage + fragment;
	}

	public int perPage() {
		return perPage;
	}
}
