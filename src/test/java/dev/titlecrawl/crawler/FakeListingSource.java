package dev.titlecrawl.crawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.titlecrawl.http.FetchClient;
import dev.titlecrawl.http.FetchResult;
import dev.titlecrawl.model.OutcomeKind;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory listing of {@code totalRecords} titles served {@code perPage} at a time, with scripted
 * failures per page.
 */
class FakeListingSource implements FetchClient {
	private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d+)");
	private static final ObjectMapper mapper = new ObjectMapper();

	private final int totalRecords;
	private final int perPage;
	private final Map<Integer, Deque<FetchResult>> scripted = new HashMap<>();
	private final Set<Integer> emptyPages = ConcurrentHashMap.newKeySet();
	private final Map<Integer, CountDownLatch> blockedPages = new ConcurrentHashMap<>();
	private final Map<Integer, Long> stubbornPages = new ConcurrentHashMap<>();
	private final List<Integer> fetchedPages = new ArrayList<>();
	private final AtomicInteger inFlight = new AtomicInteger();
	private final AtomicInteger maxInFlight = new AtomicInteger();
	private volatile long latencyMillis;

	FakeListingSource(int totalRecords, int perPage) {
		this.totalRecords = totalRecords;
		this.perPage = perPage;
	}

	/** Answer the next fetches of {@code page} with these outcomes before serving it normally */
	synchronized FakeListingSource failing(int page, OutcomeKind... kinds) {
		Deque<FetchResult> queue = scripted.computeIfAbsent(page, p -> new ArrayDeque<>());
		for (OutcomeKind kind : kinds) {
			int status = switch (kind) {
				case RATE_LIMITED -> 429;
				case FATAL_ERROR -> 404;
				default -> 503;
			};
			queue.add(FetchResult.failure(kind, status, Duration.ofMillis(5), "http_" + status));
		}
		return this;
	}

	/** Make {@code page} fail with {@code kind} on every attempt */
	synchronized FakeListingSource alwaysFailing(int page, OutcomeKind kind) {
		OutcomeKind[] kinds = new OutcomeKind[100];
		Arrays.fill(kinds, kind);
		return failing(page, kinds);
	}

	/** Answer the next fetch of {@code page} with {@code result} */
	synchronized FakeListingSource respondingWith(int page, FetchResult result) {
		scripted.computeIfAbsent(page, p -> new ArrayDeque<>()).add(result);
		return this;
	}

	/** Serve {@code page} without items while still reporting more pages */
	synchronized FakeListingSource emptyPage(int page) {
		emptyPages.add(page);
		return this;
	}

	/** Block fetches of {@code page} until the fetching thread is interrupted */
	FakeListingSource blocking(int page) {
		blockedPages.put(page, new CountDownLatch(1));
		return this;
	}

	/**
	 * Make fetches of {@code page} take {@code millis} regardless of interrupts, like a blocking
	 * socket read. The interrupt status is restored before returning.
	 */
	FakeListingSource ignoringInterrupts(int page, long millis) {
		blockedPages.put(page, new CountDownLatch(1));
		stubbornPages.put(page, millis);
		return this;
	}

	FakeListingSource withLatency(long millis) {
		this.latencyMillis = millis;
		return this;
	}

	/** Wait until a blocked page has been requested */
	void awaitBlocked(int page) throws InterruptedException {
		blockedPages.get(page).await();
	}

	@Override
	public FetchResult fetch(String url) throws InterruptedException {
		int page = pageOf(url);
		int current = inFlight.incrementAndGet();
		maxInFlight.accumulateAndGet(current, Math::max);
		try {
			FetchResult scriptedResult;
			synchronized (this) {
				fetchedPages.add(page);
				Deque<FetchResult> queue = scripted.get(page);
				scriptedResult = queue != null ? queue.poll() : null;
			}
			CountDownLatch blocked = blockedPages.get(page);
			Long stubbornMillis = stubbornPages.get(page);
			if (stubbornMillis != null) {
				blocked.countDown();
				sleepIgnoringInterrupts(stubbornMillis);
			} else if (blocked != null) {
				blocked.countDown();
				new CountDownLatch(1).await();
			}
			if (latencyMillis > 0) {
				Thread.sleep(latencyMillis);
			}
			if (scriptedResult != null) {
				return scriptedResult;
			}
			return FetchResult.success(payload(page), 200, Duration.ofMillis(latencyMillis));
		} finally {
			inFlight.decrementAndGet();
		}
	}

	private static void sleepIgnoringInterrupts(long millis) {
		long deadline = System.nanoTime() + millis * 1_000_000;
		boolean interrupted = false;
		long remaining;
		while ((remaining = deadline - System.nanoTime()) > 0) {
			try {
				Thread.sleep(remaining / 1_000_000 + 1);
			} catch (InterruptedException e) {
				interrupted = true;
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}

	private String payload(int page) {
		int first = (page - 1) * perPage;
		int count = emptyPages.contains(page) ? 0 : Math.max(0, Math.min(perPage, totalRecords - first));
		boolean hasNext = (long) page * perPage < totalRecords;

		ObjectNode root = mapper.createObjectNode();
		ObjectNode search = root.putObject("data").putObject("search");
		ArrayNode edges = search.putArray("edges");
		for (int i = 0; i < count; i++) {
			ObjectNode node = edges.addObject().putObject("node");
			node.putObject("titleText").put("text", "Title " + (first + i + 1));
			node.putObject("releaseYear").put("year", 1950 + (first + i) % 70);
			node.putObject("ratingsSummary").put("aggregateRating", 5.5);
		}
		search.putObject("pageInfo").put("hasNextPage", hasNext);
		return root.toString();
	}

	static int pageOf(String url) {
		Matcher matcher = PAGE_PARAM.matcher(url);
		if (!matcher.find()) {
			throw new IllegalArgumentException("No page in " + url);
		}
		return Integer.parseInt(matcher.group(1));
	}

	synchronized List<Integer> fetchedPages() {
		return List.copyOf(fetchedPages);
	}

	synchronized long fetchCount(int page) {
		return fetchedPages.stream().filter(p -> p == page).count();
	}

	int maxInFlight() {
		return maxInFlight.get();
	}
}
