package dev.titlecrawl.http;

import dev.titlecrawl.model.OutcomeKind;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FetchClient} backed by a pooled Apache HttpClient. A fair semaphore caps the number of
 * fetches in flight; callers over the cap block until a permit frees up. Automatic retries are
 * disabled because the scheduler owns the retry decision.
 */
public class HttpFetchClient implements FetchClient {
	private static final Logger logger = LoggerFactory.getLogger(HttpFetchClient.class);

	private final CloseableHttpClient httpClient;
	private final PoolingHttpClientConnectionManager connectionManager;
	private final Semaphore inFlightPermits;
	private final AtomicInteger inFlight = new AtomicInteger();
	private final AtomicInteger maxObservedInFlight = new AtomicInteger();
	private final Clock clock;

	public HttpFetchClient(HttpSettings settings) {
		this(settings, Clock.systemUTC());
	}

	public HttpFetchClient(HttpSettings settings, Clock clock) {
		this.clock = clock;
		int poolCapacity = settings.poolCapacity();
		if (settings.isPoolUndersized()) {
			logger.warn(
					"Connection pool ({}) is smaller than the in-flight cap ({}), raising pool capacity to match",
					settings.poolCapacity(),
					settings.maxInFlight());
			poolCapacity = settings.maxInFlight();
		}

		Timeout timeout = Timeout.ofMilliseconds(settings.timeout().toMillis());
		this.connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
				.setMaxConnTotal(poolCapacity)
				.setMaxConnPerRoute(poolCapacity)
				.setDefaultConnectionConfig(ConnectionConfig.custom()
						.setConnectTimeout(timeout)
						.setSocketTimeout(timeout)
						.build())
				.build();
		this.httpClient = HttpClients.custom()
				.setConnectionManager(connectionManager)
				.setDefaultRequestConfig(
						RequestConfig.custom().setResponseTimeout(timeout).build())
				.setUserAgent(settings.userAgent())
				.disableAutomaticRetries()
				.build();
		this.inFlightPermits = new Semaphore(settings.maxInFlight(), true);

		logger.info(
				"HTTP client ready: {} in flight, pool of {}, timeout {}s",
				settings.maxInFlight(),
				poolCapacity,
				settings.timeout().toSeconds());
	}

	@Override
	public FetchResult fetch(String url) throws InterruptedException {
		URI uri;
		try {
			uri = URI.create(url);
		} catch (IllegalArgumentException e) {
			return FetchResult.failure(OutcomeKind.FATAL_ERROR, 0, Duration.ZERO, "invalid_url: " + e.getMessage());
		}
		if (uri.getScheme() == null || uri.getHost() == null) {
			return FetchResult.failure(OutcomeKind.FATAL_ERROR, 0, Duration.ZERO, "invalid_url: missing scheme or host");
		}

		inFlightPermits.acquire();
		int current = inFlight.incrementAndGet();
		maxObservedInFlight.accumulateAndGet(current, Math::max);
		Instant startedAt = clock.instant();
		try {
			return execute(uri, startedAt);
		} catch (IOException e) {
			if (Thread.currentThread().isInterrupted()) {
				throw new InterruptedException("Fetch of " + url + " interrupted");
			}
			String reason = e instanceof InterruptedIOException ? "timeout" : "io_error";
			logger.debug("Fetch of {} failed: {} ({})", url, reason, e.toString());
			return FetchResult.failure(OutcomeKind.TRANSIENT_ERROR, 0, elapsedSince(startedAt), reason + ": " + e);
		} finally {
			inFlight.decrementAndGet();
			inFlightPermits.release();
		}
	}

	private FetchResult execute(URI uri, Instant startedAt) throws IOException {
		HttpGet request = new HttpGet(uri);
		request.setHeader(HttpHeaders.ACCEPT, "application/json");

		return httpClient.execute(request, response -> {
			int status = response.getCode();
			HttpEntity entity = response.getEntity();
			String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : null;
			Header retryAfterHeader = response.getFirstHeader(HttpHeaders.RETRY_AFTER);
			Duration retryAfter = retryAfterHeader != null
					? HttpStatusClassifier.parseRetryAfter(retryAfterHeader.getValue(), clock.instant())
					: null;
			Duration latency = elapsedSince(startedAt);

			OutcomeKind kind = HttpStatusClassifier.classify(status, body, retryAfterHeader != null);
			if (kind == OutcomeKind.SUCCESS) {
				return FetchResult.success(body, status, latency);
			}
			String detail = status >= 200 && status < 300 ? "incomplete_body" : "http_" + status;
			return new FetchResult(body, kind, status, latency, retryAfter, detail);
		});
	}

	/** Highest number of fetches observed running at the same time */
	public int maxObservedInFlight() {
		return maxObservedInFlight.get();
	}

	private Duration elapsedSince(Instant startedAt) {
		return Duration.between(startedAt, clock.instant());
	}

	@Override
	public void close() {
		httpClient.close(CloseMode.GRACEFUL);
		connectionManager.close(CloseMode.GRACEFUL);
	}
}
