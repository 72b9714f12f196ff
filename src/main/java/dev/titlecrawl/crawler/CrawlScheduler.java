package dev.titlecrawl.crawler;

import dev.titlecrawl.backoff.BackoffController;
import dev.titlecrawl.backoff.Sleeper;
import dev.titlecrawl.checkpoint.CheckpointException;
import dev.titlecrawl.checkpoint.CheckpointStore;
import dev.titlecrawl.http.FetchClient;
import dev.titlecrawl.http.FetchResult;
import dev.titlecrawl.model.Checkpoint;
import dev.titlecrawl.model.OutcomeKind;
import dev.titlecrawl.output.RecordSink;
import dev.titlecrawl.parser.PageContext;
import dev.titlecrawl.parser.PageParseException;
import dev.titlecrawl.parser.PageParser;
import dev.titlecrawl.parser.ParsedPage;
import dev.titlecrawl.reporting.CrawlProgress;
import dev.titlecrawl.reporting.ProgressEvent;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a crawl: hands out pages to a fixed pool of workers, retries what can be retried and
 * decides when the run is over.
 *
 * <p>Pages are dispatched lowest first, retries ahead of new pages. New pages are generated only
 * while they are within {@link CrawlConfig#dispatchWindow()} of the lowest uncommitted page. The
 * run ends when the source reported its last page and every page up to it is done or failed, when
 * {@link CrawlConfig#maxPages()} is reached, when a page fails fatally, or on {@link #cancel()}.
 *
 * <p>Task bookkeeping is guarded by a single lock. Sink and checkpoint writes happen inside the
 * {@link CommitSequencer} and never under that lock.
 */
public class CrawlScheduler {
	private static final Logger logger = LoggerFactory.getLogger(CrawlScheduler.class);

	private static final long POLL_MILLIS = 50;
	private static final Duration FORCED_STOP_WAIT = Duration.ofSeconds(5);

	private final CrawlConfig config;
	private final PageUrlBuilder urls;
	private final FetchClient fetchClient;
	private final PageParser parser;
	private final BackoffController backoff;
	private final Sleeper sleeper;
	private final CheckpointStore checkpoint;
	private final RecordSink sink;
	private final CrawlProgress progress;
	private final Clock clock;

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition changed = lock.newCondition();
	private final AtomicBoolean started = new AtomicBoolean();
	private final CountDownLatch done = new CountDownLatch(1);

	// guarded by lock
	private final Map<Integer, PageTask> tasks = new HashMap<>();
	private final TreeSet<Integer> retryQueue = new TreeSet<>();
	private int nextNewPage;
	private int endPage = Integer.MAX_VALUE;
	private int inFlight;
	private int pagesAttempted;
	private int retries;
	private int skippedItems;
	private int abandoned;
	private int fatalPage = Integer.MAX_VALUE;
	private String fatalError;
	private boolean cancelled;
	private long cancelDeadlineNanos;

	private String runId;
	private CommitSequencer sequencer;

	public CrawlScheduler(
			CrawlConfig config,
			FetchClient fetchClient,
			PageParser parser,
			BackoffController backoff,
			Sleeper sleeper,
			CheckpointStore checkpoint,
			RecordSink sink,
			CrawlProgress progress,
			Clock clock) {
		this.config = config;
		this.urls = new PageUrlBuilder(config.baseUrl(), config.perPage());
		this.fetchClient = fetchClient;
		this.parser = parser;
		this.backoff = backoff;
		this.sleeper = sleeper;
		this.checkpoint = checkpoint;
		this.sink = sink;
		this.progress = progress;
		this.clock = clock;
	}

	/**
	 * Run the crawl to completion. May only be called once.
	 *
	 * @param runId identifier stamped into the checkpoint
	 * @return the outcome, including partial counts for failed or cancelled runs
	 * @throws CheckpointException if the stored checkpoint cannot be read or the run cannot be
	 *     registered in it
	 */
	public CrawlResult run(String runId) throws CheckpointException {
		if (!started.compareAndSet(false, true)) {
			throw new IllegalStateException("A scheduler can only run once");
		}
		try {
			return doRun(runId);
		} finally {
			done.countDown();
		}
	}

	private CrawlResult doRun(String runId) throws CheckpointException {
		this.runId = runId;
		Instant startedAt = clock.instant();

		int startPage;
		Integer plannedTotal = null;
		if (config.resume()) {
			startPage = checkpoint.load() + 1;
			plannedTotal = checkpoint.current().map(Checkpoint::totalPagesPlanned).orElse(null);
			if (startPage > 1) {
				logger.info("Resuming after committed page {}", startPage - 1);
			}
		} else {
			checkpoint.reset();
			startPage = 1;
		}

		int lastPage = Math.min(config.lastPage(), plannedTotal != null ? plannedTotal : Integer.MAX_VALUE);
		if (startPage > lastPage) {
			logger.info("Nothing to crawl: page {} is past the last page {}", startPage, lastPage);
			return CrawlResult.nothingToDo(startPage);
		}

		checkpoint.beginRun(runId, startedAt.toString());
		sequencer = new CommitSequencer(startPage, sink, checkpoint, progress, runId);
		lock.lock();
		try {
			nextNewPage = startPage;
			if (plannedTotal != null) {
				endPage = plannedTotal;
				sequencer.capAt(plannedTotal);
			}
		} finally {
			lock.unlock();
		}

		logger.info(
				"Crawling from page {} with {} worker(s), {} per page, max pages {}",
				startPage,
				config.workerCount(),
				config.perPage(),
				config.isUnlimited() ? "unlimited" : config.maxPages());
		progress.report(ProgressEvent.started(runId, startPage));

		ExecutorService executor = Executors.newFixedThreadPool(config.workerCount(), workerThreads());
		for (int i = 0; i < config.workerCount(); i++) {
			executor.execute(this::workerLoop);
		}
		executor.shutdown();
		awaitWorkers(executor);

		CrawlResult result = buildResult(startPage, Duration.between(startedAt, clock.instant()));
		if (result.status() == CrawlResult.Status.FATAL) {
			progress.report(ProgressEvent.failed(runId, result.error(), null));
		} else {
			progress.report(ProgressEvent.completed(runId, result.toString()));
		}
		return result;
	}

	/**
	 * Stop dispatching pages. Pages in flight get the configured grace period to finish, after that
	 * their workers are interrupted and the pages abandoned. Safe to call from any thread, including
	 * a shutdown hook.
	 */
	public void cancel() {
		lock.lock();
		try {
			if (!cancelled) {
				cancelled = true;
				cancelDeadlineNanos = System.nanoTime() + config.shutdownGrace().toNanos();
				logger.warn(
						"Cancellation requested, waiting up to {}s for {} page(s) in flight",
						config.shutdownGrace().toSeconds(),
						inFlight);
				changed.signalAll();
			}
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Wait for a running crawl to return.
	 *
	 * @return false if the timeout elapsed first
	 */
	public boolean awaitCompletion(Duration timeout) throws InterruptedException {
		return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	private void workerLoop() {
		try {
			PageTask.Request request;
			while ((request = nextRequest()) != null) {
				process(request);
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.debug("Worker interrupted");
		}
	}

	/** Blocks until there is a page to work on; null means the worker should stop */
	private PageTask.Request nextRequest() throws InterruptedException {
		lock.lock();
		try {
			while (true) {
				if (fatalError != null || cancelled) {
					return null;
				}

				Integer retry = retryQueue.pollFirst();
				while (retry != null && retry > endPage) {
					tasks.remove(retry);
					retry = retryQueue.pollFirst();
				}
				if (retry != null) {
					inFlight++;
					return tasks.get(retry).dispatch();
				}

				int limit = Math.min(endPage, config.lastPage());
				if (nextNewPage <= limit) {
					if (nextNewPage < sequencer.nextPage() + config.dispatchWindow()) {
						PageTask task = new PageTask(nextNewPage, urls.urlFor(nextNewPage));
						tasks.put(nextNewPage, task);
						nextNewPage++;
						pagesAttempted++;
						inFlight++;
						return task.dispatch();
					}
				} else if (inFlight == 0) {
					changed.signalAll();
					return null;
				}
				changed.await();
			}
		} finally {
			lock.unlock();
		}
	}

	private void process(PageTask.Request request) throws InterruptedException {
		try {
			attempt(request);
		} catch (InterruptedException e) {
			abandon(request);
			throw e;
		} catch (RuntimeException e) {
			logger.error("Unexpected error on page {}", request.pageIndex(), e);
			fatal(request, "Page " + request.pageIndex() + ": unexpected error: " + e, request.pageIndex() - 1);
		}
	}

	private void attempt(PageTask.Request request) throws InterruptedException {
		sleeper.sleep(backoff.nextDelay());

		Instant scrapedAt = clock.instant();
		FetchResult fetched = fetchClient.fetch(request.url());
		// a fetch that ran past the grace period must not reach the sink
		if (Thread.currentThread().isInterrupted()) {
			throw new InterruptedException("Page " + request.pageIndex() + " fetched after workers were stopped");
		}
		OutcomeKind kind = fetched.kind();
		String detail = fetched.detail();
		ParsedPage page = null;
		if (fetched.isSuccess()) {
			try {
				page = parser.parse(fetched.payload(), new PageContext(request.pageIndex(), request.url(), scrapedAt));
			} catch (PageParseException e) {
				kind = OutcomeKind.PARSE_ERROR;
				detail = e.getMessage();
			}
		}
		backoff.recordOutcome(kind, fetched.latency(), fetched.retryAfter());

		if (kind == OutcomeKind.SUCCESS) {
			succeeded(request, page);
		} else if (kind.isRetryable()) {
			failed(request, kind, detail);
		} else {
			rejected(request, detail);
		}
	}

	private void succeeded(PageTask.Request request, ParsedPage page) {
		int pageIndex = request.pageIndex();
		boolean lastPage = false;
		boolean discard;
		lock.lock();
		try {
			if (!page.hasMorePages() && pageIndex < endPage) {
				endPage = pageIndex;
				lastPage = true;
			}
			discard = pageIndex > endPage;
			skippedItems += page.skippedItems();
		} finally {
			lock.unlock();
		}

		try {
			if (lastPage) {
				logger.info("Source reports no pages after page {}", pageIndex);
				sequencer.capAt(pageIndex);
				checkpoint.planTotal(pageIndex);
			}
			if (discard) {
				logger.debug("Discarding page {} past the last page", pageIndex);
			} else {
				sequencer.offer(pageIndex, page.records());
			}
		} catch (IOException e) {
			logger.error("Failed to commit page {}", pageIndex, e);
			fatal(request, "Page " + pageIndex + ": commit failed: " + e.getMessage(), sequencer.lastCommittedPage());
			return;
		}

		lock.lock();
		try {
			PageTask task = tasks.remove(pageIndex);
			task.complete();
			inFlight--;
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}

	private void failed(PageTask.Request request, OutcomeKind kind, String detail) {
		int pageIndex = request.pageIndex();
		boolean giveUp;
		lock.lock();
		try {
			PageTask task = tasks.get(pageIndex);
			if (pageIndex > endPage) {
				task.fail();
				tasks.remove(pageIndex);
				inFlight--;
				changed.signalAll();
				return;
			}
			giveUp = request.attempt() >= config.maxAttempts();
			if (giveUp) {
				task.fail();
			} else {
				task.retry();
				retryQueue.add(pageIndex);
				retries++;
				inFlight--;
				changed.signalAll();
			}
		} finally {
			lock.unlock();
		}

		String reason = kind + (detail != null ? " (" + detail + ")" : "");
		if (!giveUp) {
			logger.debug("Page {} attempt {} failed: {}", pageIndex, request.attempt(), reason);
			progress.report(ProgressEvent.retry(runId, pageIndex, request.attempt(), reason));
			return;
		}

		logger.warn("Giving up on page {} after {} attempts: {}", pageIndex, request.attempt(), reason);
		progress.report(ProgressEvent.pageFailed(runId, pageIndex, reason));
		try {
			sequencer.skip(pageIndex);
		} catch (IOException e) {
			logger.error("Failed to record failed page {}", pageIndex, e);
			markFatal(pageIndex, "Page " + pageIndex + ": checkpoint update failed: " + e.getMessage());
			sequencer.capAt(sequencer.lastCommittedPage());
		}

		lock.lock();
		try {
			tasks.remove(pageIndex);
			inFlight--;
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}

	private void rejected(PageTask.Request request, String detail) {
		int pageIndex = request.pageIndex();
		lock.lock();
		try {
			if (pageIndex > endPage) {
				logger.debug("Ignoring fatal outcome of page {} past the last page: {}", pageIndex, detail);
				release(pageIndex);
				return;
			}
		} finally {
			lock.unlock();
		}
		fatal(request, "Page " + pageIndex + ": " + detail, pageIndex - 1);
	}

	/**
	 * End the run because of {@code request}. Nothing above {@code lastCommittable} will be
	 * committed.
	 */
	private void fatal(PageTask.Request request, String message, int lastCommittable) {
		markFatal(request.pageIndex(), message);
		sequencer.capAt(lastCommittable);
		logger.error("Stopping crawl: {}", message);

		lock.lock();
		try {
			release(request.pageIndex());
		} finally {
			lock.unlock();
		}
	}

	private void markFatal(int pageIndex, String message) {
		lock.lock();
		try {
			if (fatalError == null || pageIndex < fatalPage) {
				fatalError = message;
				fatalPage = pageIndex;
			}
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}

	private void abandon(PageTask.Request request) {
		lock.lock();
		try {
			abandoned++;
			inFlight--;
			changed.signalAll();
		} finally {
			lock.unlock();
		}
		logger.warn("Abandoned page {} (attempt {})", request.pageIndex(), request.attempt());
	}

	// caller holds the lock
	private void release(int pageIndex) {
		PageTask task = tasks.remove(pageIndex);
		if (task != null && task.status() == PageTask.Status.IN_FLIGHT) {
			task.fail();
		}
		inFlight--;
		changed.signalAll();
	}

	private void awaitWorkers(ExecutorService executor) {
		try {
			while (!executor.awaitTermination(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
				if (graceExpired()) {
					logger.warn("Grace period over, interrupting remaining workers");
					executor.shutdownNow();
					if (!executor.awaitTermination(FORCED_STOP_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
						logger.warn("Some workers did not stop within {}s", FORCED_STOP_WAIT.toSeconds());
					}
					return;
				}
			}
		} catch (InterruptedException e) {
			cancel();
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	private boolean graceExpired() {
		lock.lock();
		try {
			return cancelled && System.nanoTime() - cancelDeadlineNanos >= 0;
		} finally {
			lock.unlock();
		}
	}

	private CrawlResult buildResult(int startPage, Duration duration) {
		lock.lock();
		try {
			var failedPages = sequencer.failedPages();
			CrawlResult.Status status;
			if (fatalError != null) {
				status = CrawlResult.Status.FATAL;
			} else if (cancelled) {
				status = CrawlResult.Status.CANCELLED;
			} else if (!failedPages.isEmpty()) {
				status = CrawlResult.Status.COMPLETED_WITH_FAILURES;
			} else {
				status = CrawlResult.Status.COMPLETED;
			}
			if (abandoned > 0) {
				logger.warn("{} page(s) were abandoned and will be fetched again on resume", abandoned);
			}
			return new CrawlResult(
					status,
					startPage,
					pagesAttempted,
					sequencer.committedPages(),
					sequencer.lastCommittedPage(),
					failedPages,
					sequencer.recordsWritten(),
					skippedItems,
					retries,
					duration,
					fatalError);
		} finally {
			lock.unlock();
		}
	}

	private static ThreadFactory workerThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "crawl-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
