package dev.titlecrawl.reporting;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central reporting thread that receives progress events from all crawl workers and logs them, so
 * workers never block on log output.
 */
public class ProgressReporter implements CrawlProgress, Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	private static final ProgressEvent POISON_PILL = ProgressEvent.completed("SHUTDOWN", "");

	private final BlockingQueue<ProgressEvent> eventQueue;
	private final AtomicBoolean running;
	private final AtomicInteger committedPages = new AtomicInteger();
	private final AtomicInteger retries = new AtomicInteger();
	private Thread reporterThread;

	public ProgressReporter() {
		this.eventQueue = new LinkedBlockingQueue<>();
		this.running = new AtomicBoolean(false);
	}

	/** Start the reporter thread */
	public void start() {
		if (running.compareAndSet(false, true)) {
			reporterThread = new Thread(this, "ProgressReporter");
			reporterThread.setDaemon(true);
			reporterThread.start();
			logger.debug("Progress reporter started");
		}
	}

	/** Submit a progress event to be processed */
	@Override
	public void report(ProgressEvent event) {
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while submitting event", e);
		}
	}

	@Override
	public void run() {
		while (running.get() || !eventQueue.isEmpty()) {
			try {
				ProgressEvent event = eventQueue.take();

				// Check for shutdown signal
				if (event == POISON_PILL) {
					break;
				}

				processEvent(event);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Reporter thread interrupted");
				break;
			} catch (Exception e) {
				logger.error("Error processing event", e);
			}
		}

		logger.debug("Progress reporter thread stopped");
	}

	void processEvent(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> logger.info("STARTED: run {} - {}", event.runId(), event.message());
			case PAGE_COMMITTED -> {
				committedPages.incrementAndGet();
				logger.info("COMMITTED: page {} - {}", event.page(), event.message());
			}
			case PAGE_RETRY -> {
				retries.incrementAndGet();
				logger.warn("RETRY: page {} - {}", event.page(), event.message());
			}
			case PAGE_FAILED -> logger.error("GAVE UP: page {} - {}", event.page(), event.message());
			case COMPLETED -> logger.info("COMPLETED: run {} - {}", event.runId(), event.message());
			case FAILED -> {
				if (event.error() != null) {
					logger.error("FAILED: run {} - {}", event.runId(), event.message(), event.error());
				} else {
					logger.error("FAILED: run {} - {}", event.runId(), event.message());
				}
			}
		}
	}

	/** Number of page commits seen so far */
	public int getCommittedPages() {
		return committedPages.get();
	}

	/** Number of retry events seen so far */
	public int getRetries() {
		return retries.get();
	}

	/** Shutdown the reporter and wait for all queued events to be processed */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				eventQueue.put(POISON_PILL);
				if (reporterThread != null) {
					reporterThread.join(5000);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down reporter", e);
			}
		}
	}
}
