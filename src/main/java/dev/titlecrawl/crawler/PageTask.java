package dev.titlecrawl.crawler;

/**
 * Scheduler-side state of one listing page. Instances are confined to the scheduler lock; workers
 * only ever see the immutable {@link Request} handed out on dispatch.
 */
public final class PageTask {

	public enum Status {
		PENDING,
		IN_FLIGHT,
		DONE,
		FAILED
	}

	/**
	 * Snapshot given to a worker.
	 *
	 * @param pageIndex 1-based page index
	 * @param url the URL to fetch
	 * @param attempt 1-based number of this attempt
	 */
	public record Request(int pageIndex, String url, int attempt) {}

	private final int pageIndex;
	private final String url;
	private int attemptCount;
	private Status status = Status.PENDING;

	public PageTask(int pageIndex, String url) {
		if (pageIndex < 1) {
			throw new IllegalArgumentException("Page index must be 1 or more: " + pageIndex);
		}
		this.pageIndex = pageIndex;
		this.url = url;
	}

	public Request dispatch() {
		expect(Status.PENDING);
		attemptCount++;
		status = Status.IN_FLIGHT;
		return new Request(pageIndex, url, attemptCount);
	}

	/** Put the page back in line after a retryable failure */
	public void retry() {
		expect(Status.IN_FLIGHT);
		status = Status.PENDING;
	}

	public void complete() {
		expect(Status.IN_FLIGHT);
		status = Status.DONE;
	}

	public void fail() {
		expect(Status.IN_FLIGHT);
		status = Status.FAILED;
	}

	public boolean isTerminal() {
		return status == Status.DONE || status == Status.FAILED;
	}

	public int pageIndex() {
		return pageIndex;
	}

	public String url() {
		return url;
	}

	public int attemptCount() {
		return attemptCount;
	}

	public Status status() {
		return status;
	}

	private void expect(Status expected) {
		if (status != expected) {
			throw new IllegalStateException(
					"Page " + pageIndex + " is " + status + ", expected " + expected);
		}
	}

	@Override
	public String toString() {
		return "PageTask[page=%d, status=%s, attempts=%d]".formatted(pageIndex, status, attemptCount);
	}
}
