package dev.titlecrawl.crawler;

import dev.titlecrawl.checkpoint.CheckpointStore;
import dev.titlecrawl.model.TitleRecord;
import dev.titlecrawl.output.RecordSink;
import dev.titlecrawl.reporting.CrawlProgress;
import dev.titlecrawl.reporting.ProgressEvent;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns out-of-order page completions into in-order commits. Finished pages are buffered until
 * every lower page has been either written or given up on; then their records go to the sink, the
 * sink is flushed and only then the checkpoint advances. Given-up pages are recorded as failures
 * and passed over without a commit of their own.
 *
 * <p>All methods hold the instance lock, which makes this the single writer of both the sink and
 * the checkpoint.
 */
public class CommitSequencer {
	private static final Logger logger = LoggerFactory.getLogger(CommitSequencer.class);

	private record Slot(List<TitleRecord> records, boolean failed) {}

	private final RecordSink sink;
	private final CheckpointStore checkpoint;
	private final CrawlProgress progress;
	private final String runId;

	private final TreeMap<Integer, Slot> buffered = new TreeMap<>();
	private final List<Integer> failedPages = new ArrayList<>();
	private volatile int nextPage;
	private int lastAllowedPage = Integer.MAX_VALUE;
	private int committedPages;
	private int lastCommittedPage;
	private long recordsWritten;

	/**
	 * @param startPage the first page this run will commit
	 */
	public CommitSequencer(
			int startPage, RecordSink sink, CheckpointStore checkpoint, CrawlProgress progress, String runId) {
		this.nextPage = startPage;
		this.lastCommittedPage = startPage - 1;
		this.sink = sink;
		this.checkpoint = checkpoint;
		this.progress = progress;
		this.runId = runId;
	}

	/**
	 * Hand over the records of a finished page. Pages above the cap set by {@link #capAt} are
	 * dropped.
	 *
	 * @throws IOException if writing the sink or the checkpoint failed, the run cannot continue
	 */
	public synchronized void offer(int pageIndex, List<TitleRecord> records) throws IOException {
		if (accept(pageIndex)) {
			buffered.put(pageIndex, new Slot(List.copyOf(records), false));
			drain();
		}
	}

	/** Pass over a page that was given up on */
	public synchronized void skip(int pageIndex) throws IOException {
		if (accept(pageIndex)) {
			buffered.put(pageIndex, new Slot(List.of(), true));
			drain();
		}
	}

	/**
	 * Never commit anything above {@code pageIndex}. Buffered pages above it are discarded. The cap
	 * only ever moves down.
	 */
	public synchronized void capAt(int pageIndex) {
		if (pageIndex >= lastAllowedPage) {
			return;
		}
		lastAllowedPage = pageIndex;
		var dropped = buffered.tailMap(pageIndex, false);
		if (!dropped.isEmpty()) {
			logger.debug("Discarding buffered pages {} above page {}", dropped.keySet(), pageIndex);
			dropped.clear();
		}
	}

	/** Lowest page that has not been written or passed over yet. Does not wait for a commit in progress. */
	public int nextPage() {
		return nextPage;
	}

	public synchronized int lastCommittedPage() {
		return lastCommittedPage;
	}

	public synchronized int committedPages() {
		return committedPages;
	}

	public synchronized long recordsWritten() {
		return recordsWritten;
	}

	public synchronized List<Integer> failedPages() {
		return List.copyOf(failedPages);
	}

	public synchronized int bufferedPages() {
		return buffered.size();
	}

	private boolean accept(int pageIndex) {
		if (pageIndex > lastAllowedPage) {
			logger.debug("Dropping page {} above last allowed page {}", pageIndex, lastAllowedPage);
			return false;
		}
		if (pageIndex < nextPage || buffered.containsKey(pageIndex)) {
			throw new IllegalStateException("Page " + pageIndex + " was already handed over");
		}
		return true;
	}

	private void drain() throws IOException {
		while (!buffered.isEmpty() && buffered.firstKey() == nextPage) {
			Slot slot = buffered.remove(nextPage);
			if (slot.failed()) {
				failedPages.add(nextPage);
				checkpoint.recordFailure(nextPage);
			} else {
				commit(nextPage, slot.records());
			}
			nextPage++;
		}
	}

	private void commit(int pageIndex, List<TitleRecord> records) throws IOException {
		sink.writePage(records);
		sink.flush();
		recordsWritten += records.size();
		checkpoint.recordsWritten(recordsWritten);
		checkpoint.commit(pageIndex);
		committedPages++;
		lastCommittedPage = pageIndex;
		progress.report(ProgressEvent.committed(runId, pageIndex, records.size(), recordsWritten));
	}
}
