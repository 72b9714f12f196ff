package dev.titlecrawl.output;

import dev.titlecrawl.model.TitleRecord;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/** Append-only destination for records */
public interface RecordSink extends Closeable {

	/**
	 * Append the records of one page as a unit. Either every record is handed to the underlying
	 * stream or none is.
	 *
	 * @throws IllegalArgumentException if any record is not valid
	 * @throws IllegalStateException if the sink is closed
	 */
	void writePage(List<TitleRecord> records) throws IOException;

	/** Append one record, see {@link #writePage} */
	default void write(TitleRecord record) throws IOException {
		writePage(Collections.singletonList(record));
	}

	/** Make everything written so far durable and readable */
	void flush() throws IOException;

	/** Number of records written since the sink was opened */
	long recordsWritten();

	/** Location of the artifact being written */
	Path path();
}
