package dev.titlecrawl.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.titlecrawl.model.TitleRecord;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes records as gzip-compressed JSON lines. The gzip stream is opened with sync-flush, so after
 * every {@link #flush()} the file holds a prefix that decompresses to whole lines even if the
 * process dies before {@link #close()} writes the trailer.
 */
public class JsonLinesGzipSink implements RecordSink {
	private static final Logger logger = LoggerFactory.getLogger(JsonLinesGzipSink.class);

	private static final int BUFFER_SIZE = 64 * 1024;
	private static final byte NEWLINE = '\n';

	private final Path path;
	private final ObjectWriter writer;
	private final FileOutputStream fileOut;
	private final GZIPOutputStream gzipOut;

	private long recordsWritten;
	private boolean closed;

	public JsonLinesGzipSink(Path path) throws IOException {
		this(path, new ObjectMapper());
	}

	public JsonLinesGzipSink(Path path, ObjectMapper mapper) throws IOException {
		this.path = path;
		this.writer = mapper.writerFor(TitleRecord.class);
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		this.fileOut = new FileOutputStream(path.toFile());
		this.gzipOut = new GZIPOutputStream(new BufferedOutputStream(fileOut, BUFFER_SIZE), BUFFER_SIZE, true);
		logger.info("Writing records to {}", path.toAbsolutePath());
	}

	@Override
	public synchronized void writePage(List<TitleRecord> records) throws IOException {
		ensureOpen();
		ByteArrayOutputStream page = new ByteArrayOutputStream();
		for (TitleRecord record : records) {
			if (record == null || !record.isValid()) {
				throw new IllegalArgumentException("Refusing to write invalid record: " + record);
			}
			page.write(writer.writeValueAsBytes(record));
			page.write(NEWLINE);
		}
		page.writeTo(gzipOut);
		recordsWritten += records.size();
	}

	@Override
	public synchronized void flush() throws IOException {
		ensureOpen();
		gzipOut.flush();
		fileOut.getFD().sync();
	}

	@Override
	public synchronized long recordsWritten() {
		return recordsWritten;
	}

	@Override
	public Path path() {
		return path;
	}

	@Override
	public synchronized void close() throws IOException {
		if (closed) {
			return;
		}
		closed = true;
		try {
			gzipOut.finish();
			gzipOut.flush();
			fileOut.getFD().sync();
		} finally {
			gzipOut.close();
		}
		logger.info("Closed {} after {} records", path.getFileName(), recordsWritten);
	}

	private void ensureOpen() {
		if (closed) {
			throw new IllegalStateException("Sink is closed: " + path);
		}
	}
}
