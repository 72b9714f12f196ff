package dev.titlecrawl.checkpoint;

import java.io.IOException;

/** Raised when the checkpoint cannot be read or durably written */
public class CheckpointException extends IOException {
	public CheckpointException(String message) {
		super(message);
	}

	public CheckpointException(String message, Throwable cause) {
		super(message, cause);
	}
}
