package dev.titlecrawl.parser;

/** Raised when a payload cannot be read as a listing page */
public class PageParseException extends Exception {
	public PageParseException(String message) {
		super(message);
	}

	public PageParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
