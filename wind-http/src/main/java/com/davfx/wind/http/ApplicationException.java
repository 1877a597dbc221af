package com.davfx.wind.http;

/**
 * Configuration error: malformed route table, unsupported method, missing handler.
 * Raised at setup time, never sent to a client.
 */
public final class ApplicationException extends RuntimeException {

	private static final long serialVersionUID = 2384570925843715431L;

	public ApplicationException(String message) {
		super(message);
	}
}
