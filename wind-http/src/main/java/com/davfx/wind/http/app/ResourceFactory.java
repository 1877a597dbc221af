package com.davfx.wind.http.app;

/**
 * Reusable handler type, a new {@link Resource} is created for each request.
 */
public interface ResourceFactory {
	Resource create();
}
