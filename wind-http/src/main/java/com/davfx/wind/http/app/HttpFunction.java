package com.davfx.wind.http.app;

import com.davfx.wind.http.HttpRequest;

/**
 * Plain handler, the returned value is written as the response body (see {@link Resource#write(Object)}).
 */
public interface HttpFunction {
	Object apply(HttpRequest request) throws Exception;
}
