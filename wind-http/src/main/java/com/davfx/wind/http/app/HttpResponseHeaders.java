package com.davfx.wind.http.app;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.davfx.wind.http.HttpContentType;
import com.davfx.wind.http.HttpHeaderKey;
import com.google.common.collect.ImmutableMap;

/**
 * Headers of the response being built, in insertion order. Keys are matched case-insensitively.
 */
public final class HttpResponseHeaders {
	private final Map<String, String> headers = new LinkedHashMap<>();
	
	public HttpResponseHeaders() {
	}
	
	private String keyOf(String key) {
		for (String k : headers.keySet()) {
			if (k.equalsIgnoreCase(key)) {
				return k;
			}
		}
		return null;
	}
	
	// Replacing keeps the position of the first insertion
	public HttpResponseHeaders add(String key, String value) {
		String k = keyOf(key);
		headers.put((k == null) ? key : k, value);
		return this;
	}
	
	public HttpResponseHeaders remove(String key) {
		Iterator<String> i = headers.keySet().iterator();
		while (i.hasNext()) {
			if (i.next().equalsIgnoreCase(key)) {
				i.remove();
			}
		}
		return this;
	}
	
	public String get(String key) {
		String k = keyOf(key);
		if (k == null) {
			return null;
		}
		return headers.get(k);
	}
	
	public boolean isEmpty() {
		return headers.isEmpty();
	}
	
	public void clear() {
		headers.clear();
	}
	
	public HttpResponseHeaders contentLength(long contentLength) {
		return add(HttpHeaderKey.CONTENT_LENGTH, String.valueOf(contentLength));
	}
	
	public HttpResponseHeaders jsonContent() {
		return add(HttpHeaderKey.CONTENT_TYPE, HttpContentType.json());
	}
	
	public HttpResponseHeaders etag(String etag) {
		return add(HttpHeaderKey.ETAG, etag);
	}
	
	public ImmutableMap<String, String> toMap() {
		return ImmutableMap.copyOf(headers);
	}
	
	@Override
	public String toString() {
		return headers.toString();
	}
}
