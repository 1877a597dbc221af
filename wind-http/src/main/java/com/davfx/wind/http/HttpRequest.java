package com.davfx.wind.http;

import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMultimap;

/**
 * Parsed request, immutable for the whole handling cycle.
 */
public final class HttpRequest {
	
	public final HttpMethod method;
	public final String path;
	public final String url;
	public final ImmutableMultimap<String, String> headers;
	public final String version;
	
	public HttpRequest(HttpMethod method, String path, String url, ImmutableMultimap<String, String> headers, String version) {
		this.method = method;
		this.path = path;
		this.url = url;
		this.headers = headers;
		this.version = version;
	}
	public HttpRequest(HttpMethod method, String url, ImmutableMultimap<String, String> headers) {
		this(method, pathOf(url), url, headers, HttpSpecification.HTTP11);
	}
	public HttpRequest(HttpMethod method, String url) {
		this(method, url, ImmutableMultimap.<String, String>of());
	}
	
	private static String pathOf(String url) {
		int i = url.indexOf('?');
		int j = url.indexOf('#');
		if ((j >= 0) && ((i < 0) || (j < i))) {
			i = j;
		}
		if (i < 0) {
			return url;
		}
		return url.substring(0, i);
	}
	
	// Last one, key is case-insensitive
	public Optional<String> header(String key) {
		String value = null;
		for (Map.Entry<String, String> e : headers.entries()) {
			if (e.getKey().equalsIgnoreCase(key)) {
				value = e.getValue();
			}
		}
		return Optional.fromNullable(value);
	}
	
	public Optional<String> ifNoneMatch() {
		return header(HttpHeaderKey.IF_NONE_MATCH);
	}
	
	/**
	 * Numeric suffix of the version ({@code 1.1} for {@code HTTP/1.1}), {@code NaN} if it cannot be read.
	 */
	public double versionNumber() {
		if (version == null) {
			return Double.NaN;
		}
		int i = version.lastIndexOf(HttpSpecification.VERSION_SEPARATOR);
		try {
			return Double.parseDouble(version.substring(i + 1).trim());
		} catch (NumberFormatException nfe) {
			return Double.NaN;
		}
	}
	
	@Override
	public String toString() {
		return "[method=" + method + ", url=" + url + ", version=" + version + ", headers=" + headers + "]";
	}
}
