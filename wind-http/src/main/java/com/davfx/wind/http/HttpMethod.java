package com.davfx.wind.http;

import java.util.Locale;

public enum HttpMethod {
	GET("GET"),
	POST("POST"),
	PUT("PUT"),
	DELETE("DELETE"),
	HEAD("HEAD");

	private final String out;

	private HttpMethod(String out) {
		this.out = out;
	}
	
	/**
	 * Lower-case name, the form used when declaring the methods a route allows.
	 */
	public String lowerCase() {
		return out.toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return out;
	}
	
	/**
	 * Case-insensitive lookup.
	 * @throws ApplicationException if {@code method} is not a supported method
	 */
	public static HttpMethod of(String method) {
		if (method != null) {
			for (HttpMethod m : values()) {
				if (m.out.equalsIgnoreCase(method)) {
					return m;
				}
			}
		}
		throw new ApplicationException("Unsupported HTTP method '" + method + "'");
	}
}
