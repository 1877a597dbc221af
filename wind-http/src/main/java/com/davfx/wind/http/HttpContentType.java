package com.davfx.wind.http;

import java.nio.charset.Charset;

import com.google.common.base.Charsets;

public final class HttpContentType {

	private HttpContentType() {
	}
	
	private static String withCharset(String mediaType, Charset c) {
		return mediaType + "; " + HttpHeaderKey.CHARSET + "=" + c.name();
	}
	
	public static String plainText(Charset c) {
		return withCharset("text/plain", c);
	}
	public static String json(Charset c) {
		return withCharset("application/json", c);
	}
	public static String json() {
		return json(Charsets.UTF_8);
	}
}
