package com.davfx.wind.http;

public final class HttpMessage {

	public static final String OK = "OK";
	public static final String NO_CONTENT = "No Content";
	public static final String NOT_MODIFIED = "Not Modified";
	public static final String BAD_REQUEST = "Bad Request";
	public static final String FORBIDDEN = "Forbidden";
	public static final String NOT_FOUND = "Not Found";
	public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
	public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
	public static final String UNKNOWN = "Unknown";

	private HttpMessage() {
	}
	
	public static String of(int status) {
		switch (status) {
		case HttpStatus.OK:
			return OK;
		case HttpStatus.NO_CONTENT:
			return NO_CONTENT;
		case HttpStatus.NOT_MODIFIED:
			return NOT_MODIFIED;
		case HttpStatus.BAD_REQUEST:
			return BAD_REQUEST;
		case HttpStatus.FORBIDDEN:
			return FORBIDDEN;
		case HttpStatus.NOT_FOUND:
			return NOT_FOUND;
		case HttpStatus.METHOD_NOT_ALLOWED:
			return METHOD_NOT_ALLOWED;
		case HttpStatus.INTERNAL_SERVER_ERROR:
			return INTERNAL_SERVER_ERROR;
		default:
			return UNKNOWN;
		}
	}
}
