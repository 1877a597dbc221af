package com.davfx.wind.http;

public interface HttpHeaderKey {
	String CONTENT_LENGTH = "Content-Length";
	String CONTENT_TYPE = "Content-Type";
	String CONNECTION = "Connection";
	String ETAG = "ETag";
	String IF_NONE_MATCH = "If-None-Match";

	String CHARSET = "charset";
}
