package com.davfx.wind.http;

public interface HttpHeaderValue {
	String CLOSE = "close";
}
