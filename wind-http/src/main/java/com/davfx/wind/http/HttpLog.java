package com.davfx.wind.http;

public interface HttpLog {
	void access(String message);
	void failure(String message, Throwable cause);
}
