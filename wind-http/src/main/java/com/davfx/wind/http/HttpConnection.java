package com.davfx.wind.http;

import java.nio.ByteBuffer;

/**
 * Transport of one client connection.
 */
public interface HttpConnection {
	/**
	 * Non-blocking, {@code callback} is notified once the bytes are handed off.
	 */
	void write(ByteBuffer buffer, SendCallback callback);
	void close();
}
