package com.davfx.wind.http;

import java.io.IOException;

/**
 * Exactly one of the two methods is called, once.
 */
public interface SendCallback {
	void sent();
	void failed(IOException e);
}
