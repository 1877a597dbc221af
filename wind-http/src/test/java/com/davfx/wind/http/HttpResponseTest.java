package com.davfx.wind.http;

import org.assertj.core.api.Assertions;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultimap;

public class HttpResponseTest {
	
	@Test
	public void testRaw() throws Exception {
		HttpRequest request = new HttpRequest(HttpMethod.GET, "/", "/", ImmutableMultimap.<String, String>of(), HttpSpecification.HTTP10);
		HttpResponse response = new HttpResponse(request, HttpStatus.NOT_FOUND, ImmutableMap.of("Content-Length", "3", "Connection", "close"));
		Assertions.assertThat(response.raw()).isEqualTo("HTTP/1.0 404 Not Found\r\nContent-Length: 3\r\nConnection: close\r\n\r\n");
	}
	
	@Test
	public void testRawWithoutRequest() throws Exception {
		HttpResponse response = new HttpResponse(null, 299, ImmutableMap.<String, String>of());
		Assertions.assertThat(response.raw()).isEqualTo("HTTP/1.1 299 Unknown\r\n\r\n");
	}
}
