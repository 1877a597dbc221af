package com.davfx.wind.http.app;

import org.assertj.core.api.Assertions;
import org.junit.Test;

public class HttpResponseHeadersTest {
	
	@Test
	public void testInsertionOrder() throws Exception {
		HttpResponseHeaders h = new HttpResponseHeaders();
		h.add("X-B", "b");
		h.add("X-A", "a");
		h.contentLength(11);
		h.add("x-b", "bb");
		Assertions.assertThat(h.toMap().keySet()).containsExactly("X-B", "X-A", "Content-Length");
		Assertions.assertThat(h.get("X-B")).isEqualTo("bb");
		Assertions.assertThat(h.get("content-length")).isEqualTo("11");
	}
	
	@Test
	public void testDerivedSetters() throws Exception {
		HttpResponseHeaders h = new HttpResponseHeaders();
		h.jsonContent().etag("abc");
		Assertions.assertThat(h.get("Content-Type")).isEqualTo("application/json; charset=UTF-8");
		Assertions.assertThat(h.get("ETag")).isEqualTo("abc");
	}
	
	@Test
	public void testRemoveAndClear() throws Exception {
		HttpResponseHeaders h = new HttpResponseHeaders();
		h.add("X-A", "a").add("X-B", "b");
		h.remove("x-a");
		Assertions.assertThat(h.toMap()).containsOnlyKeys("X-B");
		h.clear();
		Assertions.assertThat(h.isEmpty()).isTrue();
	}
}
