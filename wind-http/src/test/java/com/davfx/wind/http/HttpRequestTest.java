package com.davfx.wind.http;

import org.assertj.core.api.Assertions;
import org.junit.Test;

import com.google.common.collect.ImmutableMultimap;

public class HttpRequestTest {
	
	@Test
	public void testPathOfUrl() throws Exception {
		Assertions.assertThat(new HttpRequest(HttpMethod.GET, "/a/b?c=d#e").path).isEqualTo("/a/b");
		Assertions.assertThat(new HttpRequest(HttpMethod.GET, "/a#e?x").path).isEqualTo("/a");
		Assertions.assertThat(new HttpRequest(HttpMethod.GET, "/").path).isEqualTo("/");
	}
	
	@Test
	public void testIfNoneMatchIsCaseInsensitive() throws Exception {
		HttpRequest r = new HttpRequest(HttpMethod.GET, "/", ImmutableMultimap.of("if-NONE-match", "abc"));
		Assertions.assertThat(r.ifNoneMatch().get()).isEqualTo("abc");
		Assertions.assertThat(new HttpRequest(HttpMethod.GET, "/").ifNoneMatch().isPresent()).isFalse();
	}
	
	@Test
	public void testVersionNumber() throws Exception {
		Assertions.assertThat(new HttpRequest(HttpMethod.GET, "/", "/", ImmutableMultimap.<String, String>of(), HttpSpecification.HTTP11).versionNumber()).isEqualTo(1.1d);
		Assertions.assertThat(new HttpRequest(HttpMethod.GET, "/", "/", ImmutableMultimap.<String, String>of(), HttpSpecification.HTTP10).versionNumber()).isEqualTo(1.0d);
		Assertions.assertThat(new HttpRequest(HttpMethod.GET, "/", "/", ImmutableMultimap.<String, String>of(), "HTTP/x").versionNumber()).isNaN();
	}
	
	@Test
	public void testMethodOf() throws Exception {
		Assertions.assertThat(HttpMethod.of("get")).isEqualTo(HttpMethod.GET);
		Assertions.assertThat(HttpMethod.of("Delete")).isEqualTo(HttpMethod.DELETE);
		Assertions.assertThat(HttpMethod.HEAD.lowerCase()).isEqualTo("head");
	}
	
	@Test(expected = ApplicationException.class)
	public void testUnknownMethod() throws Exception {
		HttpMethod.of("options");
	}
}
