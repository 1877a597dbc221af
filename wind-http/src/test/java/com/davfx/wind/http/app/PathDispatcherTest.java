package com.davfx.wind.http.app;

import java.util.Arrays;

import org.assertj.core.api.Assertions;
import org.junit.Test;

import com.davfx.wind.http.ApplicationException;
import com.davfx.wind.http.HttpRequest;

public class PathDispatcherTest {
	
	private static final HttpFunction HELLO = new HttpFunction() {
		@Override
		public Object apply(HttpRequest request) {
			return "hello";
		}
	};
	
	@Test
	public void testExactLookup() throws Exception {
		Path root = Path.of(HELLO, "/", "get");
		Path a = Path.of(HELLO, "/a", "get", "post");
		PathDispatcher d = new PathDispatcher(Arrays.asList(root, a));
		Assertions.assertThat(d.lookup("/")).isSameAs(root);
		Assertions.assertThat(d.lookup("/a")).isSameAs(a);
		Assertions.assertThat(d.lookup("/a/")).isNull();
		Assertions.assertThat(d.lookup("/b")).isNull();
		Assertions.assertThat(d.lookup("")).isNull();
	}
	
	@Test
	public void testFirstMatchWins() throws Exception {
		Path first = Path.of(HELLO, "/a", "get");
		Path second = Path.of(HELLO, "/a", "post");
		PathDispatcher d = new PathDispatcher(Arrays.asList(first, second));
		Assertions.assertThat(d.lookup("/a")).isSameAs(first);
		Assertions.assertThat(d).containsExactly(first, second);
	}
	
	@Test(expected = ApplicationException.class)
	public void testNullPaths() throws Exception {
		new PathDispatcher(null);
	}
	
	@Test(expected = ApplicationException.class)
	public void testNullElement() throws Exception {
		new PathDispatcher(Arrays.asList(Path.of(HELLO, "/", "get"), null));
	}
	
	@Test(expected = ApplicationException.class)
	public void testErrorPathIsNotRoutable() throws Exception {
		new PathDispatcher(Arrays.asList(Path.error(HELLO)));
	}
}
