package com.davfx.wind.http.app;

import java.nio.ByteBuffer;

import org.assertj.core.api.Assertions;
import org.junit.Test;

import com.google.common.base.Charsets;

public class WriteBufferTest {
	
	private static ByteBuffer bytes(String s) {
		return ByteBuffer.wrap(s.getBytes(Charsets.UTF_8));
	}
	private static String string(ByteBuffer b) {
		byte[] a = new byte[b.remaining()];
		b.duplicate().get(a);
		return new String(a, Charsets.UTF_8);
	}
	
	@Test
	public void testAppendKeepsOrderAndCount() throws Exception {
		WriteBuffer b = new WriteBuffer();
		b.append(bytes("cd"));
		b.appendLeft(bytes("ab"));
		b.append(bytes("ef"));
		b.append(bytes(""));
		Assertions.assertThat(b.size()).isEqualTo(3);
		Assertions.assertThat(b.totalBytes()).isEqualTo(6);
		StringBuilder s = new StringBuilder();
		for (ByteBuffer c : b) {
			s.append(string(c));
		}
		Assertions.assertThat(s.toString()).isEqualTo("abcdef");
	}
	
	@Test
	public void testGatherAll() throws Exception {
		WriteBuffer b = new WriteBuffer();
		b.append(bytes("hello"));
		b.append(bytes(" "));
		b.append(bytes("wind!"));
		b.gather(b.totalBytes());
		Assertions.assertThat(b.size()).isEqualTo(1);
		Assertions.assertThat(b.totalBytes()).isEqualTo(11);
		ByteBuffer c = b.popLeft();
		Assertions.assertThat(string(c)).isEqualTo("hello wind!");
		Assertions.assertThat(b.isEmpty()).isTrue();
		Assertions.assertThat(b.totalBytes()).isEqualTo(0);
	}
	
	@Test
	public void testGatherSplitsChunk() throws Exception {
		WriteBuffer b = new WriteBuffer();
		b.append(bytes("abc"));
		b.append(bytes("def"));
		b.gather(4);
		Assertions.assertThat(b.size()).isEqualTo(2);
		Assertions.assertThat(b.totalBytes()).isEqualTo(6);
		Assertions.assertThat(string(b.popLeft())).isEqualTo("abcd");
		Assertions.assertThat(string(b.popLeft())).isEqualTo("ef");
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void testGatherTooMuch() throws Exception {
		WriteBuffer b = new WriteBuffer();
		b.append(bytes("abc"));
		b.gather(4);
	}
	
	@Test(expected = IllegalStateException.class)
	public void testPopEmpty() throws Exception {
		new WriteBuffer().popLeft();
	}
	
	@Test
	public void testIterationDoesNotConsume() throws Exception {
		WriteBuffer b = new WriteBuffer();
		b.append(bytes("abc"));
		for (ByteBuffer c : b) {
			c.get();
		}
		Assertions.assertThat(b.totalBytes()).isEqualTo(3);
		Assertions.assertThat(string(b.popLeft())).isEqualTo("abc");
	}
	
	@Test
	public void testClear() throws Exception {
		WriteBuffer b = new WriteBuffer();
		b.append(bytes("abc"));
		b.clear();
		Assertions.assertThat(b.isEmpty()).isTrue();
		Assertions.assertThat(b.totalBytes()).isEqualTo(0);
	}
}
