package com.davfx.wind.http.app;

import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedList;

import com.google.common.base.Function;
import com.google.common.collect.Iterators;

/**
 * Ordered chunks of output, to be sent in a single write once {@link #gather(int) gathered}.
 * <p>
 * Chunks are never modified, iteration gives read-only views. Not thread-safe.
 */
public final class WriteBuffer implements Iterable<ByteBuffer> {
	private final Deque<ByteBuffer> buffers = new LinkedList<>();
	private int totalBytes = 0;
	
	public WriteBuffer() {
	}
	
	@Override
	public Iterator<ByteBuffer> iterator() {
		return Iterators.transform(buffers.iterator(), new Function<ByteBuffer, ByteBuffer>() {
			@Override
			public ByteBuffer apply(ByteBuffer input) {
				return input.asReadOnlyBuffer();
			}
		});
	}
	
	public void append(ByteBuffer buffer) {
		if (!buffer.hasRemaining()) {
			return;
		}
		buffers.addLast(buffer);
		totalBytes += buffer.remaining();
	}
	
	public void appendLeft(ByteBuffer buffer) {
		if (!buffer.hasRemaining()) {
			return;
		}
		buffers.addFirst(buffer);
		totalBytes += buffer.remaining();
	}
	
	public int totalBytes() {
		return totalBytes;
	}
	
	// Number of chunks
	public int size() {
		return buffers.size();
	}
	
	public boolean isEmpty() {
		return buffers.isEmpty();
	}
	
	/**
	 * Coalesces the first {@code n} bytes into one chunk placed at the front.
	 * A chunk crossing the boundary is split, its remainder stays right after the gathered chunk.
	 */
	public void gather(int n) {
		if ((n < 0) || (n > totalBytes)) {
			throw new IllegalArgumentException("Cannot gather " + n + " bytes out of " + totalBytes);
		}
		if (n == 0) {
			return;
		}
		if (buffers.peekFirst().remaining() == n) {
			return;
		}
		
		byte[] b = new byte[n];
		int off = 0;
		while (off < n) {
			ByteBuffer chunk = buffers.removeFirst().duplicate();
			int k = Math.min(chunk.remaining(), n - off);
			chunk.get(b, off, k);
			off += k;
			if (chunk.hasRemaining()) {
				buffers.addFirst(chunk.slice());
			}
		}
		buffers.addFirst(ByteBuffer.wrap(b));
	}
	
	/**
	 * @throws IllegalStateException if empty, {@link #gather(int)} must have been called first
	 */
	public ByteBuffer popLeft() {
		ByteBuffer b = buffers.pollFirst();
		if (b == null) {
			throw new IllegalStateException("Empty write buffer");
		}
		totalBytes -= b.remaining();
		return b;
	}
	
	public void clear() {
		buffers.clear();
		totalBytes = 0;
	}
	
	@Override
	public String toString() {
		return "[chunks=" + buffers.size() + ", bytes=" + totalBytes + "]";
	}
}
