package com.davfx.wind.http.app;

import java.util.Iterator;

import com.davfx.wind.http.ApplicationException;
import com.google.common.collect.ImmutableList;

/**
 * Route table, in registration order. The first path whose route equals the looked up one wins.
 */
public final class PathDispatcher implements Iterable<Path> {
	private final ImmutableList<Path> paths;
	
	public PathDispatcher(Iterable<Path> paths) {
		if (paths == null) {
			throw new ApplicationException("PathDispatcher wants an ordered sequence of Path");
		}
		ImmutableList.Builder<Path> b = ImmutableList.builder();
		for (Path p : paths) {
			if (p == null) {
				throw new ApplicationException("PathDispatcher wants an ordered sequence of Path, got a null element");
			}
			if (p.isError()) {
				throw new ApplicationException("Error path cannot be routed: " + p);
			}
			b.add(p);
		}
		this.paths = b.build();
	}
	
	@Override
	public Iterator<Path> iterator() {
		return paths.iterator();
	}
	
	public Path lookup(String url) {
		for (Path p : paths) {
			if (p.route().equals(url)) {
				return p;
			}
		}
		return null;
	}
	
	@Override
	public String toString() {
		return paths.toString();
	}
}
