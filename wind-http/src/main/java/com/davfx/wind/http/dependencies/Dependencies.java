package com.davfx.wind.http.dependencies;

public final class Dependencies implements com.davfx.wind.util.Dependencies {
	@Override
	public com.davfx.wind.util.Dependencies[] dependencies() {
		return new com.davfx.wind.util.Dependencies[] {
			new com.davfx.wind.util.dependencies.Dependencies()
		};
	}
}
