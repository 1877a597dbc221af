package com.davfx.wind.http.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.davfx.wind.http.ApplicationException;
import com.davfx.wind.http.HttpConnection;
import com.davfx.wind.http.HttpLog;
import com.davfx.wind.http.HttpMethod;
import com.davfx.wind.http.HttpRequest;
import com.davfx.wind.http.Slf4jHttpLog;
import com.google.common.collect.ImmutableSet;

/**
 * Binds a route and its allowed methods to a handler.
 * <p>
 * A path without route is an error path: it is only followed when no route matches, and methods are not checked.
 * Routes are matched exactly, patterns are not supported.
 */
public final class Path {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(Path.class);
	
	public static enum Kind {
		RESOURCE,
		FUNCTION
	}
	
	private final Kind kind;
	private final ResourceFactory factory;
	private final HttpFunction function;
	private final String route;
	private final ImmutableSet<String> methods;
	
	private Path(Kind kind, ResourceFactory factory, HttpFunction function, String route, String[] methods) {
		this.kind = kind;
		this.factory = factory;
		this.function = function;
		this.route = route;
		
		if (route == null) {
			this.methods = ImmutableSet.of();
		} else {
			if (route.isEmpty()) {
				throw new ApplicationException("Empty route");
			}
			if (methods == null) {
				throw new ApplicationException("No allowed method for route '" + route + "'");
			}
			ImmutableSet.Builder<String> b = ImmutableSet.builder();
			for (String m : methods) {
				b.add(HttpMethod.of(m).lowerCase());
			}
			this.methods = b.build();
		}
	}
	
	private static ResourceFactory validate(ResourceFactory factory) {
		if (factory == null) {
			throw new ApplicationException("Request handler registered to app should not be null");
		}
		return factory;
	}
	private static HttpFunction validate(HttpFunction function) {
		if (function == null) {
			throw new ApplicationException("Request handler registered to app should be callable");
		}
		return function;
	}
	
	public static Path of(ResourceFactory factory, String route, String... methods) {
		if (route == null) {
			throw new ApplicationException("Null route");
		}
		return new Path(Kind.RESOURCE, validate(factory), null, route, methods);
	}
	public static Path of(HttpFunction function, String route, String... methods) {
		if (route == null) {
			throw new ApplicationException("Null route");
		}
		return new Path(Kind.FUNCTION, null, validate(function), route, methods);
	}
	
	public static Path error(ResourceFactory factory) {
		return new Path(Kind.RESOURCE, validate(factory), null, null, null);
	}
	public static Path error(HttpFunction function) {
		return new Path(Kind.FUNCTION, null, validate(function), null, null);
	}
	
	public Kind kind() {
		return kind;
	}
	
	// Null for an error path
	public String route() {
		return route;
	}
	
	public ImmutableSet<String> methods() {
		return methods;
	}
	
	public boolean isError() {
		return route == null;
	}
	
	/**
	 * Always {@code false} for an error path, which does not check methods.
	 */
	public boolean allowed(HttpMethod method) {
		return methods.contains(method.lowerCase());
	}
	
	private Resource create(HttpLog log, ResourceDeadline deadline) {
		Resource resource;
		switch (kind) {
		case RESOURCE:
			resource = factory.create();
			if (resource == null) {
				LOGGER.error("Resource factory of {} returned null", this);
				resource = new Resource();
				resource.inject(new HttpFunction() {
					@Override
					public Object apply(HttpRequest request) throws Exception {
						throw new IllegalStateException("No resource created for " + Path.this);
					}
				});
			}
			break;
		case FUNCTION:
			resource = new Resource();
			resource.inject(function);
			break;
		default:
			throw new IllegalStateException("Unknown kind: " + kind);
		}
		resource.bind(this, log, deadline);
		return resource;
	}
	
	/**
	 * Creates the resource handling this request and lets it react.
	 * The path itself is never modified, it may be shared by several applications.
	 */
	public void follow(HttpConnection connection, HttpRequest request, HttpLog log, ResourceDeadline deadline) {
		Resource resource = create(log, deadline);
		LOGGER.trace("Following {} for {}", this, request);
		resource.react(connection, request);
	}
	
	// Logs through slf4j, with the configured deadline
	public void follow(HttpConnection connection, HttpRequest request) {
		follow(connection, request, new Slf4jHttpLog(), new ResourceDeadline());
	}
	
	@Override
	public String toString() {
		if (route == null) {
			return "[error, kind=" + kind + "]";
		}
		return "[route=" + route + ", methods=" + methods + ", kind=" + kind + "]";
	}
}
