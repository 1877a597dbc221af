package com.davfx.wind.http.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.davfx.wind.http.ApplicationException;
import com.davfx.wind.http.HttpConnection;
import com.davfx.wind.http.HttpException;
import com.davfx.wind.http.HttpLog;
import com.davfx.wind.http.HttpRequest;
import com.davfx.wind.http.Slf4jHttpLog;
import com.google.common.collect.ImmutableList;

/**
 * Web application serving HTTP requests.
 * <pre>
 * WindApp app = WindApp.builder()
 * 	.register(Path.of(new HttpFunction() {
 * 		&#64;Override
 * 		public Object apply(HttpRequest request) {
 * 			return "hello wind!";
 * 		}
 * 	}, "/", "get"))
 * 	.register(Path.of(new ResourceFactory() {
 * 		&#64;Override
 * 		public Resource create() {
 * 			return new HelloResource();
 * 		}
 * 	}, "/resource", "get"))
 * 	.build();
 * </pre>
 * The transport calls {@link #react(HttpConnection, HttpRequest)} for each parsed request.
 */
public final class WindApp {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(WindApp.class);
	
	public static interface Builder {
		Builder register(Path path);
		Builder log(HttpLog log);
		/**
		 * @param timeout seconds an asynchronous resource may take to finish, zero or less to wait forever
		 */
		Builder timeout(double timeout);
		WindApp build();
	}
	
	public static Builder builder() {
		return new Builder() {
			private final ImmutableList.Builder<Path> paths = ImmutableList.builder();
			private HttpLog log = null;
			private ResourceDeadline deadline = null;
			
			@Override
			public Builder register(Path path) {
				if (path == null) {
					throw new ApplicationException("Cannot register a null path");
				}
				paths.add(path);
				return this;
			}
			
			@Override
			public Builder log(HttpLog log) {
				this.log = log;
				return this;
			}
			
			@Override
			public Builder timeout(double timeout) {
				deadline = new ResourceDeadline(timeout);
				return this;
			}
			
			@Override
			public WindApp build() {
				return new WindApp(paths.build(), (log == null) ? new Slf4jHttpLog() : log, (deadline == null) ? new ResourceDeadline() : deadline);
			}
		};
	}
	
	private final PathDispatcher dispatcher;
	private final Path notFound;
	private final HttpLog log;
	private final ResourceDeadline deadline;
	
	private WindApp(Iterable<Path> paths, HttpLog log, ResourceDeadline deadline) {
		dispatcher = new PathDispatcher(paths);
		this.log = log;
		this.deadline = deadline;
		notFound = Path.error(new HttpFunction() {
			@Override
			public Object apply(HttpRequest request) throws Exception {
				throw HttpException.notFound();
			}
		});
		LOGGER.debug("Application created: {}", dispatcher);
	}
	
	public WindApp(Iterable<Path> paths) {
		this(paths, new Slf4jHttpLog(), new ResourceDeadline());
	}
	
	public void react(HttpConnection connection, HttpRequest request) {
		if (request == null) {
			throw new ApplicationException("Can only react to an HttpRequest");
		}
		if (connection == null) {
			throw new ApplicationException("Cannot react without connection");
		}
		
		Path path = dispatcher.lookup(request.path);
		if (path == null) {
			LOGGER.trace("No path registered for {}", request.path);
			path = notFound;
		}
		path.follow(connection, request, log, deadline);
	}
}
