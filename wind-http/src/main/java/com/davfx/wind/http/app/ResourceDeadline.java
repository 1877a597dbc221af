package com.davfx.wind.http.app;

import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.davfx.wind.http.HttpSpecification;
import com.davfx.wind.http.dependencies.Dependencies;
import com.davfx.wind.util.ConfigUtils;
import com.typesafe.config.Config;

/**
 * Bounds the time an asynchronous resource may take to finish.
 * All deadlines share one daemon thread.
 */
public final class ResourceDeadline {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(ResourceDeadline.class);
	
	private static final Config CONFIG = ConfigUtils.load(new Dependencies(), HttpSpecification.class);
	private static final double DEFAULT_TIMEOUT = ConfigUtils.getDuration(CONFIG, "resource.timeout");
	
	private static final AtomicInteger NUMBER = new AtomicInteger(0);
	private static final ScheduledExecutorService EXECUTOR = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
		@Override
		public Thread newThread(Runnable r) {
			Thread t = new Thread(r, ResourceDeadline.class.getSimpleName() + "-" + NUMBER.getAndIncrement());
			t.setDaemon(true);
			return t;
		}
	});
	
	private final double timeout;
	
	/**
	 * @param timeout in seconds, zero or less disables the deadline
	 */
	public ResourceDeadline(double timeout) {
		this.timeout = timeout;
	}
	public ResourceDeadline() {
		this(DEFAULT_TIMEOUT);
	}
	
	public double timeout() {
		return timeout;
	}
	
	/**
	 * @return null if disabled, otherwise the future to cancel once the resource is finished
	 */
	public Future<?> arm(final Runnable expired) {
		if (timeout <= 0d) {
			return null;
		}
		return EXECUTOR.schedule(new Runnable() {
			@Override
			public void run() {
				try {
					expired.run();
				} catch (Throwable t) {
					LOGGER.error("Error in deadline task", t);
				}
			}
		}, (long) (timeout * 1000d), TimeUnit.MILLISECONDS);
	}
}
