package com.davfx.wind.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.davfx.wind.http.dependencies.Dependencies;
import com.davfx.wind.util.ConfigUtils;
import com.typesafe.config.Config;

public final class Slf4jHttpLog implements HttpLog {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(Slf4jHttpLog.class);
	
	private static final Config CONFIG = ConfigUtils.load(new Dependencies(), Slf4jHttpLog.class);
	private static final String ACCESS_LOGGER = CONFIG.getString("access.logger");
	
	private final Logger access;
	
	public Slf4jHttpLog(Logger access) {
		this.access = access;
	}
	public Slf4jHttpLog() {
		this(LoggerFactory.getLogger(ACCESS_LOGGER));
	}
	
	@Override
	public void access(String message) {
		access.info(message);
	}
	
	@Override
	public void failure(String message, Throwable cause) {
		LOGGER.error(message, cause);
	}
}
