package com.davfx.wind.util;

import java.io.File;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

public final class ConfigUtils {
	
	private static final Logger LOGGER = LoggerFactory.getLogger(ConfigUtils.class);
	
	private static final String DEPENDENCIES_PACKAGE_SUFFIX = ".dependencies";
	private static final String EXTENSION = ".conf";
	private static final String DEFAULT_APPLICATION_RESOURCE = "configure";
	
	private ConfigUtils() {
	}
	
	/**
	 * Reads a duration in seconds.
	 */
	public static double getDuration(Config c, String key) {
		return c.getDuration(key, TimeUnit.NANOSECONDS) / 1_000_000_000d;
	}
	
	private static Config parse(Dependencies dependencies, String resource, boolean required) {
		File f = new File(new File("."), resource + EXTENSION);
		if (f.exists()) {
			LOGGER.debug("Config file: {}", f.getAbsolutePath());
			return ConfigFactory.parseFile(f);
		}
		ClassLoader classLoader = dependencies.getClass().getClassLoader();
		if (classLoader.getResource(resource + EXTENSION) == null) {
			if (required) {
				LOGGER.warn("Config file not found: {}", resource);
				throw new ConfigException.Generic("Config file not found: " + resource);
			}
			return ConfigFactory.empty();
		}
		LOGGER.debug("Config resource: {}", resource);
		return ConfigFactory.parseResources(classLoader, resource + EXTENSION);
	}
	
	private static void gatherDependencies(Dependencies dependencies, List<Dependencies> l) {
		for (Dependencies d : dependencies.dependencies()) {
			gatherDependencies(d, l);
		}
		for (Dependencies d : l) {
			if (d.getClass() == dependencies.getClass()) {
				return;
			}
		}
		l.add(dependencies);
	}
	
	private static String packageOf(Dependencies dependencies) {
		String packageName = dependencies.getClass().getPackage().getName();
		if (!packageName.endsWith(DEPENDENCIES_PACKAGE_SUFFIX)) {
			throw new ConfigException.Generic("Must end with '" + DEPENDENCIES_PACKAGE_SUFFIX + "': " + packageName);
		}
		return packageName.substring(0, packageName.length() - DEPENDENCIES_PACKAGE_SUFFIX.length());
	}

	/**
	 * Layers, from lowest to highest priority: the {@code .conf} of every module in the dependency graph (dependencies first),
	 * the given resource if not null, then the optional application {@code configure.conf}.
	 */
	public static synchronized Config load(Dependencies dependencies, String resource) {
		List<Dependencies> l = new LinkedList<>();
		gatherDependencies(dependencies, l);

		Config c = ConfigFactory.empty();
		for (Dependencies d : l) {
			String packageName = packageOf(d);
			LOGGER.trace("Dependency conf: {}", packageName);
			c = parse(d, packageName, true).withFallback(c);
		}
		
		if (resource != null) {
			c = parse(dependencies, resource, true).withFallback(c);
		}

		c = parse(dependencies, DEFAULT_APPLICATION_RESOURCE, false).withFallback(c);

		return c.resolve();
	}

	// Static conf of the package of clazz, overriding is done with configure.conf
	public static synchronized Config load(Dependencies dependencies, Class<?> clazz) {
		return load(dependencies, (String) null).getConfig(clazz.getPackage().getName());
	}
}
