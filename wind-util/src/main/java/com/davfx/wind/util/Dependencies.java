package com.davfx.wind.util;

/**
 * Declares the modules a module depends on.
 * <p>
 * Every module ships an implementation named {@code <package>.dependencies.Dependencies} and a
 * {@code <package>.conf} resource; {@link ConfigUtils} walks the graph to layer the configurations.
 */
public interface Dependencies {
	Dependencies[] dependencies();
}
