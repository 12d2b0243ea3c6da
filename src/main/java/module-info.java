// Part of DataTracker
/**
 * DataTracker owns a single value, lets callers read it freely and modify it through a scoped handle,
 * and notifies registered listeners with old and new value whenever a closed handle leaves the value changed.
 * <p>
 * The main package {@link com.machinezoo.datatracker} contains the tracked container, its modifier handle, and listener registry.
 * Package {@link com.machinezoo.datatracker.util} holds diagnostic helpers.
 */
module com.machinezoo.datatracker {
	exports com.machinezoo.datatracker;
	exports com.machinezoo.datatracker.util;
	requires com.machinezoo.stagean;
	/*
	 * TrackedModifier implements CloseableScope, so the dependency leaks into the API.
	 */
	requires transitive com.machinezoo.closeablescope;
	requires org.slf4j;
	requires com.google.common;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
}
