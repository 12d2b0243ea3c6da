// Part of DataTracker
package com.machinezoo.datatracker.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Diagnostic names for objects. Every object can have an alias, a few tags, and a parent.
 * Tracked values own their listener registry and their modifiers, so a modifier's name includes
 * the name of its tracked value and all tags of the tracked value (for example application-defined "name" tag).
 *
 * Information is kept in a weak-keyed map, so that objects do not need any extra field
 * and the information disappears when the object is collected.
 * Guava's weak-keyed cache compares keys by identity, which is what we need here.
 * WeakHashMap would call equals() and hashCode() on tracked application objects.
 *
 * Tags are used in toString() and in tracing spans.
 */
/**
 * Trace of object ancestors for easier debugging and tracing.
 * <p>
 * Typical use is to give the object an alias and tags:
 *
 * <pre>{@code
 * OwnerTrace.of(tracked).tag("name", "settings");
 * }</pre>
 *
 * @param <T>
 *            type of the object
 */
@StubDocs
@DraftApi("should be in a separate library")
public class OwnerTrace<T> {
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	private static class TraceData {
		volatile String alias;
		/*
		 * Tags are replaced as a whole on every change. Reads never need locking.
		 */
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile TraceData parent;
		TraceData(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	private final T target;
	private final TraceData data;
	private OwnerTrace(T target) {
		Objects.requireNonNull(target);
		this.target = target;
		data = all.getUnchecked(target);
	}
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<>(target);
	}
	public T target() {
		return target;
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Null values are ignored, so that callers don't have to check for null.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data) {
				Map<String, Object> tags = new LinkedHashMap<>(data.tags);
				tags.put(key, value);
				data.tags = Collections.unmodifiableMap(tags);
			}
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		if (parent == null)
			data.parent = null;
		else if (parent instanceof OwnerTrace)
			data.parent = ((OwnerTrace<?>)parent).data;
		else
			data.parent = all.getUnchecked(parent);
		return this;
	}
	/*
	 * Ancestors, root first. Aliases are numbered when they repeat, for example "tracked.tracked2",
	 * so that tags of different ancestors don't collide.
	 */
	private List<Map.Entry<String, TraceData>> namespaces() {
		List<TraceData> chain = new ArrayList<>();
		for (TraceData ancestor = data; ancestor != null; ancestor = ancestor.parent)
			chain.add(ancestor);
		Collections.reverse(chain);
		Object2IntMap<String> seen = new Object2IntOpenHashMap<>();
		List<Map.Entry<String, TraceData>> namespaces = new ArrayList<>();
		for (TraceData ancestor : chain) {
			String alias = ancestor.alias;
			int count = seen.getInt(alias) + 1;
			seen.put(alias, count);
			namespaces.add(new AbstractMap.SimpleImmutableEntry<>(count == 1 ? alias : alias + count, ancestor));
		}
		return namespaces;
	}
	private Map<String, Object> flatten(List<Map.Entry<String, TraceData>> namespaces) {
		Map<String, Object> flat = new TreeMap<>();
		for (Map.Entry<String, TraceData> ns : namespaces)
			for (Map.Entry<String, Object> tag : ns.getValue().tags.entrySet())
				flat.put(ns.getKey() + "." + tag.getKey(), tag.getValue());
		return flat;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, TraceData>> namespaces = namespaces();
		span.setTag("owner", namespaces.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, Object> tag : flatten(namespaces).entrySet()) {
			Object value = tag.getValue();
			if (value instanceof Number)
				span.setTag(tag.getKey(), (Number)value);
			else if (value instanceof Boolean)
				span.setTag(tag.getKey(), (Boolean)value);
			else
				span.setTag(tag.getKey(), value.toString());
		}
		return span;
	}
	@Override
	public String toString() {
		List<Map.Entry<String, TraceData>> namespaces = namespaces();
		return namespaces.stream().map(Map.Entry::getKey).collect(joining(".")) + flatten(namespaces);
	}
}
