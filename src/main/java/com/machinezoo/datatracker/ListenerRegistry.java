// Part of DataTracker
package com.machinezoo.datatracker;

import java.util.*;
import org.slf4j.*;
import com.google.common.collect.*;
import com.machinezoo.datatracker.util.*;
import com.machinezoo.stagean.*;

/*
 * Listener registry is a thin wrapper around a hash map. It is usually hidden inside TrackedValue,
 * but it is usable on its own, for example when several values should share one set of listeners.
 *
 * Keys are supplied by the caller. We only need equals() and hashCode() from them.
 * Keys serve two purposes: callers can later remove the listener and they can replace it by adding another one under the same key.
 * That's why add() returns the previous listener. Callers can detect replacement without separate lookup.
 *
 * Notification order is hash order, which is effectively random. Callers must not rely on any particular order.
 *
 * Registry is not thread-safe. TrackedValue synchronizes access to it.
 */
/**
 * Keyed collection of {@link ChangeListener}s.
 * Listeners are stored in a hash map, so every key can be associated with at most one listener.
 * <p>
 * {@link ListenerRegistry} is not thread-safe.
 * When embedded in {@link TrackedValue}, access is synchronized by the {@link TrackedValue}.
 *
 * @param <T>
 *            type of the values passed to listeners
 * @param <K>
 *            type of listener keys, which must provide {@link Object#equals(Object)} and {@link Object#hashCode()}
 *
 * @see TrackedValue
 */
@DraftDocs("examples")
public class ListenerRegistry<T, K> {
	private static final Logger logger = LoggerFactory.getLogger(ListenerRegistry.class);
	private final Map<K, ChangeListener<T>> listeners = new HashMap<>();
	/**
	 * Creates new empty registry.
	 */
	public ListenerRegistry() {
		OwnerTrace.of(this).alias("listeners");
	}
	/**
	 * Registers {@code listener} under {@code key}.
	 * If there already is a listener with the same {@code key}, it is replaced.
	 *
	 * @param key
	 *            key identifying the listener
	 * @param listener
	 *            listener to invoke when {@link #fire(Object, Object)} is called
	 * @return previous listener registered under {@code key} or {@code null} if there was none
	 * @throws NullPointerException
	 *             if {@code key} or {@code listener} is {@code null}
	 */
	public ChangeListener<T> add(K key, ChangeListener<T> listener) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(listener);
		ChangeListener<T> previous = listeners.put(key, listener);
		if (previous != null)
			logger.debug("Replaced listener {} in {}.", key, this);
		return previous;
	}
	/**
	 * Unregisters listener with the specified {@code key}.
	 * Removing absent key is not an error. It has no effect.
	 *
	 * @param key
	 *            key identifying the listener
	 * @return listener that was removed or {@code null} if there was no listener under {@code key}
	 * @throws NullPointerException
	 *             if {@code key} is {@code null}
	 */
	public ChangeListener<T> remove(K key) {
		Objects.requireNonNull(key);
		return listeners.remove(key);
	}
	/**
	 * Returns listener registered under {@code key}.
	 *
	 * @param key
	 *            key identifying the listener
	 * @return registered listener or {@code null} if there is none
	 */
	public ChangeListener<T> get(K key) {
		Objects.requireNonNull(key);
		return listeners.get(key);
	}
	/**
	 * Returns keys of all registered listeners.
	 *
	 * @return immutable copy of the key set, iterated in unspecified order
	 */
	public Set<K> keys() {
		return ImmutableSet.copyOf(listeners.keySet());
	}
	public int size() {
		return listeners.size();
	}
	public boolean isEmpty() {
		return listeners.isEmpty();
	}
	/*
	 * Listeners may add or remove listeners while they run. When the registry is used standalone, nothing prevents that.
	 * Iterating the live map would then throw ConcurrentModificationException or worse, skip or repeat listeners.
	 * We therefore iterate over a copy. Changes made during notification take effect in the next round.
	 *
	 * Exceptions are not caught. The first failing listener aborts the round and the exception reaches the caller.
	 */
	/**
	 * Invokes all registered listeners with the supplied values.
	 * Every listener is invoked exactly once in unspecified order.
	 * <p>
	 * Listeners are invoked sequentially on the calling thread.
	 * If a listener throws, the exception propagates out of this method and remaining listeners are not invoked.
	 * Listeners added or removed during notification do not affect the current round.
	 *
	 * @param previous
	 *            value before the change
	 * @param current
	 *            value after the change
	 */
	public void fire(T previous, T current) {
		for (ChangeListener<T> listener : ImmutableList.copyOf(listeners.values()))
			listener.changed(previous, current);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
