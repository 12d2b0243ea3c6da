// Part of DataTracker
package com.machinezoo.datatracker;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.datatracker.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/**
 * Container that owns single value and notifies {@link ChangeListener}s when the value changes.
 * <p>
 * The value can be read via {@link #get()}. Changes are made by opening {@link TrackedModifier} via {@link #modify()},
 * changing the value through the modifier, and closing the modifier, preferably in try-with-resources:
 *
 * <pre>{@code
 * try (TrackedModifier<Settings> modifier = tracked.modify()) {
 *     modifier.get().volume = 10;
 * }
 * }</pre>
 *
 * When the modifier is closed, the value is compared to a snapshot taken when the modifier was opened.
 * If they differ, all registered listeners are invoked with the snapshot and the current value.
 * Any number of writes can be made through one modifier. Listeners are notified at most once per modifier.
 * <p>
 * Only one {@link TrackedModifier} can be open at a time. While it is open, the {@link TrackedValue} is busy
 * and all other access to it (reads, opening another modifier, listener registration) fails with {@link IllegalStateException}.
 * This holds for all threads. Access is not blocked and waiting. It is rejected immediately.
 * <p>
 * Mutable values need a copier, which is passed to {@link #TrackedValue(Object, UnaryOperator)}.
 * Immutable values can use {@link #TrackedValue(Object)} and they are then changed via {@link TrackedModifier#set(Object)}.
 * Values may be {@code null}. Values are compared using {@link Objects#equals(Object, Object)}.
 *
 * @param <T>
 *            type of the tracked value
 * @param <K>
 *            type of listener keys
 *
 * @see TrackedModifier
 * @see ChangeListener
 */
public class TrackedValue<T, K> {
	private static final Logger logger = LoggerFactory.getLogger(TrackedValue.class);
	private static final Counter changeCount = Metrics.counter("datatracker.changes");
	private static final Timer notificationTimer = Metrics.timer("datatracker.notifications");
	/*
	 * Java has no universal clone operation. Callers supply one.
	 * The copier must return an object that is not affected by subsequent changes to the original.
	 * For immutable values, identity function is sufficient.
	 */
	private final UnaryOperator<T> copier;
	/*
	 * The value is volatile, so that writes made through modifier in one thread are visible to the thread that closes it
	 * and reads after the modifier is closed see the latest value.
	 */
	private volatile T value;
	private final ListenerRegistry<T, K> listeners;
	/*
	 * Non-null while the value is being modified. Guarded by this.
	 */
	private TrackedModifier<T> modifier;
	/**
	 * Creates new {@link TrackedValue} holding mutable {@code value}.
	 * Function {@code copier} is used to take a snapshot of the value every time {@link TrackedModifier} is opened.
	 * It is never called with {@code null} value.
	 *
	 * @param value
	 *            initial value, possibly {@code null}
	 * @param copier
	 *            function that returns independent copy of its parameter that compares equal to the parameter
	 * @throws NullPointerException
	 *             if {@code copier} is {@code null}
	 */
	public TrackedValue(T value, UnaryOperator<T> copier) {
		Objects.requireNonNull(copier);
		this.value = value;
		this.copier = copier;
		OwnerTrace.of(this).alias("tracked");
		listeners = OwnerTrace.of(new ListenerRegistry<T, K>())
			.parent(this)
			.target();
	}
	/**
	 * Creates new {@link TrackedValue} holding immutable {@code value}.
	 * Snapshots share the instance with the live value,
	 * so the value must not be changed in place. It should be replaced via {@link TrackedModifier#set(Object)}.
	 *
	 * @param value
	 *            initial value, possibly {@code null}
	 */
	public TrackedValue(T value) {
		this(value, UnaryOperator.identity());
	}
	private void ensureIdle() {
		if (modifier != null)
			throw new IllegalStateException("Value is being modified.");
	}
	/**
	 * Returns current value.
	 * The returned object must not be changed in place. Use {@link #modify()} to make changes.
	 *
	 * @return current value, possibly {@code null}
	 * @throws IllegalStateException
	 *             if {@link TrackedModifier} is open
	 */
	public synchronized T get() {
		ensureIdle();
		return value;
	}
	/*
	 * Version counting is borrowed from reactive variables. It is handy in tests and when polling for changes.
	 * Version is only incremented by the owner of the open modifier, so the volatile increment is not racy.
	 */
	private volatile long version = 1;
	/**
	 * Returns number that is incremented every time a change is detected. Initial version is 1.
	 * Version is incremented even if there are no listeners.
	 * Closing {@link TrackedModifier} without changing the value does not change the version.
	 * This method can be called while {@link TrackedModifier} is open.
	 *
	 * @return current version of the value
	 */
	public long version() {
		return version;
	}
	/**
	 * Registers {@code listener} to be notified about changes.
	 * If there already is a listener with the same {@code key}, it is replaced.
	 *
	 * @param key
	 *            key under which the listener is registered
	 * @param listener
	 *            listener to invoke when change is detected
	 * @return previously registered listener or {@code null} if there was none
	 * @throws NullPointerException
	 *             if {@code key} or {@code listener} is {@code null}
	 * @throws IllegalStateException
	 *             if {@link TrackedModifier} is open
	 *
	 * @see ListenerRegistry#add(Object, ChangeListener)
	 */
	public synchronized ChangeListener<T> addListener(K key, ChangeListener<T> listener) {
		ensureIdle();
		return listeners.add(key, listener);
	}
	/**
	 * Unregisters listener with the specified {@code key}.
	 *
	 * @param key
	 *            key under which the listener was registered
	 * @return removed listener or {@code null} if there was no listener with the key
	 * @throws NullPointerException
	 *             if {@code key} is {@code null}
	 * @throws IllegalStateException
	 *             if {@link TrackedModifier} is open
	 *
	 * @see ListenerRegistry#remove(Object)
	 */
	public synchronized ChangeListener<T> removeListener(K key) {
		ensureIdle();
		return listeners.remove(key);
	}
	/**
	 * Opens {@link TrackedModifier} that can be used to change the value.
	 * Snapshot of the value is taken immediately.
	 * The returned modifier must be closed, preferably via try-with-resources.
	 * This {@link TrackedValue} is inaccessible until then.
	 *
	 * @return new {@link TrackedModifier} for this value
	 * @throws IllegalStateException
	 *             if another {@link TrackedModifier} is already open
	 */
	public synchronized TrackedModifier<T> modify() {
		if (modifier != null)
			throw new IllegalStateException("Cannot open second modifier while the first one is still open.");
		/*
		 * If the copier throws, no modifier is created and the value remains idle.
		 */
		T snapshot = value != null ? copier.apply(value) : null;
		modifier = OwnerTrace.of(new TrackedModifier<T>(this, snapshot))
			.parent(this)
			.target();
		return modifier;
	}
	/**
	 * Changes the value in place. The {@code mutation} receives the live value.
	 * This is a shorthand for opening {@link TrackedModifier}, passing {@link TrackedModifier#get()} to {@code mutation},
	 * and closing the modifier, which notifies listeners if the value has changed.
	 * The modifier is closed even if the {@code mutation} throws.
	 *
	 * @param mutation
	 *            code that changes the value in place
	 * @throws NullPointerException
	 *             if {@code mutation} is {@code null}
	 * @throws IllegalStateException
	 *             if {@link TrackedModifier} is already open
	 */
	public void modify(Consumer<? super T> mutation) {
		Objects.requireNonNull(mutation);
		try (TrackedModifier<T> modifier = modify()) {
			mutation.accept(modifier.get());
		}
	}
	/**
	 * Replaces the value with the result of {@code function}.
	 * This is a shorthand for {@link #modify()} followed by {@link TrackedModifier#set(Object)} and closing the modifier.
	 *
	 * @param function
	 *            function that computes new value from the current value
	 * @throws NullPointerException
	 *             if {@code function} is {@code null}
	 * @throws IllegalStateException
	 *             if {@link TrackedModifier} is already open
	 */
	public void update(UnaryOperator<T> function) {
		Objects.requireNonNull(function);
		try (TrackedModifier<T> modifier = modify()) {
			modifier.set(function.apply(modifier.get()));
		}
	}
	/**
	 * Replaces the value. Listeners are notified if the new value is not equal to the current value.
	 *
	 * @param value
	 *            new value, possibly {@code null}
	 * @throws IllegalStateException
	 *             if {@link TrackedModifier} is already open
	 */
	public void set(T value) {
		try (TrackedModifier<T> modifier = modify()) {
			modifier.set(value);
		}
	}
	/*
	 * Access to the live value for the open modifier. The modifier checks that it is still open.
	 */
	T live() {
		return value;
	}
	void live(T value) {
		this.value = value;
	}
	/*
	 * Called by the open modifier after it detects a change. The value is still busy at this point,
	 * so nobody can change the registry while we iterate it and listeners cannot read or modify the value.
	 */
	void changed(T previous, T current) {
		++version;
		changeCount.increment();
		if (listeners.isEmpty()) {
			logger.debug("Detected change in {}, no listeners to notify.", this);
			return;
		}
		logger.debug("Detected change in {}, notifying {} listeners.", this, listeners.size());
		/*
		 * Tracing is only enabled when there is somebody to notify. Changes without listeners are not interesting.
		 */
		Span span = GlobalTracer.get().buildSpan("datatracker.change")
			.withTag("component", "datatracker")
			.start();
		OwnerTrace.of(this).fill(span);
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			notificationTimer.record(() -> listeners.fire(previous, current));
		} finally {
			span.finish();
		}
	}
	/*
	 * Called by the modifier when it is closed, even if change detection or notification failed.
	 */
	synchronized void release(TrackedModifier<T> closed) {
		if (modifier == closed)
			modifier = null;
	}
	/**
	 * Returns diagnostic string representation of this {@link TrackedValue}.
	 * The value is included unless it is being modified.
	 *
	 * @return string representation of this {@link TrackedValue}
	 */
	@Override
	public synchronized String toString() {
		if (modifier != null)
			return OwnerTrace.of(this) + " (modifying)";
		return OwnerTrace.of(this) + " = " + value;
	}
}
