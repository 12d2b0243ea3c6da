// Part of DataTracker
package com.machinezoo.datatracker;

import java.util.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.datatracker.util.*;

/*
 * Modifier is the only way to change the tracked value. It has two states: open and closed.
 *
 * When opened, it holds a snapshot of the value. While open, it grants exclusive access to the live value.
 * Callers can read and write the value as many times as they like. Nothing is compared and nobody is notified meantime.
 * When closed, the snapshot is compared to the live value and listeners are notified if they differ.
 * Only the first pre-modification state and the last post-modification state matter.
 *
 * Modifier implements CloseableScope, so that try-with-resources closes it on every path out of the block,
 * including early returns and exceptions. Closing is idempotent. Only the first close() does anything.
 *
 * Modifier is deliberately not thread-safe. It is expected to be used by one thread at a time.
 */
/**
 * Exclusive access to the value of {@link TrackedValue}.
 * Instances are created by {@link TrackedValue#modify()}.
 * <p>
 * When {@link #close()} is called, the value is compared to a snapshot taken when this modifier was opened
 * and registered {@link ChangeListener}s are notified if the value has changed.
 * Closing the modifier also makes the {@link TrackedValue} accessible again.
 * <p>
 * {@link TrackedModifier} is not thread-safe.
 *
 * @param <T>
 *            type of the tracked value
 *
 * @see TrackedValue#modify()
 */
public class TrackedModifier<T> implements CloseableScope {
	private final TrackedValue<T, ?> owner;
	private final T snapshot;
	TrackedModifier(TrackedValue<T, ?> owner, T snapshot) {
		this.owner = owner;
		this.snapshot = snapshot;
		OwnerTrace.of(this).alias("modifier");
	}
	private boolean closed;
	/**
	 * Returns {@code true} if this modifier has been closed.
	 *
	 * @return {@code true} if closed, {@code false} if still open
	 */
	public boolean closed() {
		return closed;
	}
	private void ensureOpen() {
		if (closed)
			throw new IllegalStateException("Modifier was already closed.");
	}
	/**
	 * Returns the live value of the {@link TrackedValue}.
	 * Mutable values can be changed in place.
	 *
	 * @return the live value, possibly {@code null}
	 * @throws IllegalStateException
	 *             if this modifier is closed
	 */
	public T get() {
		ensureOpen();
		return owner.live();
	}
	/**
	 * Replaces the live value of the {@link TrackedValue}.
	 * Listeners are not notified until this modifier is closed.
	 *
	 * @param value
	 *            new value, possibly {@code null}
	 * @throws IllegalStateException
	 *             if this modifier is closed
	 */
	public void set(T value) {
		ensureOpen();
		owner.live(value);
	}
	/**
	 * Closes this modifier and notifies listeners if the value has changed.
	 * The value is considered changed if it is not equal to the snapshot
	 * per {@link Objects#equals(Object, Object)}.
	 * Listeners receive the snapshot as the previous value and the live value as the current value.
	 * <p>
	 * Exceptions thrown by listeners or by {@link Object#equals(Object)} propagate from this method.
	 * The {@link TrackedValue} is released in any case.
	 * Subsequent calls to this method have no effect.
	 */
	@Override
	public void close() {
		if (closed)
			return;
		closed = true;
		try {
			T current = owner.live();
			if (!Objects.equals(snapshot, current))
				owner.changed(snapshot, current);
		} finally {
			owner.release(this);
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + (closed ? " (closed)" : " (open)");
	}
}
