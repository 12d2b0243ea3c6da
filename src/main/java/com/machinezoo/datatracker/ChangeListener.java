// Part of DataTracker
package com.machinezoo.datatracker;

import com.machinezoo.stagean.*;

/*
 * Listeners are plain functional interfaces, so that lambdas and method references can be registered directly.
 * There is no return value. Listeners communicate only through side effects.
 *
 * Listeners may throw. We deliberately do not declare any checked exception here though.
 * Code that needs to throw checked exceptions can wrap its listener in Exceptions.sneak() from NoException.
 */
/**
 * Callback for changes in {@link TrackedValue}.
 * Listeners are registered via {@link TrackedValue#addListener(Object, ChangeListener)}
 * or directly in {@link ListenerRegistry#add(Object, ChangeListener)}.
 * <p>
 * Listeners may be invoked on any thread that closes {@link TrackedModifier} of the {@link TrackedValue}.
 * They are never invoked concurrently by the same {@link TrackedValue}.
 *
 * @param <T>
 *            type of the tracked value
 */
@DraftDocs("document listener reentrancy rules")
@FunctionalInterface
public interface ChangeListener<T> {
	/**
	 * Notifies the listener that the tracked value has changed.
	 * Both parameters are compared unequal per {@link java.util.Objects#equals(Object, Object)}.
	 * Parameter {@code previous} is a snapshot taken when the {@link TrackedModifier} was opened.
	 * Parameter {@code current} is the live value. Listeners should not modify either of them.
	 * <p>
	 * Exceptions thrown from this method propagate to the code that closed the {@link TrackedModifier}.
	 * Listeners that have not been invoked yet in the same notification round are then skipped.
	 *
	 * @param previous
	 *            value before the change, possibly {@code null}
	 * @param current
	 *            value after the change, possibly {@code null}
	 */
	void changed(T previous, T current);
}
