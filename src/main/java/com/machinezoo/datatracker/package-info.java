// Part of DataTracker
/*
 * Conventions shared by all classes in this package:
 * - Null check is performed on method parameters where null has no meaning (keys, listeners, copiers, mutations).
 * - Values themselves may be null. Equality is always tested via Objects.equals().
 * - Exceptions thrown by application code (listeners, equals(), copiers) are never caught. They propagate to the caller.
 * - Misuse (accessing container while it is being modified) is rejected with IllegalStateException.
 * - Logging is limited to debug messages. Metrics and tracing spans are produced only when a change is detected.
 * - Object's OwnerTrace has at least an alias. Method toString() uses OwnerTrace.toString().
 */
/**
 * Change-tracked ownership of a single value.
 * <p>
 * {@link com.machinezoo.datatracker.TrackedValue} owns the value and its {@link com.machinezoo.datatracker.ListenerRegistry}.
 * Changes are made through {@link com.machinezoo.datatracker.TrackedModifier},
 * which compares the value before and after modification when it is closed
 * and notifies {@link com.machinezoo.datatracker.ChangeListener}s if the value has changed.
 */
package com.machinezoo.datatracker;
