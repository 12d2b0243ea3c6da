// Part of DataTracker
package com.machinezoo.datatracker;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.*;
import org.junit.jupiter.params.provider.*;

public class TrackedValueTest extends TestBase {
	@Test
	public void trackStruct() {
		TrackedValue<Sample, Integer> t = sample(1);
		AtomicInteger n = new AtomicInteger();
		t.addListener(0, (p, c) -> n.incrementAndGet());
		// Reading does not notify.
		assertEquals(1, t.get().a);
		assertEquals(0, n.get());
		// Changed value notifies.
		try (TrackedModifier<Sample> m = t.modify()) {
			m.get().a = 10;
		}
		assertEquals(1, n.get());
		// Writing the same value again is not a change.
		try (TrackedModifier<Sample> m = t.modify()) {
			m.get().a = 10;
		}
		assertEquals(1, n.get());
		try (TrackedModifier<Sample> m = t.modify()) {
			m.get().a = 20;
		}
		assertEquals(2, n.get());
		assertEquals(new Sample(20), t.get());
		assertEquals(2, n.get());
		assertNotNull(t.removeListener(0));
	}
	@Test
	public void trackEnum() {
		TrackedValue<Variant, Integer> t = new TrackedValue<>(Variant.FIRST_VALUE);
		AtomicInteger n = new AtomicInteger();
		t.addListener(0, (p, c) -> n.incrementAndGet());
		assertSame(Variant.FIRST_VALUE, t.get());
		assertEquals(0, n.get());
		try (TrackedModifier<Variant> m = t.modify()) {
			m.set(Variant.SECOND_VALUE);
		}
		assertEquals(1, n.get());
		assertSame(Variant.SECOND_VALUE, t.get());
		assertEquals(1, n.get());
	}
	@Test
	public void argumentOrder() {
		TrackedValue<Variant, Integer> t = new TrackedValue<>(Variant.FIRST_VALUE);
		AtomicBoolean ran = new AtomicBoolean();
		AtomicInteger n = new AtomicInteger();
		t.addListener(0, (p, c) -> {
			assertSame(Variant.FIRST_VALUE, p);
			assertSame(Variant.SECOND_VALUE, c);
			ran.set(true);
			n.incrementAndGet();
		});
		try (TrackedModifier<Variant> m = t.modify()) {
			m.set(Variant.SECOND_VALUE);
		}
		assertTrue(ran.get());
		assertEquals(1, n.get());
	}
	@Test
	public void collapseWrites() {
		TrackedValue<Sample, Integer> t = sample(1);
		List<String> calls = new ArrayList<>();
		t.addListener(0, (p, c) -> calls.add(p + " -> " + c));
		// Only the state before the first write and after the last write matters.
		try (TrackedModifier<Sample> m = t.modify()) {
			m.get().a = 2;
			m.get().a = 3;
			m.set(new Sample(4));
			m.get().a = 5;
		}
		assertEquals(List.of("{a: 1} -> {a: 5}"), calls);
		// Writes that end where they started are not a change.
		try (TrackedModifier<Sample> m = t.modify()) {
			m.get().a = 100;
			m.get().a = 5;
		}
		assertEquals(1, calls.size());
	}
	@Test
	public void snapshotIsIndependent() {
		TrackedValue<Sample, Integer> t = sample(1);
		AtomicReference<Sample> previous = new AtomicReference<>();
		AtomicReference<Sample> current = new AtomicReference<>();
		t.addListener(0, (p, c) -> {
			previous.set(p);
			current.set(c);
		});
		Sample live;
		try (TrackedModifier<Sample> m = t.modify()) {
			live = m.get();
			live.a = 2;
		}
		assertEquals(new Sample(1), previous.get());
		assertNotSame(live, previous.get());
		// Listeners get the live instance as the current value.
		assertSame(live, current.get());
	}
	@Test
	public void allListenersNotified() {
		TrackedValue<String, String> t = new TrackedValue<>("a");
		Map<String, String> seen = new HashMap<>();
		for (String key : List.of("x", "y", "z"))
			t.addListener(key, (p, c) -> assertNull(seen.put(key, p + c)));
		t.set("b");
		assertEquals(Map.of("x", "ab", "y", "ab", "z", "ab"), seen);
	}
	@Test
	public void replaceListener() {
		TrackedValue<String, String> t = new TrackedValue<>("a");
		AtomicInteger first = new AtomicInteger();
		AtomicInteger second = new AtomicInteger();
		ChangeListener<String> l1 = (p, c) -> first.incrementAndGet();
		ChangeListener<String> l2 = (p, c) -> second.incrementAndGet();
		assertNull(t.addListener("key", l1));
		assertSame(l1, t.addListener("key", l2));
		t.set("b");
		assertEquals(0, first.get());
		assertEquals(1, second.get());
	}
	@Test
	public void removeListener() {
		TrackedValue<String, String> t = new TrackedValue<>("a");
		AtomicInteger n = new AtomicInteger();
		ChangeListener<String> l = (p, c) -> n.incrementAndGet();
		t.addListener("key", l);
		assertSame(l, t.removeListener("key"));
		t.set("b");
		assertEquals(0, n.get());
		// Absent key.
		assertNull(t.removeListener("key"));
		assertNull(t.removeListener("other"));
		t.set("c");
		assertEquals(0, n.get());
	}
	@Test
	public void versions() {
		TrackedValue<String, String> t = new TrackedValue<>("a");
		assertEquals(1, t.version());
		// Version changes even without listeners.
		t.set("b");
		assertEquals(2, t.version());
		// Unchanged value keeps the version.
		t.set(new String("b"));
		assertEquals(2, t.version());
		t.update(s -> s + "c");
		assertEquals(3, t.version());
		assertEquals("bc", t.get());
	}
	@Test
	public void modifyInPlace() {
		TrackedValue<Sample, Integer> t = sample(1);
		AtomicInteger n = new AtomicInteger();
		t.addListener(0, (p, c) -> n.incrementAndGet());
		t.modify(s -> s.a = 7);
		assertEquals(1, n.get());
		assertEquals(7, t.get().a);
		t.modify(s -> {});
		assertEquals(1, n.get());
		assertThrows(NullPointerException.class, () -> t.modify((Consumer<Sample>)null));
	}
	@ParameterizedTest
	@CsvSource({
		"a, b, 1",
		"a, a, 0",
		"'', a, 1"
	})
	public void setNotifiesOnlyOnChange(String from, String to, int expected) {
		TrackedValue<String, Integer> t = new TrackedValue<>(from);
		AtomicInteger n = new AtomicInteger();
		t.addListener(0, (p, c) -> n.incrementAndGet());
		t.set(to);
		assertEquals(expected, n.get());
		assertEquals(to, t.get());
	}
	@Test
	public void nulls() {
		AtomicInteger copies = new AtomicInteger();
		TrackedValue<Sample, Integer> t = new TrackedValue<>(null, s -> {
			copies.incrementAndGet();
			return new Sample(s);
		});
		List<String> calls = new ArrayList<>();
		t.addListener(0, (p, c) -> calls.add(p + " -> " + c));
		assertNull(t.get());
		// Null value is never passed to the copier.
		t.set(null);
		assertEquals(0, copies.get());
		assertEquals(0, calls.size());
		t.set(new Sample(1));
		assertEquals(List.of("null -> {a: 1}"), calls);
		t.set(null);
		assertEquals(1, copies.get());
		assertEquals(List.of("null -> {a: 1}", "{a: 1} -> null"), calls);
		assertThrows(NullPointerException.class, () -> new TrackedValue<String, Integer>("a", null));
	}
	@Test
	public void failingCopier() {
		RuntimeException ex = new RuntimeException();
		TrackedValue<Sample, Integer> t = new TrackedValue<>(new Sample(1), s -> {
			throw ex;
		});
		assertSame(ex, assertThrows(RuntimeException.class, t::modify));
		// No modifier was created, so the value is still accessible.
		assertEquals(1, t.get().a);
	}
	@Test
	public void diagnostics() {
		TrackedValue<String, String> t = new TrackedValue<>("hello");
		assertTrue(t.toString().endsWith(" = hello"));
		try (TrackedModifier<String> m = t.modify()) {
			// String representation doesn't throw even while the value is busy.
			assertTrue(t.toString().endsWith("(modifying)"));
			assertTrue(m.toString().endsWith("(open)"));
			assertTrue(m.toString().startsWith("tracked.modifier"));
		}
	}
}
