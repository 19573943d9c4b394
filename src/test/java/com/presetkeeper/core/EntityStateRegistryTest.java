package com.presetkeeper.core;

import com.presetkeeper.api.EntityState;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class EntityStateRegistryTest {

    @Test
    public void testPutAndGet() {
        EntityStateRegistry r = new EntityStateRegistry();
        assertNull(r.get(0x14));
        assertEquals(-1, r.presetIndexOf(0x14));

        r.put(0x14, EntityState.ofPresetIndex(3));
        assertEquals(3, r.presetIndexOf(0x14));
        assertTrue(r.contains(0x14));

        r.put(0x14, EntityState.ofPresetIndex(5));
        assertEquals(5, r.get(0x14).presetIndex());
        assertEquals(1, r.size());
    }

    @Test
    public void testVisitOnlyTouchesExistingEntries() {
        EntityStateRegistry r = new EntityStateRegistry();
        assertFalse(r.visit(7, s -> s.withPresetIndex(1)));
        assertFalse(r.contains(7));

        r.put(7, EntityState.EMPTY);
        assertTrue(r.visit(7, s -> s.withPresetIndex(1)));
        assertEquals(1, r.presetIndexOf(7));
    }

    @Test
    public void testEmplaceOrVisitReturnsPreviousState() {
        EntityStateRegistry r = new EntityStateRegistry();
        EntityState before = r.emplaceOrVisit(9, EntityState.EMPTY, s -> s.withDispatching(true));
        assertFalse(before.isDispatching());
        assertTrue(r.get(9).isDispatching());

        before = r.emplaceOrVisit(9, EntityState.EMPTY, s -> s.withDispatching(true));
        assertTrue(before.isDispatching());
    }

    @Test
    public void testNegativeAndExtremeIdsAreDistinctKeys() {
        EntityStateRegistry r = new EntityStateRegistry(4);
        int[] ids = { 0, -1, Integer.MIN_VALUE, Integer.MAX_VALUE, 0xFF000001 };
        for (int i = 0; i < ids.length; i++)
            r.put(ids[i], EntityState.ofPresetIndex(i));
        for (int i = 0; i < ids.length; i++)
            assertEquals(i, r.presetIndexOf(ids[i]));
    }

    @Test
    public void testGrowthKeepsEveryEntry() {
        EntityStateRegistry r = new EntityStateRegistry(1);
        for (int id = 0; id < 20_000; id++)
            r.put(id * 31, EntityState.ofPresetIndex(id % 1000));
        assertEquals(20_000, r.size());
        for (int id = 0; id < 20_000; id++)
            assertEquals(id % 1000, r.presetIndexOf(id * 31));
    }

    @Test
    public void testForEachWhileVisitsAllOrStops() {
        EntityStateRegistry r = new EntityStateRegistry(8);
        Map<Integer, Integer> expected = new HashMap<>();
        for (int id = 1; id <= 100; id++) {
            r.put(id, EntityState.ofPresetIndex(id));
            expected.put(id, id);
        }

        Map<Integer, Integer> seen = new HashMap<>();
        assertTrue(r.forEachWhile((id, s) -> {
            seen.put(id, s.presetIndex());
            return true;
        }));
        assertEquals(expected, seen);

        List<Integer> partial = new ArrayList<>();
        assertFalse(r.forEachWhile((id, s) -> {
            partial.add(id);
            return partial.size() < 10;
        }));
        assertEquals(10, partial.size());
    }

    @Test
    public void testVisitorMayCallBackIntoRegistry() {
        EntityStateRegistry r = new EntityStateRegistry(2);
        for (int id = 0; id < 50; id++)
            r.put(id, EntityState.EMPTY);
        r.forEachWhile((id, s) -> r.visit(id, x -> x.withPresetIndex(2)));
        for (int id = 0; id < 50; id++)
            assertEquals(2, r.presetIndexOf(id));
    }

    @Test
    public void testClear() {
        EntityStateRegistry r = new EntityStateRegistry();
        for (int id = 0; id < 500; id++)
            r.put(id, EntityState.ofPresetIndex(1));
        r.clear();
        assertTrue(r.isEmpty());
        assertNull(r.get(1));
        r.put(1, EntityState.ofPresetIndex(4));
        assertEquals(4, r.presetIndexOf(1));
    }

    @Test
    public void testStripeCountMustBePowerOfTwo() {
        assertEquals(64, new EntityStateRegistry().stripeCount());
        assertEquals(1, new EntityStateRegistry(1).stripeCount());
        try {
            new EntityStateRegistry(12);
            fail("Non power of two accepted");
        } catch (IllegalArgumentException expected) {
        }
        try {
            new EntityStateRegistry(0);
            fail("Zero stripes accepted");
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testConcurrentUpdatesOfSameEntitiesAreNotLost() throws Exception {
        final EntityStateRegistry r = new EntityStateRegistry(4);
        final int threads = 8;
        final int perThread = 1600;
        final int entities = 16;
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            Thread w = new Thread(() -> {
                for (int i = 0; i < perThread; i++)
                    r.emplaceOrVisit(i % entities, EntityState.EMPTY,
                            s -> new EntityState(s.bits() + (1 << EntityState.PRESET_SHIFT)));
            });
            workers.add(w);
            w.start();
        }
        for (Thread w : workers)
            w.join();

        assertEquals(entities, r.size());
        for (int id = 0; id < entities; id++)
            assertEquals(threads * perThread / entities, r.get(id).presetSlot());
    }
}
