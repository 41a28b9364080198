package cn.hjw.dev.flowgraph.cache;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class InMemoryContentCacheTest {

    @Test
    public void testStoredEntryIsIsolatedFromCaller() {
        InMemoryContentCache cache = new InMemoryContentCache();
        byte[] output = {1, 2, 3};
        List<byte[]> outputs = new ArrayList<>(List.of(output));

        cache.put("g", "n", new byte[]{9}, outputs);
        output[0] = 42;
        outputs.clear();

        List<byte[]> loaded = cache.get("g", "n", new byte[]{9}).orElseThrow();
        Assertions.assertEquals(1, loaded.size());
        Assertions.assertArrayEquals(new byte[]{1, 2, 3}, loaded.get(0));
    }

    @Test
    public void testLookupIsByContent() {
        InMemoryContentCache cache = new InMemoryContentCache();
        cache.put("g", "n", new byte[]{1, 2}, List.of(new byte[]{7}));

        Assertions.assertTrue(cache.get("g", "n", new byte[]{1, 2}).isPresent());
        Assertions.assertTrue(cache.get("g", "n", new byte[]{2, 1}).isEmpty());
        Assertions.assertEquals(1, cache.size());
    }

    @Test
    public void testNoOpCacheNeverRemembers() {
        NoOpContentCache cache = new NoOpContentCache();
        cache.put("g", "n", new byte[]{1}, List.of(new byte[]{7}));

        Assertions.assertTrue(cache.get("g", "n", new byte[]{1}).isEmpty());
    }
}
