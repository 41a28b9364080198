package cn.hjw.dev.flowgraph.cache;

import cn.hjw.dev.flowgraph.exception.CodecException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public class FileSystemContentCacheTest {

    @TempDir
    Path dir;

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testMissingEntryIsAbsent() {
        FileSystemContentCache cache = new FileSystemContentCache(dir);

        Assertions.assertTrue(cache.get("g", "n", bytes("input")).isEmpty());
    }

    @Test
    public void testStoredOutputsKeepOrder() {
        FileSystemContentCache cache = new FileSystemContentCache(dir);
        cache.put("g", "n", bytes("input"), List.of(bytes("first"), bytes("second"), new byte[0]));

        Optional<List<byte[]>> loaded = cache.get("g", "n", bytes("input"));

        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertEquals(3, loaded.get().size());
        Assertions.assertArrayEquals(bytes("first"), loaded.get().get(0));
        Assertions.assertArrayEquals(bytes("second"), loaded.get().get(1));
        Assertions.assertEquals(0, loaded.get().get(2).length);
    }

    @Test
    public void testKeysArePartitionedByGraphAndNode() {
        FileSystemContentCache cache = new FileSystemContentCache(dir);
        cache.put("g", "n", bytes("input"), List.of(bytes("out")));

        Assertions.assertTrue(cache.get("g", "other", bytes("input")).isEmpty());
        Assertions.assertTrue(cache.get("other", "n", bytes("input")).isEmpty());
        Assertions.assertTrue(cache.get("g", "n", bytes("input2")).isEmpty());
    }

    @Test
    public void testEntriesSurviveNewInstance() {
        new FileSystemContentCache(dir).put("g", "n/with/slash", bytes("input"), List.of(bytes("out")));

        Optional<List<byte[]>> loaded = new FileSystemContentCache(dir).get("g", "n/with/slash", bytes("input"));

        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertArrayEquals(bytes("out"), loaded.get().get(0));
    }

    @Test
    public void testNoTemporaryFilesLeftBehind() throws IOException {
        FileSystemContentCache cache = new FileSystemContentCache(dir);
        cache.put("g", "n", bytes("input"), List.of(bytes("out")));
        cache.put("g", "n", bytes("input"), List.of(bytes("out-2")));

        try (Stream<Path> files = Files.walk(dir)) {
            Assertions.assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
        Assertions.assertArrayEquals(bytes("out-2"), cache.get("g", "n", bytes("input")).get().get(0));
    }

    @Test
    public void testCorruptedEntryFailsLoudly() throws IOException {
        FileSystemContentCache cache = new FileSystemContentCache(dir);
        cache.put("g", "n", bytes("input"), List.of(bytes("out")));
        Files.write(cache.entryPath("g", "n", bytes("input")), bytes("garbage{"));

        Assertions.assertThrows(CodecException.class, () -> cache.get("g", "n", bytes("input")));
    }

    /**
     * . / .. / 空名 不能被解析为目录跳转，不同图之间互不串用
     */
    @Test
    public void testDotNamesStayInsideOwnDirectory() {
        FileSystemContentCache cache = new FileSystemContentCache(dir);
        cache.put("graph-one", "..", bytes("input"), List.of(bytes("from-graph-one")));

        Assertions.assertTrue(cache.get("graph-two", "..", bytes("input")).isEmpty());
        Assertions.assertArrayEquals(bytes("from-graph-one"), cache.get("graph-one", "..", bytes("input")).get().get(0));

        for (String name : List.of(".", "..", "")) {
            Path entry = cache.entryPath(name, name, bytes("input")).normalize();
            Assertions.assertTrue(entry.startsWith(dir.normalize()), "escaped cache root: " + entry);
            Assertions.assertEquals(3, dir.normalize().relativize(entry).getNameCount(), "collapsed path: " + entry);
        }
        cache.put("", ".", bytes("input"), List.of(bytes("odd")));
        Assertions.assertTrue(cache.get(".", "", bytes("input")).isEmpty());
    }
}
