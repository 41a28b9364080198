package cn.hjw.dev.flowgraph.cache;

import cn.hjw.dev.flowgraph.exception.CacheException;
import cn.hjw.dev.flowgraph.exception.CodecException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 磁盘缓存，跨进程复用节点输出
 * 布局: {@code <root>/g-<graph>/n-<node>/<sha256(inputKey)>.cbor}，图名与节点名加前缀，不会被解析为 . 或 ..，文件内容是 CBOR 数组，每个元素是一条编码后的输出。
 * 写入先落到临时文件再原子改名，读者要么看到完整条目，要么看不到。
 */
@Slf4j
public class FileSystemContentCache implements ContentCache {

    private static final String SUFFIX = ".cbor";

    private final Path root;
    private final CBORMapper mapper = new CBORMapper();

    public FileSystemContentCache(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new CacheException("Cannot create cache directory " + root, e);
        }
    }

    @Override
    public Optional<List<byte[]>> get(String graph, String node, byte[] inputKey) {
        Path entry = entryPath(graph, node, inputKey);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(entry);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheException("Failed to read cache entry " + entry, e);
        }
        return Optional.of(decodeEntry(entry, bytes));
    }

    @Override
    public void put(String graph, String node, byte[] inputKey, List<byte[]> outputs) {
        Path entry = entryPath(graph, node, inputKey);
        try {
            Files.createDirectories(entry.getParent());
            Path tmp = Files.createTempFile(entry.getParent(), "entry-", ".tmp");
            try {
                Files.write(tmp, mapper.writeValueAsBytes(outputs));
                moveIntoPlace(tmp, entry);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new CacheException("Failed to write cache entry " + entry, e);
        }
        log.debug("Cached {} outputs for node [{}] of graph [{}] at {}", outputs.size(), node, graph, entry);
    }

    private static void moveIntoPlace(Path tmp, Path entry) throws IOException {
        try {
            Files.move(tmp, entry, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", entry);
            Files.move(tmp, entry, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private List<byte[]> decodeEntry(Path entry, byte[] bytes) {
        JsonNode tree;
        try {
            tree = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new CodecException("Corrupted cache entry " + entry, e);
        }
        if (tree == null || !tree.isArray()) {
            throw new CodecException("Corrupted cache entry " + entry + ": not an array");
        }
        List<byte[]> outputs = new ArrayList<>(tree.size());
        for (JsonNode element : tree) {
            if (!element.isBinary()) {
                throw new CodecException("Corrupted cache entry " + entry + ": non-binary element");
            }
            try {
                outputs.add(element.binaryValue());
            } catch (IOException e) {
                throw new CodecException("Corrupted cache entry " + entry, e);
            }
        }
        return outputs;
    }

    Path entryPath(String graph, String node, byte[] inputKey) {
        return root.resolve("g-" + segment(graph)).resolve("n-" + segment(node)).resolve(CacheKeys.digest(inputKey) + SUFFIX);
    }

    private static String segment(String name) {
        return URLEncoder.encode(name, StandardCharsets.UTF_8);
    }
}
