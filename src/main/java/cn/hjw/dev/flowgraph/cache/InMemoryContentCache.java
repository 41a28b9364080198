package cn.hjw.dev.flowgraph.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内缓存，引擎关闭即失效
 */
public class InMemoryContentCache implements ContentCache {

    private final Map<String, List<byte[]>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<List<byte[]>> get(String graph, String node, byte[] inputKey) {
        List<byte[]> stored = entries.get(key(graph, node, inputKey));
        return Optional.ofNullable(stored).map(InMemoryContentCache::copy);
    }

    @Override
    public void put(String graph, String node, byte[] inputKey, List<byte[]> outputs) {
        // 整体替换，读者只会看到完整的列表
        entries.put(key(graph, node, inputKey), Collections.unmodifiableList(copy(outputs)));
    }

    public int size() {
        return entries.size();
    }

    private static List<byte[]> copy(List<byte[]> outputs) {
        List<byte[]> copied = new ArrayList<>(outputs.size());
        for (byte[] output : outputs) {
            copied.add(output.clone());
        }
        return copied;
    }

    private static String key(String graph, String node, byte[] inputKey) {
        return graph + '\u0000' + node + '\u0000' + CacheKeys.digest(inputKey);
    }
}
