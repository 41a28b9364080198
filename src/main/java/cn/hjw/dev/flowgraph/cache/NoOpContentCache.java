package cn.hjw.dev.flowgraph.cache;

import java.util.List;
import java.util.Optional;

// 关闭缓存：每个工作项都重新执行节点函数
public class NoOpContentCache implements ContentCache {

    @Override
    public Optional<List<byte[]>> get(String graph, String node, byte[] inputKey) {
        return Optional.empty();
    }

    @Override
    public void put(String graph, String node, byte[] inputKey, List<byte[]> outputs) {
    }
}
