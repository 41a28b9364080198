package cn.hjw.dev.flowgraph.cache;

import java.util.List;
import java.util.Optional;

/**
 * 内容寻址的节点输出缓存
 * 键为 (图名, 节点名, 输入的规范化字节)，值为该输入下节点产出的所有输出 (已编码)。
 * 关闭缓存 (永远返回空) 不允许改变任何可观察的输出，只影响执行成本。
 */
public interface ContentCache {

    /**
     * 纯查找，无副作用
     * @return 之前存储的输出列表；不存在时返回 empty
     */
    Optional<List<byte[]>> get(String graph, String node, byte[] inputKey);

    /**
     * 存储 (可覆盖) 一个键的全部输出。实现需保证同一个键不会被观察到只写了一半。
     */
    void put(String graph, String node, byte[] inputKey, List<byte[]> outputs);
}
