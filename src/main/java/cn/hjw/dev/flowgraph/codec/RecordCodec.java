package cn.hjw.dev.flowgraph.codec;

import cn.hjw.dev.flowgraph.model.Record;

/**
 * Record 的线上表示 (wire representation)
 * 用于缓存值的存储以及缓存键的计算，与查询时的类型化视图 {@link PayloadMapper} 分离。
 */
public interface RecordCodec {

    /**
     * 序列化整个 Record (含 id)
     */
    byte[] encode(Record record);

    /**
     * 反序列化，字节损坏时抛出 {@link cn.hjw.dev.flowgraph.exception.CodecException}
     */
    Record decode(byte[] bytes);

    /**
     * 缓存键：只取逻辑内容 (payload)，与 id 无关。
     * 不同调用中 payload 相同的输入会得到相同的键。
     */
    byte[] inputKey(Record record);
}
