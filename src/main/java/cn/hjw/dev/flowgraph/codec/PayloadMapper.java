package cn.hjw.dev.flowgraph.codec;

import cn.hjw.dev.flowgraph.exception.CodecException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;
import java.util.Map;

/**
 * payload 的类型化视图 (typed view)
 * 业务对象 <-> CBOR 字节。只在提交输入、节点函数内部以及查询结果时使用，遍历过程只搬运字节。
 */
public class PayloadMapper {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final CBORMapper mapper;

    public PayloadMapper() {
        // 按 key 排序，保证同样的字段得到同样的字节 (缓存键依赖这一点)
        this(CBORMapper.builder()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public PayloadMapper(CBORMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] toPayload(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new CodecException("Failed to serialize payload of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    public <T> T fromPayload(byte[] payload, Class<T> type) {
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new CodecException("Failed to decode payload into " + type.getName(), e);
        }
    }

    /**
     * 将任意对象转换为字段表 (用于以对象方式提交调用)
     */
    public Map<String, Object> toFields(Object value) {
        try {
            return mapper.convertValue(value, FIELDS);
        } catch (IllegalArgumentException e) {
            throw new CodecException("Failed to convert " + value.getClass().getName() + " into fields", e);
        }
    }
}
