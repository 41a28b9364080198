package cn.hjw.dev.flowgraph.codec;

import cn.hjw.dev.flowgraph.exception.CodecException;
import cn.hjw.dev.flowgraph.model.Record;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;

/**
 * 基于 Jackson CBOR 的 Record 编解码。
 * 编码结构: {"id": text, "payload": bytes}
 */
public class CborRecordCodec implements RecordCodec {

    private static final String FIELD_ID = "id";
    private static final String FIELD_PAYLOAD = "payload";

    private final CBORMapper mapper;

    public CborRecordCodec() {
        this(new CBORMapper());
    }

    public CborRecordCodec(CBORMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(Record record) {
        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_ID, record.getId());
        node.put(FIELD_PAYLOAD, record.getPayload());
        try {
            return mapper.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new CodecException("Failed to encode record " + record.getId(), e);
        }
    }

    @Override
    public Record decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CodecException("Cannot decode record from empty bytes");
        }
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new CodecException("Malformed record bytes", e);
        }
        if (root == null || !root.isObject()) {
            throw new CodecException("Record bytes do not hold an object");
        }
        JsonNode id = root.get(FIELD_ID);
        JsonNode payload = root.get(FIELD_PAYLOAD);
        if (id == null || !id.isTextual() || payload == null || !payload.isBinary()) {
            throw new CodecException("Record bytes miss the id or payload field");
        }
        try {
            return new Record(id.textValue(), payload.binaryValue());
        } catch (IOException e) {
            throw new CodecException("Malformed record payload", e);
        }
    }

    @Override
    public byte[] inputKey(Record record) {
        // 对 payload 再包一层 CBOR byte string，保证键是规范化的 CBOR 值
        try {
            return mapper.writeValueAsBytes(record.getPayload());
        } catch (IOException e) {
            throw new CodecException("Failed to compute input key for record " + record.getId(), e);
        }
    }
}
