package cn.hjw.dev.flowgraph.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * 节点之间流动的数据信封
 * id 标识一次顶层调用，payload 是序列化后的业务数据 (CBOR)。
 * 不可变：节点函数只能产生新的 Record，不能修改输入。
 */
@Getter
@EqualsAndHashCode(doNotUseGetters = true)
public final class Record {

    private final String id;

    private final byte[] payload;

    public Record(String id, byte[] payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.payload = Objects.requireNonNull(payload, "payload").clone();
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    // 同一次调用内的新数据，沿用调用 id
    public Record withPayload(byte[] newPayload) {
        return new Record(id, newPayload);
    }

    @Override
    public String toString() {
        return "Record(id=" + id + ", payload=" + payload.length + " bytes, hash="
                + Integer.toHexString(Arrays.hashCode(payload)) + ")";
    }
}
