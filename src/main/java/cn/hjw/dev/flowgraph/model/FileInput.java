package cn.hjw.dev.flowgraph.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 以文件作为调用输入时的载荷结构
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileInput {

    private byte[] data;

    private String mimeType;

    private Map<String, Object> metadata;
}
