package cn.hjw.dev.flowgraph.exception;

/**
 * 编解码失败：字节内容损坏或无法映射为目标类型。
 * 缓存内容损坏时必须抛出，不能静默返回错误结果。
 */
public class CodecException extends FlowGraphException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
