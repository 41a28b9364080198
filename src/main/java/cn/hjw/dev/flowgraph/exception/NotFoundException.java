package cn.hjw.dev.flowgraph.exception;

/**
 * 查询的调用 / 节点输出 / 图不存在
 */
public class NotFoundException extends FlowGraphException {

    public NotFoundException(String message) {
        super(message);
    }
}
