package cn.hjw.dev.flowgraph.exception;

import lombok.Getter;

/**
 * 节点或路由函数抛出受检异常时的包装。
 * 非受检异常原样向上抛出，不经过此类。
 */
@Getter
public class FunctionExecutionException extends FlowGraphException {

    private final String nodeName;

    public FunctionExecutionException(String nodeName, Exception cause) {
        super("Function execution failed: " + nodeName, cause);
        this.nodeName = nodeName;
    }
}
