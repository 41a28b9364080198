package cn.hjw.dev.flowgraph.exception;

// 引擎所有运行期异常的基类，业务层可统一捕获
public class FlowGraphException extends RuntimeException {

    public FlowGraphException(String message) {
        super(message);
    }

    public FlowGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
