package cn.hjw.dev.flowgraph.exception;

public class CacheException extends FlowGraphException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
