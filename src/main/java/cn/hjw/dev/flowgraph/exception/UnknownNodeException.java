package cn.hjw.dev.flowgraph.exception;

import lombok.Getter;

/**
 * 引用了图中不存在的节点 (静态边配置错误)
 */
@Getter
public class UnknownNodeException extends FlowGraphException {

    private final String nodeName;

    public UnknownNodeException(String graphName, String nodeName) {
        super("Graph [" + graphName + "] has no node named [" + nodeName + "]");
        this.nodeName = nodeName;
    }
}
