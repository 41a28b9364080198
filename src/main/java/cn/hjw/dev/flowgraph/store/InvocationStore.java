package cn.hjw.dev.flowgraph.store;

import cn.hjw.dev.flowgraph.exception.NotFoundException;
import cn.hjw.dev.flowgraph.model.Record;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 调用结果存储
 * 生命周期: create -> 遍历时填充 -> query 读取 -> dispose 显式释放
 */
@Slf4j
public class InvocationStore {

    private final Map<String, InvocationOutputs> invocations = new ConcurrentHashMap<>();

    /**
     * 分配新的调用 id 并创建空的累加器
     */
    public InvocationOutputs create(String graphName) {
        String invocationId = UUID.randomUUID().toString();
        InvocationOutputs outputs = new InvocationOutputs(invocationId, graphName);
        invocations.put(invocationId, outputs);
        return outputs;
    }

    public InvocationOutputs get(String invocationId) {
        InvocationOutputs outputs = invocations.get(invocationId);
        if (outputs == null) {
            throw new NotFoundException("No invocation found with id [" + invocationId + "]");
        }
        return outputs;
    }

    public List<Record> outputs(String invocationId, String nodeName) {
        return get(invocationId).get(nodeName);
    }

    public boolean dispose(String invocationId) {
        boolean removed = invocations.remove(invocationId) != null;
        if (removed) {
            log.debug("Disposed invocation [{}]", invocationId);
        }
        return removed;
    }

    public int size() {
        return invocations.size();
    }
}
