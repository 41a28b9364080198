package cn.hjw.dev.flowgraph.store;

import cn.hjw.dev.flowgraph.exception.NotFoundException;
import cn.hjw.dev.flowgraph.model.Record;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单次调用的输出累加器 (Key: 节点名, Value: 按追加顺序排列的输出)
 * 只追加，不删除。按节点分区加锁。
 */
public class InvocationOutputs {

    @Getter
    private final String invocationId;

    @Getter
    private final String graphName;

    private final Map<String, List<Record>> outputs = new ConcurrentHashMap<>();

    // 记录节点首次产出的顺序，便于快照展示
    private final List<String> nodeOrder = Collections.synchronizedList(new ArrayList<>());

    public InvocationOutputs(String invocationId, String graphName) {
        this.invocationId = invocationId;
        this.graphName = graphName;
    }

    public void append(String nodeName, List<Record> records) {
        outputs.compute(nodeName, (k, existing) -> {
            List<Record> list = existing;
            if (list == null) {
                list = new ArrayList<>();
                nodeOrder.add(nodeName);
            }
            list.addAll(records);
            return list;
        });
    }

    /**
     * @return 该节点所有输出的拷贝
     * @throws NotFoundException 节点在本次调用中从未被访问
     */
    public List<Record> get(String nodeName) {
        List<Record> copy = new ArrayList<>();
        List<Record> present = outputs.computeIfPresent(nodeName, (k, list) -> {
            copy.addAll(list);
            return list;
        });
        if (present == null) {
            throw new NotFoundException("No outputs for node [" + nodeName + "] in invocation [" + invocationId + "]");
        }
        return copy;
    }

    public boolean contains(String nodeName) {
        return outputs.containsKey(nodeName);
    }

    public Map<String, List<Record>> snapshot() {
        List<String> nodes;
        synchronized (nodeOrder) {
            nodes = new ArrayList<>(nodeOrder);
        }
        Map<String, List<Record>> snapshot = new LinkedHashMap<>();
        for (String node : nodes) {
            snapshot.put(node, get(node));
        }
        return snapshot;
    }
}
