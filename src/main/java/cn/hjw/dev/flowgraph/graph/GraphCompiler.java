package cn.hjw.dev.flowgraph.graph;

import cn.hjw.dev.flowgraph.exception.UnknownNodeException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

@Slf4j
public class GraphCompiler {

    private GraphCompiler() {
    }

    /**
     * 校验图定义并冻结为只读描述
     * @param graph 图定义
     * @return 编译后的图
     * @throws UnknownNodeException 静态边引用了未注册的节点
     * @throws IllegalStateException 起始节点缺失或命名冲突
     */
    public static CompiledGraph compile(ComputeGraph graph) {
        String name = graph.getName();
        if (name.isBlank()) {
            throw new IllegalStateException("Graph name must not be blank");
        }
        Set<String> nodes = graph.getNodes().keySet();
        Set<String> routers = graph.getRouters().keySet();

        // 1. 起始节点必须是普通节点
        if (!nodes.contains(graph.getStartNode())) {
            throw new UnknownNodeException(name, graph.getStartNode());
        }

        // 2. 路由与节点不能同名，否则无法区分静态边与动态边
        for (String router : routers) {
            if (nodes.contains(router)) {
                throw new IllegalStateException("Graph [" + name + "] declares [" + router + "] as both node and router");
            }
        }

        // 3. 静态边校验
        Map<String, List<String>> edges = new LinkedHashMap<>();
        graph.getEdges().forEach((from, successors) -> {
            if (!nodes.contains(from)) {
                throw new UnknownNodeException(name, from);
            }
            for (String to : successors) {
                if (!nodes.contains(to) && !routers.contains(to)) {
                    throw new UnknownNodeException(name, to);
                }
            }
            edges.put(from, List.copyOf(successors));
        });

        if (hasStaticCycle(nodes, edges)) {
            // 不拒绝：节点可能输出空列表而终止，执行期由工作项上限兜底
            log.warn("Graph [{}] contains a static cycle, traversal relies on the work item budget", name);
        }

        return new CompiledGraph(
                name,
                graph.getStartNode(),
                Collections.unmodifiableMap(new LinkedHashMap<>(graph.getNodes())),
                Collections.unmodifiableMap(new LinkedHashMap<>(graph.getOutputTypes())),
                Collections.unmodifiableMap(new LinkedHashMap<>(graph.getRouters())),
                Collections.unmodifiableMap(edges)
        );
    }

    // Kahn 拓扑排序，只看静态的 节点->节点 边
    private static boolean hasStaticCycle(Set<String> nodes, Map<String, List<String>> edges) {
        Map<String, Integer> inDegree = new HashMap<>();
        nodes.forEach(v -> inDegree.put(v, 0));
        edges.forEach((from, successors) -> successors.stream()
                .filter(nodes::contains)
                .forEach(to -> inDegree.merge(to, 1, Integer::sum)));

        Queue<String> queue = new ArrayDeque<>();
        inDegree.forEach((k, v) -> {
            if (v == 0) queue.offer(k);
        });

        int count = 0;
        while (!queue.isEmpty()) {
            String node = queue.poll();
            count++;
            for (String child : edges.getOrDefault(node, new ArrayList<>())) {
                if (!nodes.contains(child)) {
                    continue;
                }
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    queue.offer(child);
                }
            }
        }
        return count != nodes.size();
    }
}
