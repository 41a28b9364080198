package cn.hjw.dev.flowgraph.executor;

import cn.hjw.dev.flowgraph.cache.ContentCache;
import cn.hjw.dev.flowgraph.codec.RecordCodec;
import cn.hjw.dev.flowgraph.exception.FunctionExecutionException;
import cn.hjw.dev.flowgraph.exception.StepBudgetExceededException;
import cn.hjw.dev.flowgraph.function.RouterOutput;
import cn.hjw.dev.flowgraph.graph.CompiledGraph;
import cn.hjw.dev.flowgraph.model.Record;
import cn.hjw.dev.flowgraph.store.InvocationOutputs;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Queue;

/**
 * 图遍历执行器 (单线程、同步)
 * 从起始节点出发，按 FIFO 顺序处理 (节点, 输入) 工作项，直到队列为空：
 * 1. 以输入的规范化字节查缓存，命中则回放，否则执行节点函数并同步写缓存
 * 2. 输出追加到本次调用的累加器
 * 3. 计算有效下游 = 静态边(去掉路由) + 路由按每条输出动态给出的边(过滤掉不存在的节点)
 * 4. 下游 x 输出 的笛卡尔积入队，不去重
 * 异常不在循环内恢复，直接中止遍历，已累加的输出保留可查。
 */
@Slf4j
public class GraphExecutor {

    private final ContentCache cache;
    private final RecordCodec codec;
    private final long maxWorkItems;

    public GraphExecutor(ContentCache cache, RecordCodec codec, long maxWorkItems) {
        if (maxWorkItems <= 0) {
            throw new IllegalArgumentException("maxWorkItems must be positive: " + maxWorkItems);
        }
        this.cache = cache;
        this.codec = codec;
        this.maxWorkItems = maxWorkItems;
    }

    public ExecutionStats execute(CompiledGraph graph, Record initialInput, InvocationOutputs outputs) {
        ExecutionStats stats = new ExecutionStats();
        Queue<WorkItem> queue = new ArrayDeque<>();
        queue.offer(new WorkItem(graph.getStartNode(), initialInput));

        while (!queue.isEmpty()) {
            if (stats.getWorkItems() >= maxWorkItems) {
                throw new StepBudgetExceededException(graph.getName(), maxWorkItems);
            }
            WorkItem item = queue.poll();
            stats.onWorkItem();

            List<Record> produced = produce(graph, item, stats);
            outputs.append(item.getNodeName(), produced);

            List<String> successors = resolveSuccessors(graph, item.getNodeName(), produced, stats);
            if (!successors.isEmpty() && !produced.isEmpty()) {
                log.debug("Node [{}] fans out {} outputs to {}", item.getNodeName(), produced.size(), successors);
            }
            for (String successor : successors) {
                for (Record output : produced) {
                    queue.offer(new WorkItem(successor, output));
                }
            }
        }
        return stats;
    }

    /**
     * 缓存命中则解码回放，否则执行节点并在解析下游之前写入缓存
     */
    private List<Record> produce(CompiledGraph graph, WorkItem item, ExecutionStats stats) {
        String nodeName = item.getNodeName();
        byte[] inputKey = codec.inputKey(item.getInput());

        Optional<List<byte[]>> cached = cache.get(graph.getName(), nodeName, inputKey);
        if (cached.isPresent()) {
            stats.onCacheHit();
            log.debug("Node [{}] cache hit, replaying {} outputs", nodeName, cached.get().size());
            List<Record> replayed = new ArrayList<>(cached.get().size());
            for (byte[] bytes : cached.get()) {
                // 回放的输出归属当前调用，id 取自本次输入
                replayed.add(item.getInput().withPayload(codec.decode(bytes).getPayload()));
            }
            return Collections.unmodifiableList(replayed);
        }

        stats.onCacheMiss();
        List<Record> results = List.copyOf(invoke(graph, nodeName, item.getInput()));
        List<byte[]> encoded = new ArrayList<>(results.size());
        for (Record result : results) {
            encoded.add(codec.encode(result));
        }
        cache.put(graph.getName(), nodeName, inputKey, encoded);
        log.debug("Node [{}] produced {} outputs", nodeName, results.size());
        return results;
    }

    /**
     * 每一步重新计算有效下游，不修改图中存储的边
     */
    private List<String> resolveSuccessors(CompiledGraph graph, String nodeName, List<Record> produced,
                                           ExecutionStats stats) {
        List<String> staticEdges = new ArrayList<>();
        List<String> dynamicEdges = new ArrayList<>();
        for (String edge : graph.edges(nodeName)) {
            if (!graph.isRouter(edge)) {
                staticEdges.add(edge);
                continue;
            }
            // 路由对每一条输出各调用一次
            for (Record output : produced) {
                RouterOutput routed = route(graph, edge, output);
                for (String target : routed.getEdges()) {
                    if (graph.hasNode(target)) {
                        log.debug("Router [{}] returned node [{}]", edge, target);
                        dynamicEdges.add(target);
                    } else {
                        stats.onDroppedRouterTarget();
                        log.debug("Router [{}] returned unknown node [{}], dropped", edge, target);
                    }
                }
            }
        }
        List<String> successors = new ArrayList<>(staticEdges.size() + dynamicEdges.size());
        successors.addAll(staticEdges);
        successors.addAll(dynamicEdges);
        return Collections.unmodifiableList(successors);
    }

    private List<Record> invoke(CompiledGraph graph, String nodeName, Record input) {
        try {
            return graph.invoke(nodeName, input);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new FunctionExecutionException(nodeName, e);
        }
    }

    private RouterOutput route(CompiledGraph graph, String routerName, Record input) {
        try {
            return graph.invokeRouter(routerName, input);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new FunctionExecutionException(routerName, e);
        }
    }

    // --- 工作项 ---
    @Getter
    @RequiredArgsConstructor
    private static class WorkItem {
        private final String nodeName;
        private final Record input;
    }
}
