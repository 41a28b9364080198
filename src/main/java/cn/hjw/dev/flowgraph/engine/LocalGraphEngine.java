package cn.hjw.dev.flowgraph.engine;

import cn.hjw.dev.flowgraph.GraphClient;
import cn.hjw.dev.flowgraph.cache.ContentCache;
import cn.hjw.dev.flowgraph.cache.FileSystemContentCache;
import cn.hjw.dev.flowgraph.cache.InMemoryContentCache;
import cn.hjw.dev.flowgraph.cache.NoOpContentCache;
import cn.hjw.dev.flowgraph.codec.CborRecordCodec;
import cn.hjw.dev.flowgraph.codec.PayloadMapper;
import cn.hjw.dev.flowgraph.codec.RecordCodec;
import cn.hjw.dev.flowgraph.config.RunnerConfig;
import cn.hjw.dev.flowgraph.exception.FlowGraphException;
import cn.hjw.dev.flowgraph.exception.NotFoundException;
import cn.hjw.dev.flowgraph.executor.ExecutionStats;
import cn.hjw.dev.flowgraph.executor.GraphExecutor;
import cn.hjw.dev.flowgraph.graph.CompiledGraph;
import cn.hjw.dev.flowgraph.graph.ComputeGraph;
import cn.hjw.dev.flowgraph.graph.GraphCompiler;
import cn.hjw.dev.flowgraph.model.FileInput;
import cn.hjw.dev.flowgraph.model.Record;
import cn.hjw.dev.flowgraph.store.InvocationOutputs;
import cn.hjw.dev.flowgraph.store.InvocationStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 本地图执行引擎
 * 注册 -> 提交 (同步遍历) -> 按调用 id 查询。图表与调用结果都是实例状态，不存在进程级全局表。
 */
@Slf4j
public class LocalGraphEngine implements GraphClient {

    private final Map<String, CompiledGraph> graphs = new ConcurrentHashMap<>();
    private final List<String> graphOrder = new CopyOnWriteArrayList<>();

    private final InvocationStore store;
    private final PayloadMapper payloadMapper;
    private final GraphExecutor executor;

    public LocalGraphEngine() {
        this(RunnerConfig.defaults());
    }

    public LocalGraphEngine(RunnerConfig config) {
        this(config, createCache(config), new CborRecordCodec(), new PayloadMapper(), new InvocationStore());
    }

    public LocalGraphEngine(RunnerConfig config, ContentCache cache, RecordCodec codec,
                            PayloadMapper payloadMapper, InvocationStore store) {
        this.store = store;
        this.payloadMapper = payloadMapper;
        this.executor = new GraphExecutor(config.isCacheEnabled() ? cache : new NoOpContentCache(),
                codec, config.getMaxWorkItems());
    }

    private static ContentCache createCache(RunnerConfig config) {
        if (!config.isCacheEnabled()) {
            return new NoOpContentCache();
        }
        if (config.getCacheDir() != null) {
            return new FileSystemContentCache(config.getCacheDir());
        }
        return new InMemoryContentCache();
    }

    @Override
    public void register(ComputeGraph graph) {
        CompiledGraph compiled = GraphCompiler.compile(graph);
        if (graphs.put(compiled.getName(), compiled) == null) {
            graphOrder.add(compiled.getName());
        }
        log.info("Registered graph [{}] with {} nodes and {} routers",
                compiled.getName(), compiled.nodes().size(), compiled.routers().size());
    }

    @Override
    public List<String> graphs() {
        return new ArrayList<>(graphOrder);
    }

    @Override
    public String invoke(String graphName, Map<String, Object> fields) {
        CompiledGraph graph = graph(graphName);
        InvocationOutputs outputs = store.create(graphName);
        Record input = new Record(outputs.getInvocationId(), payloadMapper.toPayload(fields));

        log.info("Invoking graph [{}] at node [{}], invocation [{}]",
                graphName, graph.getStartNode(), outputs.getInvocationId());
        long start = System.currentTimeMillis();
        try {
            ExecutionStats stats = executor.execute(graph, input, outputs);
            log.info("Invocation [{}] finished in {} ms: {}",
                    outputs.getInvocationId(), System.currentTimeMillis() - start, stats);
        } catch (RuntimeException e) {
            // 唯一的失败日志点，已累加的输出保留可查
            log.error("Invocation [{}] of graph [{}] aborted: {}", outputs.getInvocationId(), graphName, e.toString());
            throw e;
        }
        return outputs.getInvocationId();
    }

    @Override
    public String invokeWithObject(String graphName, Object input) {
        return invoke(graphName, payloadMapper.toFields(input));
    }

    @Override
    public String invokeWithFile(String graphName, Path path, Map<String, Object> metadata) {
        byte[] data;
        String mimeType;
        try {
            data = Files.readAllBytes(path);
            mimeType = Files.probeContentType(path);
        } catch (IOException e) {
            throw new FlowGraphException("Failed to read input file " + path, e);
        }
        FileInput file = new FileInput(data, mimeType, metadata == null ? Map.of() : metadata);
        return invoke(graphName, Map.of("file", file));
    }

    @Override
    public List<Object> outputs(String invocationId, String nodeName) {
        InvocationOutputs outputs = store.get(invocationId);
        Class<?> type = graph(outputs.getGraphName()).outputType(nodeName);
        List<Object> results = new ArrayList<>();
        for (Record record : outputs.get(nodeName)) {
            results.add(payloadMapper.fromPayload(record.getPayload(), type));
        }
        return results;
    }

    @Override
    public <T> List<T> outputs(String invocationId, String nodeName, Class<T> type) {
        List<T> results = new ArrayList<>();
        for (Record record : store.outputs(invocationId, nodeName)) {
            results.add(payloadMapper.fromPayload(record.getPayload(), type));
        }
        return results;
    }

    /**
     * 未解码的原始输出
     */
    public List<Record> records(String invocationId, String nodeName) {
        return store.outputs(invocationId, nodeName);
    }

    @Override
    public void dispose(String invocationId) {
        if (!store.dispose(invocationId)) {
            throw new NotFoundException("No invocation found with id [" + invocationId + "]");
        }
    }

    private CompiledGraph graph(String graphName) {
        CompiledGraph graph = graphs.get(graphName);
        if (graph == null) {
            throw new NotFoundException("No graph registered with name [" + graphName + "]");
        }
        return graph;
    }
}
