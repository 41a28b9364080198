package cn.hjw.dev.flowgraph.graph;

import cn.hjw.dev.flowgraph.codec.PayloadMapper;
import cn.hjw.dev.flowgraph.function.NodeFunction;
import cn.hjw.dev.flowgraph.function.RouterFunction;
import cn.hjw.dev.flowgraph.function.RouterOutput;
import cn.hjw.dev.flowgraph.function.TypedNodeFunction;
import cn.hjw.dev.flowgraph.function.TypedRouterFunction;
import cn.hjw.dev.flowgraph.model.Record;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 图定义 (注册期使用，可变)
 * 注册到引擎时经 {@link GraphCompiler} 校验并冻结为 {@link CompiledGraph}。
 */
@Getter
public class ComputeGraph {

    private final String name;

    private final String startNode;

    // 节点逻辑表 (保持声明顺序)
    private final Map<String, NodeFunction> nodes = new LinkedHashMap<>();

    // 查询时用于反序列化的输出类型
    private final Map<String, Class<?>> outputTypes = new LinkedHashMap<>();

    // 路由表
    private final Map<String, RouterFunction> routers = new LinkedHashMap<>();

    // 邻接表 (Key: 上游, Value: 下游列表，有序、允许重复)
    private final Map<String, List<String>> edges = new LinkedHashMap<>();

    private final PayloadMapper payloadMapper;

    public ComputeGraph(String name, String startNode) {
        this(name, startNode, new PayloadMapper());
    }

    public ComputeGraph(String name, String startNode, PayloadMapper payloadMapper) {
        this.name = Objects.requireNonNull(name, "name");
        this.startNode = Objects.requireNonNull(startNode, "startNode");
        this.payloadMapper = payloadMapper;
    }

    /**
     * 注册字节层节点
     * @param outputType 查询结果时 payload 反序列化的目标类型
     */
    public ComputeGraph addNode(String nodeName, NodeFunction function, Class<?> outputType) {
        this.nodes.put(nodeName, Objects.requireNonNull(function, "function"));
        this.outputTypes.put(nodeName, Objects.requireNonNull(outputType, "outputType"));
        return this;
    }

    /**
     * 注册类型化节点：输入 payload 解码为 inputType，输出编码后沿用输入的调用 id
     */
    public <I, O> ComputeGraph addFunction(String nodeName, Class<I> inputType, Class<O> outputType,
                                           TypedNodeFunction<I, O> function) {
        Objects.requireNonNull(function, "function");
        NodeFunction wrapped = input -> {
            List<O> results = function.apply(payloadMapper.fromPayload(input.getPayload(), inputType));
            if (results == null) {
                return List.of();
            }
            List<Record> records = new ArrayList<>(results.size());
            for (O result : results) {
                records.add(input.withPayload(payloadMapper.toPayload(result)));
            }
            return records;
        };
        return addNode(nodeName, wrapped, outputType);
    }

    public ComputeGraph addRouter(String routerName, RouterFunction function) {
        this.routers.put(routerName, Objects.requireNonNull(function, "function"));
        return this;
    }

    public <I> ComputeGraph addRouter(String routerName, Class<I> inputType, TypedRouterFunction<I> function) {
        Objects.requireNonNull(function, "function");
        RouterFunction wrapped = input -> {
            RouterOutput output = function.route(payloadMapper.fromPayload(input.getPayload(), inputType));
            return output == null ? RouterOutput.none() : output;
        };
        return addRouter(routerName, wrapped);
    }

    /**
     * 添加边: from -> to (可一次添加多个下游)
     * to 可以是普通节点，也可以是路由节点。
     */
    public ComputeGraph addEdge(String from, String... to) {
        List<String> successors = edges.computeIfAbsent(from, k -> new ArrayList<>());
        Collections.addAll(successors, to);
        return this;
    }
}
