package cn.hjw.dev.flowgraph.graph;

import cn.hjw.dev.flowgraph.exception.NotFoundException;
import cn.hjw.dev.flowgraph.function.NodeFunction;
import cn.hjw.dev.flowgraph.function.RouterFunction;
import cn.hjw.dev.flowgraph.function.RouterOutput;
import cn.hjw.dev.flowgraph.model.Record;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 编译后的只读图描述，执行期间只被借用，不会被修改
 */
public class CompiledGraph {

    @Getter
    private final String name;

    @Getter
    private final String startNode;

    private final Map<String, NodeFunction> nodes;
    private final Map<String, Class<?>> outputTypes;
    private final Map<String, RouterFunction> routers;
    private final Map<String, List<String>> edges;

    CompiledGraph(String name, String startNode, Map<String, NodeFunction> nodes, Map<String, Class<?>> outputTypes,
                  Map<String, RouterFunction> routers, Map<String, List<String>> edges) {
        this.name = name;
        this.startNode = startNode;
        this.nodes = nodes;
        this.outputTypes = outputTypes;
        this.routers = routers;
        this.edges = edges;
    }

    public Set<String> nodes() {
        return nodes.keySet();
    }

    public Set<String> routers() {
        return routers.keySet();
    }

    public Map<String, List<String>> edges() {
        return edges;
    }

    public List<String> edges(String nodeName) {
        return edges.getOrDefault(nodeName, List.of());
    }

    public boolean hasNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    public boolean isRouter(String nodeName) {
        return routers.containsKey(nodeName);
    }

    public List<Record> invoke(String nodeName, Record input) throws Exception {
        List<Record> outputs = function(nodeName).invoke(input);
        return outputs == null ? List.of() : outputs;
    }

    public RouterOutput invokeRouter(String routerName, Record input) throws Exception {
        RouterFunction router = routers.get(routerName);
        if (router == null) {
            throw new NotFoundException("Graph [" + name + "] has no router named [" + routerName + "]");
        }
        RouterOutput output = router.route(input);
        return output == null ? RouterOutput.none() : output;
    }

    public Class<?> outputType(String nodeName) {
        Class<?> type = outputTypes.get(nodeName);
        if (type == null) {
            throw new NotFoundException("Graph [" + name + "] has no node named [" + nodeName + "]");
        }
        return type;
    }

    private NodeFunction function(String nodeName) {
        NodeFunction function = nodes.get(nodeName);
        if (function == null) {
            throw new NotFoundException("Graph [" + name + "] has no node named [" + nodeName + "]");
        }
        return function;
    }
}
