package cn.hjw.dev.flowgraph.function;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;

/**
 * 路由结果：候选的下游节点名 (按顺序)。图中不存在的节点会被引擎丢弃。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RouterOutput {

    private static final RouterOutput NONE = new RouterOutput(List.of());

    private final List<String> edges;

    public RouterOutput(List<String> edges) {
        this.edges = List.copyOf(edges);
    }

    public static RouterOutput of(String... edges) {
        return new RouterOutput(Arrays.asList(edges));
    }

    public static RouterOutput none() {
        return NONE;
    }
}
