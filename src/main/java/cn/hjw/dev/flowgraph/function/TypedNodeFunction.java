package cn.hjw.dev.flowgraph.function;

import java.util.List;

/**
 * 类型化的节点函数，由 {@link cn.hjw.dev.flowgraph.graph.ComputeGraph} 负责 payload 的编解码
 * @param <I> 输入类型
 * @param <O> 输出类型
 */
@FunctionalInterface
public interface TypedNodeFunction<I, O> {

    List<O> apply(I input) throws Exception;
}
