package cn.hjw.dev.flowgraph.function;

@FunctionalInterface
public interface TypedRouterFunction<I> {

    RouterOutput route(I input) throws Exception;
}
