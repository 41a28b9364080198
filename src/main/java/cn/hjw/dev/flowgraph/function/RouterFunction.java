package cn.hjw.dev.flowgraph.function;

import cn.hjw.dev.flowgraph.model.Record;

/**
 * 路由函数：根据上游的一条输出决定下一跳
 */
@FunctionalInterface
public interface RouterFunction {

    RouterOutput route(Record input) throws Exception;
}
