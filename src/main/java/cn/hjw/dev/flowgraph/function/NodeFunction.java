package cn.hjw.dev.flowgraph.function;

import cn.hjw.dev.flowgraph.model.Record;

import java.util.List;

/**
 * 节点函数 (字节层)
 */
@FunctionalInterface
public interface NodeFunction {

    /**
     * 执行节点逻辑
     * @param input 输入数据，不可修改
     * @return 零个或多个输出，顺序即下游收到的顺序
     * @throws Exception 执行异常，直接中止本次遍历
     */
    List<Record> invoke(Record input) throws Exception;
}
