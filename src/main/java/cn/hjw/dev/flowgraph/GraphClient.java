package cn.hjw.dev.flowgraph;

import cn.hjw.dev.flowgraph.graph.ComputeGraph;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public interface GraphClient {

    /**
     * 注册图，同名图会被替换
     * @param graph 图定义
     */
    void register(ComputeGraph graph);

    /**
     * @return 已注册的图名 (注册顺序)
     */
    List<String> graphs();

    /**
     * 同步执行一次调用，遍历完成后才返回
     * @param graphName 图名
     * @param fields    输入字段，序列化为起始节点的 payload
     * @return 调用 id
     */
    String invoke(String graphName, Map<String, Object> fields);

    /**
     * 以对象作为输入，对象先转换为字段表
     */
    String invokeWithObject(String graphName, Object input);

    /**
     * 以文件作为输入，文件内容放在字段 {@code file} 下
     */
    String invokeWithFile(String graphName, Path path, Map<String, Object> metadata);

    /**
     * 查询某次调用中某节点的输出，按节点声明的输出类型解码
     */
    List<Object> outputs(String invocationId, String nodeName);

    <T> List<T> outputs(String invocationId, String nodeName, Class<T> type);

    /**
     * 释放一次调用的结果
     */
    void dispose(String invocationId);
}
