package cn.hjw.dev.flowgraph.executor;

import lombok.Getter;
import lombok.ToString;

/**
 * 单次遍历的统计
 */
@Getter
@ToString
public class ExecutionStats {

    private long workItems;
    private long cacheHits;
    private long cacheMisses;
    private long droppedRouterTargets;

    void onWorkItem() {
        workItems++;
    }

    void onCacheHit() {
        cacheHits++;
    }

    void onCacheMiss() {
        cacheMisses++;
    }

    void onDroppedRouterTarget() {
        droppedRouterTargets++;
    }
}
