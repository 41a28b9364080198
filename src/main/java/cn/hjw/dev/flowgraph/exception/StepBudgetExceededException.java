package cn.hjw.dev.flowgraph.exception;

import lombok.Getter;

/**
 * 单次遍历处理的工作项超过上限，通常意味着路由形成了环
 */
@Getter
public class StepBudgetExceededException extends FlowGraphException {

    private final String graphName;
    private final long maxWorkItems;

    public StepBudgetExceededException(String graphName, long maxWorkItems) {
        super("Graph [" + graphName + "] exceeded the work item budget of " + maxWorkItems
                + ", possible routing cycle");
        this.graphName = graphName;
        this.maxWorkItems = maxWorkItems;
    }
}
