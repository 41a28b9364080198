package cn.hjw.dev.flowgraph.config;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@Builder
public class RunnerConfig {

    // --- 缓存配置 ---
    @Builder.Default
    private boolean cacheEnabled = true;

    // 为空时使用内存缓存
    private Path cacheDir;

    // --- 遍历保护 ---
    // 单次调用最多处理的工作项数，防止路由成环时无限执行
    @Builder.Default
    private long maxWorkItems = 100_000L;

    public static RunnerConfig defaults() {
        return RunnerConfig.builder().build();
    }
}
