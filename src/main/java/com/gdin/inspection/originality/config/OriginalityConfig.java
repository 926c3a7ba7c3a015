package com.gdin.inspection.originality.config;

import com.gdin.inspection.originality.collaborator.CollaboratorCalls;
import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import jakarta.annotation.Resource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OriginalityConfig {
    @Resource
    private OriginalityProperties originalityProperties;

    /**
     * 分支任务线程池：内部比对、跨提交检索、逐单元作者身份分析
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, originalityProperties.getPipeline().getAnalysisThreads()));
    }

    /**
     * 外部调用线程池，与分支线程池分开，分支阻塞等待调用结果时不会互相占满
     */
    @Bean(name = "collaboratorCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService collaboratorCallExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, originalityProperties.getPipeline().getCallThreads()));
    }

    @Bean
    public CollaboratorCalls collaboratorCalls(@Qualifier("collaboratorCallExecutor") ExecutorService executor) {
        return new CollaboratorCalls(executor, originalityProperties.getResilience());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
