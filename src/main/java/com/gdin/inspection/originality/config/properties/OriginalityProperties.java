package com.gdin.inspection.originality.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.time.Duration;

/**
 * 原创性分析的全部阈值与资源配置
 */
@Data
@ConfigurationProperties(prefix = "gdin.ai.originality")
@Component
public class OriginalityProperties implements Serializable {

    /** 单个文本参与比对的最大字符数，超出部分截断 */
    private int maxTextChars = 51200;

    /** 报告中保留的最短匹配块（token 数） */
    private int minBlockTokens = 3;

    private Internal internal = new Internal();

    private Retrieval retrieval = new Retrieval();

    private Authorship authorship = new Authorship();

    private Resilience resilience = new Resilience();

    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Internal implements Serializable {
        private double lexicalWeight = 0.3;
        private double strippedLexicalWeight = 0.4;
        private double structuralWeight = 0.3;
        private double flagThreshold = 0.70;
        private double retainThreshold = 0.40;
    }

    @Data
    public static class Retrieval implements Serializable {
        private int topK = 50;
        private double reportThreshold = 0.40;
        /** 嵌入输入的 token 上限 */
        private int embeddingMaxTokens = 512;
        private int chunkSize = 1000;
        private int chunkOverlap = 100;
        /** 命中摘录的最大字符数 */
        private int excerptChars = 2000;
    }

    @Data
    public static class Authorship implements Serializable {
        /** 发送给模型的单元文本 token 上限 */
        private int unitMaxTokens = 3000;
        private int triageAiDefault = 85;
        private int triageHumanDefault = 10;
    }

    @Data
    public static class Resilience implements Serializable {
        private Duration callTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 2;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Pipeline implements Serializable {
        private Duration deadline = Duration.ofSeconds(30);
        private int analysisThreads = 8;
        private int callThreads = 8;
        /** 分析完成后把提交写入向量库，供后续提交比对 */
        private boolean indexAfterAnalysis = false;
    }
}
