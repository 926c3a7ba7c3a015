package com.gdin.inspection.originality.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.milvus")
@Component
public class MilvusProperties implements Serializable {
    private String uri;
    private String token;
    /** 历史提交分块所在集合 */
    private String submissionCollectionName = "originality_submission_chunk";
    /** 需与嵌入模型输出维度一致 */
    private Integer dimension = 1024;
    private Integer insertBatchSize = 1000;
    /** 启动时若集合不存在则创建 */
    private Boolean initCollection = true;
}
