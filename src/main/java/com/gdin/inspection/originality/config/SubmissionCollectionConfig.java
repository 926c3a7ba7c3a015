package com.gdin.inspection.originality.config;

import com.gdin.inspection.originality.config.properties.MilvusProperties;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.gdin.inspection.originality.collaborator.MilvusVectorStore.*;

/**
 * 历史提交分块集合，不存在时创建
 */
@Slf4j
@Configuration
public class SubmissionCollectionConfig {
    @Resource
    private MilvusClientV2 milvusClientV2;
    @Resource
    private MilvusProperties milvusProperties;

    @PostConstruct
    private void init() {
        if (Boolean.FALSE.equals(milvusProperties.getInitCollection())) return;
        String collectionName = milvusProperties.getSubmissionCollectionName();
        if (Boolean.TRUE.equals(milvusClientV2.hasCollection(HasCollectionReq.builder()
                .collectionName(collectionName)
                .build()))) {
            return;
        }

        CreateCollectionReq.CollectionSchema schema = milvusClientV2.createSchema();
        // 主键：submission_id + 文件序号 + 分块序号
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_ID)
                .dataType(DataType.VarChar)
                .maxLength(512)
                .isPrimaryKey(true)
                .autoID(false)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_SUBMISSION_ID)
                .dataType(DataType.VarChar)
                .maxLength(256)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_AUTHOR_ID)
                .dataType(DataType.VarChar)
                .maxLength(256)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_FILE_NAME)
                .dataType(DataType.VarChar)
                .maxLength(1024)
                .build());
        // code / natural_language / unknown
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_CONTENT_KIND)
                .dataType(DataType.VarChar)
                .maxLength(32)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_CHUNK_INDEX)
                .dataType(DataType.Int64)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_TEXT)
                .dataType(DataType.VarChar)
                .maxLength(65535)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_CREATED_AT)
                .dataType(DataType.VarChar)
                .maxLength(64)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_EMBEDDING)
                .dataType(DataType.FloatVector)
                .dimension(milvusProperties.getDimension())
                .build());

        // 创建索引，余弦相似度便于直接当作 [0,1] 相似度使用
        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(FIELD_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 8, "efConstruction", 64))
                .build();
        List<IndexParam> indexParams = new ArrayList<>();
        indexParams.add(vectorIndex);
        milvusClientV2.createCollection(CreateCollectionReq.builder()
                .collectionName(collectionName)
                .collectionSchema(schema)
                .indexParams(indexParams)
                .build());
        log.info("已创建集合 {}，向量维度 {}", collectionName, milvusProperties.getDimension());
    }
}
