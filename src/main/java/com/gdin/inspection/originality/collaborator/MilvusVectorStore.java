package com.gdin.inspection.originality.collaborator;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.originality.config.properties.MilvusProperties;
import com.gdin.inspection.originality.models.ContentKind;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.collection.request.GetCollectionStatsReq;
import io.milvus.v2.service.collection.response.GetCollectionStatsResp;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import io.milvus.v2.service.vector.response.UpsertResp;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 历史提交分块的 Milvus 存取
 */
@Slf4j
@Component
public class MilvusVectorStore implements VectorSearchClient, VectorIndexWriter {

    public static final String FIELD_ID = "id";
    public static final String FIELD_SUBMISSION_ID = "submission_id";
    public static final String FIELD_AUTHOR_ID = "author_id";
    public static final String FIELD_FILE_NAME = "file_name";
    public static final String FIELD_CONTENT_KIND = "content_kind";
    public static final String FIELD_CHUNK_INDEX = "chunk_index";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_CREATED_AT = "created_at";
    public static final String FIELD_EMBEDDING = "embedding";

    private static final List<String> OUTPUT_FIELDS = List.of(FIELD_SUBMISSION_ID, FIELD_AUTHOR_ID, FIELD_FILE_NAME,
            FIELD_CONTENT_KIND, FIELD_CHUNK_INDEX, FIELD_TEXT);

    @Resource
    private MilvusProperties milvusProperties;

    @Resource
    private MilvusClientV2 milvusClientV2;

    @Override
    public List<SearchHit> search(float[] vector, int topK, SearchFilter filter) {
        SearchReq.SearchReqBuilder searchReqBuilder = SearchReq.builder()
                .collectionName(milvusProperties.getSubmissionCollectionName())
                .annsField(FIELD_EMBEDDING)
                .data(Collections.singletonList(new FloatVec(vector)))
                .limit(topK)
                .outputFields(OUTPUT_FIELDS);
        String expr = toFilterExpression(filter);
        if (StrUtil.isNotBlank(expr)) searchReqBuilder.filter(expr);

        SearchResp searchResp = milvusClientV2.search(searchReqBuilder.build());
        // 单 query 的结果放在 searchResults.get(0)
        List<SearchResp.SearchResult> results = CollectionUtil.isEmpty(searchResp.getSearchResults())
                ? List.of() : searchResp.getSearchResults().get(0);

        List<SearchHit> hits = new ArrayList<>(results.size());
        for (SearchResp.SearchResult result : results) {
            Map<String, Object> entity = result.getEntity();
            Float score = result.getScore();
            hits.add(SearchHit.builder()
                    .submissionId(asString(entity.get(FIELD_SUBMISSION_ID)))
                    .authorId(asString(entity.get(FIELD_AUTHOR_ID)))
                    .fileName(asString(entity.get(FIELD_FILE_NAME)))
                    .contentKind(ContentKind.of(asString(entity.get(FIELD_CONTENT_KIND))))
                    .chunkIndex(entity.get(FIELD_CHUNK_INDEX) instanceof Number num ? num.intValue() : 0)
                    .text(asString(entity.get(FIELD_TEXT)))
                    .score(score == null ? 0.0 : score)
                    .build());
        }
        return hits;
    }

    @Override
    public long indexedCount() {
        GetCollectionStatsResp stats = milvusClientV2.getCollectionStats(GetCollectionStatsReq.builder()
                .collectionName(milvusProperties.getSubmissionCollectionName())
                .build());
        Long count = stats.getNumOfEntities();
        return count == null ? 0L : count;
    }

    @Override
    public long upsert(List<IndexedChunk> chunks) {
        if (CollectionUtil.isEmpty(chunks)) return 0L;

        List<JsonObject> rows = new ArrayList<>(chunks.size());
        for (IndexedChunk chunk : chunks) {
            JsonObject obj = new JsonObject();
            obj.addProperty(FIELD_ID, chunk.getId());
            obj.addProperty(FIELD_SUBMISSION_ID, StrUtil.nullToEmpty(chunk.getSubmissionId()));
            obj.addProperty(FIELD_AUTHOR_ID, StrUtil.nullToEmpty(chunk.getAuthorId()));
            obj.addProperty(FIELD_FILE_NAME, StrUtil.nullToEmpty(chunk.getFileName()));
            obj.addProperty(FIELD_CONTENT_KIND, chunk.getContentKind().getValue());
            obj.addProperty(FIELD_CHUNK_INDEX, chunk.getChunkIndex());
            obj.addProperty(FIELD_TEXT, StrUtil.nullToEmpty(chunk.getText()));
            // ISO-8601
            obj.addProperty(FIELD_CREATED_AT, chunk.getCreatedAt() == null ? "" : chunk.getCreatedAt().toString());
            JsonArray vector = new JsonArray();
            for (float v : chunk.getVector()) vector.add(v);
            obj.add(FIELD_EMBEDDING, vector);
            rows.add(obj);
        }

        int batchSize = milvusProperties.getInsertBatchSize();
        long total = 0L;
        for (int i = 0; i < rows.size(); i += batchSize) {
            List<JsonObject> subList = rows.subList(i, Math.min(i + batchSize, rows.size()));
            UpsertResp resp = milvusClientV2.upsert(UpsertReq.builder()
                    .collectionName(milvusProperties.getSubmissionCollectionName())
                    .data(subList)
                    .build());
            total += resp.getUpsertCnt();
        }
        log.info("已写入 {} 个分块到 {}", total, milvusProperties.getSubmissionCollectionName());
        return total;
    }

    /**
     * content_kind == "code" && author_id != "a" && submission_id != "s"
     */
    static String toFilterExpression(SearchFilter filter) {
        if (filter == null) return null;
        List<String> clauses = new ArrayList<>();
        if (filter.getContentKind() != null) {
            clauses.add(FIELD_CONTENT_KIND + " == " + quote(filter.getContentKind().getValue()));
        }
        if (StrUtil.isNotBlank(filter.getExcludeAuthorId())) {
            clauses.add(FIELD_AUTHOR_ID + " != " + quote(filter.getExcludeAuthorId()));
        }
        if (StrUtil.isNotBlank(filter.getExcludeSubmissionId())) {
            clauses.add(FIELD_SUBMISSION_ID + " != " + quote(filter.getExcludeSubmissionId()));
        }
        return String.join(" && ", clauses);
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
