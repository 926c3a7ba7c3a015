package com.gdin.inspection.originality.collaborator;

import java.util.List;

public interface VectorSearchClient {

    List<SearchHit> search(float[] vector, int topK, SearchFilter filter);

    /**
     * 索引中的分块数量，0 表示还没有任何历史提交
     */
    long indexedCount();
}
