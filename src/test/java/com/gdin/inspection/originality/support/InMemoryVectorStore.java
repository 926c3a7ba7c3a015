package com.gdin.inspection.originality.support;

import com.gdin.inspection.originality.collaborator.EmbeddingClient;
import com.gdin.inspection.originality.collaborator.IndexedChunk;
import com.gdin.inspection.originality.collaborator.SearchFilter;
import com.gdin.inspection.originality.collaborator.SearchHit;
import com.gdin.inspection.originality.collaborator.VectorIndexWriter;
import com.gdin.inspection.originality.collaborator.VectorSearchClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存向量库：search 返回预置命中（按 filter 过滤），upsert 记录写入的分块
 */
public class InMemoryVectorStore implements VectorSearchClient, VectorIndexWriter, EmbeddingClient {

    private final List<SearchHit> hits = new ArrayList<>();
    private final List<IndexedChunk> written = new ArrayList<>();
    private final AtomicInteger searchCalls = new AtomicInteger();
    private long indexedCount;
    private RuntimeException searchFailure;

    public InMemoryVectorStore withHit(SearchHit hit) {
        hits.add(hit);
        indexedCount = Math.max(indexedCount, hits.size());
        return this;
    }

    public InMemoryVectorStore withIndexedCount(long count) {
        this.indexedCount = count;
        return this;
    }

    public InMemoryVectorStore failingSearch(RuntimeException failure) {
        this.searchFailure = failure;
        return this;
    }

    @Override
    public float[] embed(String text) {
        return new float[]{text.length(), 1f};
    }

    @Override
    public synchronized List<SearchHit> search(float[] vector, int topK, SearchFilter filter) {
        searchCalls.incrementAndGet();
        if (searchFailure != null) throw searchFailure;
        return hits.stream()
                .filter(h -> filter.getContentKind() == null || h.getContentKind() == filter.getContentKind())
                .filter(h -> !Objects.equals(h.getAuthorId(), filter.getExcludeAuthorId()))
                .filter(h -> !Objects.equals(h.getSubmissionId(), filter.getExcludeSubmissionId()))
                .limit(topK)
                .toList();
    }

    @Override
    public long indexedCount() {
        return indexedCount;
    }

    @Override
    public synchronized long upsert(List<IndexedChunk> chunks) {
        written.addAll(chunks);
        return chunks.size();
    }

    public int searchCalls() {
        return searchCalls.get();
    }

    public synchronized List<IndexedChunk> written() {
        return List.copyOf(written);
    }
}
