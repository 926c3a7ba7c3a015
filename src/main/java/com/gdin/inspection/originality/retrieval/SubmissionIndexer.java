package com.gdin.inspection.originality.retrieval;

import com.gdin.inspection.originality.collaborator.CollaboratorCalls;
import com.gdin.inspection.originality.collaborator.EmbeddingClient;
import com.gdin.inspection.originality.collaborator.IndexedChunk;
import com.gdin.inspection.originality.collaborator.VectorIndexWriter;
import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.SubsystemUnavailableException;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.models.Submission;
import com.gdin.inspection.originality.util.TokenUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把提交按分块写入向量库，供之后的提交做跨提交比对
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionIndexer {

    private final EmbeddingClient embeddingClient;
    private final VectorIndexWriter vectorIndexWriter;
    private final CollaboratorCalls collaboratorCalls;
    private final TokenUtil tokenUtil;
    private final OriginalityProperties originalityProperties;

    /**
     * @return 是否全部写入成功
     */
    public boolean index(Submission submission) {
        OriginalityProperties.Retrieval config = originalityProperties.getRetrieval();
        List<IndexedChunk> chunks = new ArrayList<>();
        try {
            for (ContentUnit unit : submission.getUnits()) {
                List<String> pieces = chunk(unit.getRawText(), config.getChunkSize(), config.getChunkOverlap());
                for (int c = 0; c < pieces.size(); c++) {
                    String piece = pieces.get(c);
                    String input = tokenUtil.truncate(piece, config.getEmbeddingMaxTokens());
                    float[] vector = collaboratorCalls.call("embed chunk", () -> embeddingClient.embed(input));
                    chunks.add(IndexedChunk.builder()
                            .id(submission.getId() + "_" + unit.getIndex() + "_" + c)
                            .submissionId(submission.getId())
                            .authorId(submission.getAuthorId())
                            .fileName(unit.getFileName())
                            .contentKind(unit.getContentKind())
                            .chunkIndex(c)
                            .text(piece)
                            .createdAt(submission.getCreatedAt())
                            .vector(vector)
                            .build());
                }
            }
            long written = collaboratorCalls.call("vector-upsert", () -> vectorIndexWriter.upsert(chunks));
            log.info("提交 {} 已索引 {} 个分块", submission.getId(), written);
            return true;
        } catch (SubsystemUnavailableException e) {
            log.warn("提交 {} 索引失败 [{}]: {}", submission.getId(), e.getReason(), e.getMessage());
            return false;
        }
    }

    /**
     * 按字符切块，相邻块重叠 overlap 个字符
     */
    static List<String> chunk(String text, int size, int overlap) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        int step = Math.max(1, size - Math.max(0, overlap));
        for (int start = 0; start < text.length(); start += step) {
            int end = Math.min(text.length(), start + size);
            out.add(text.substring(start, end));
            if (end == text.length()) break;
        }
        return out;
    }
}
