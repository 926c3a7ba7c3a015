package com.gdin.inspection.originality.collaborator;

import com.gdin.inspection.originality.models.ContentKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 写入向量库的一个分块
 */
@Value
@Builder
public class IndexedChunk {
    String id;
    String submissionId;
    String authorId;
    String fileName;
    ContentKind contentKind;
    int chunkIndex;
    String text;
    Instant createdAt;
    float[] vector;
}
