package com.gdin.inspection.originality.collaborator;

import com.gdin.inspection.originality.models.ContentKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchHit {
    String submissionId;
    String authorId;
    String fileName;
    ContentKind contentKind;
    int chunkIndex;
    String text;
    /** 余弦相似度，可能略超出 [0,1]，由调用方截断 */
    double score;
}
