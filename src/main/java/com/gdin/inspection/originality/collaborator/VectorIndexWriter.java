package com.gdin.inspection.originality.collaborator;

import java.util.List;

public interface VectorIndexWriter {

    /**
     * @return 写入条数
     */
    long upsert(List<IndexedChunk> chunks);
}
