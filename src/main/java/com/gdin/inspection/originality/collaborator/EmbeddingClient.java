package com.gdin.inspection.originality.collaborator;

public interface EmbeddingClient {

    float[] embed(String text);
}
