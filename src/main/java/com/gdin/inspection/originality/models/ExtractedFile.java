package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 上游抽取服务交过来的单个文件（已完成 OCR / 文档解析）
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractedFile {

    @JsonProperty("file_name")
    String fileName;

    @JsonProperty("extracted_text")
    String extractedText;

    @JsonProperty("content_kind")
    ContentKind contentKind;
}
