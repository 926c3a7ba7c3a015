package com.gdin.inspection.originality.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentUnit {

    /** 在提交中的顺序号，从 0 开始 */
    @JsonProperty("index")
    int index;

    @JsonProperty("file_name")
    String fileName;

    @JsonProperty("raw_text")
    String rawText;

    @JsonProperty("normalized_text")
    String normalizedText;

    @JsonProperty("content_kind")
    ContentKind contentKind;

    @JsonIgnore
    public boolean isCode() {
        return contentKind == ContentKind.CODE;
    }

    /**
     * 报告里引用单元时使用的标识
     */
    @JsonIgnore
    public String reference() {
        return fileName == null ? "unit-" + index : fileName;
    }
}
