package com.gdin.inspection.originality.collaborator;

import com.gdin.inspection.originality.models.ContentKind;
import lombok.Builder;
import lombok.Value;

/**
 * 检索过滤：同类内容、排除本人、排除当前提交
 */
@Value
@Builder
public class SearchFilter {
    ContentKind contentKind;
    String excludeAuthorId;
    String excludeSubmissionId;
}
