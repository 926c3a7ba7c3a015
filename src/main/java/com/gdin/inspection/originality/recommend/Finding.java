package com.gdin.inspection.originality.recommend;

import java.util.List;

/**
 * 一类问题的证据与处理步骤
 */
public record Finding(FindingCategory category, String evidence, List<String> actions) {

    public Finding {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /** 渲染为一条建议：标题 + 证据 + 编号步骤 */
    public String render() {
        StringBuilder sb = new StringBuilder("【").append(category.getLabel()).append("】").append(evidence);
        for (int i = 0; i < actions.size(); i++) {
            sb.append('\n').append(i + 1).append(". ").append(actions.get(i));
        }
        return sb.toString();
    }
}
