package com.gdin.inspection.originality.recommend.prompts;

public final class RecommendationPromptsZh {

    private RecommendationPromptsZh() {}

    public static final String ELABORATION_PROMPT_ZH = """
---角色---

你是一名学术诚信顾问，需要根据原创性检测结果为任课教师给出专业、可执行的处理建议。

---检测结果---

{findings_summary}

---要求---

1. overall_assessment：一句话总体评估，语气与风险等级相符
2. findings：只针对检测结果中实际出现的问题类别（authorship、internal_duplication、cross_submission），
   每类给出结合具体证据的说明（evidence）和按顺序执行的处理步骤（actions）
3. best_practices：结合提交类型（{submission_type}）给出 3 条左右的最佳实践
4. 不要编造检测结果中没有的信息；算法相同但独立实现的代码可以接受
5. 使用规范的中文书面语，不要使用表情符号

---输出---

只输出一个 JSON 对象，不要输出其它内容：
{
  "overall_assessment": "...",
  "findings": [
    {"category": "authorship" | "internal_duplication" | "cross_submission", "evidence": "...", "actions": ["...", "..."]}
  ],
  "best_practices": ["...", "..."]
}
""";
}
