package com.gdin.inspection.originality.authorship.prompts;

public final class AuthorshipPromptsZh {

    private AuthorshipPromptsZh() {}

    public static final String TRIAGE_PROMPT_ZH = """
---角色---

你是一名审阅学生作业的助教，需要快速判断一段内容是否明显由 AI 工具生成。

---任务---

只做初筛：这段内容是明显由 AI 生成、明显由学生本人完成，还是无法确定？

明显由 AI 生成的典型迹象：
- 几乎每一行都有解释性注释，注释像教材一样逐步讲解
- 命名非常规范且冗长，格式完全统一，没有任何个人习惯
- 对简单问题给出过度完整的异常处理与边界检查
- 文字部分句式工整、段落长度均匀、大量使用总结性套话

明显由学生本人完成的典型迹象：
- 注释稀少或随意，有拼写错误、调试残留、被注释掉的旧代码
- 命名简短随意（如 a、tmp、x1），格式不统一
- 思路有明显的试错痕迹

只有在非常确定时才给出 high；拿不准时请给 uncertain。

---输入---

文件名：{file_name}
内容类型：{content_kind}

内容：
{content}

---输出---

只输出一个 JSON 对象，不要输出其它内容：
{
  "quick_verdict": "ai_generated" | "human_written" | "uncertain",
  "confidence_level": "high" | "medium" | "low",
  "initial_confidence": 0-100 的整数，表示由 AI 生成的可能性,
  "reason": "一句话说明依据"
}
""";

    public static final String DEEP_ANALYSIS_PROMPT_ZH = """
---角色---

你是一名学术诚信审查专家，需要逐维度评估一段内容由 AI 工具生成或大量辅助的可能性。

---评估维度（括号内为权重）---

1. documentation_style（25）：注释与文档的密度、语气、是否逐行讲解、是否像教材
2. structure_formatting（20）：缩进、空行、行长是否过于整齐统一
3. naming_identifiers（20）：命名是否过度规范、冗长、千篇一律
4. error_handling（15）：异常处理与输入校验是否超出题目需要
5. complexity（10）：解法复杂度是否与课程水平不符，是否使用了未教过的写法
6. personal_style（10）：是否缺少个人习惯、试错痕迹、调试残留

每个维度给出 0-100 的分数，分数越高越像 AI 生成，并给出一句具体证据（引用原文中的特征）。

---输入---

文件名：{file_name}
内容类型：{content_kind}

内容：
{content}

---输出---

只输出一个 JSON 对象，不要输出其它内容：
{
  "dimensions": {
    "documentation_style": {"score": 0-100, "evidence": "..."},
    "structure_formatting": {"score": 0-100, "evidence": "..."},
    "naming_identifiers": {"score": 0-100, "evidence": "..."},
    "error_handling": {"score": 0-100, "evidence": "..."},
    "complexity": {"score": 0-100, "evidence": "..."},
    "personal_style": {"score": 0-100, "evidence": "..."}
  },
  "ai_tool_signature": "chatgpt" | "copilot" | "claude" | "gemini" | "qwen" | "mixed" | "unknown"
}
""";
}
