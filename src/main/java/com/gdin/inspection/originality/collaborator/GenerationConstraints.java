package com.gdin.inspection.originality.collaborator;

import lombok.Builder;
import lombok.Value;

/**
 * 单次文本生成的约束
 */
@Value
@Builder
public class GenerationConstraints {

    /** 调用用途，仅用于日志 */
    String purpose;

    /** true 使用思考模型（深度分析），false 使用普通模型 */
    boolean deliberate;

    /** 期望输出 JSON 对象 */
    boolean expectJson;

    public static GenerationConstraints quickJson(String purpose) {
        return GenerationConstraints.builder().purpose(purpose).expectJson(true).build();
    }

    public static GenerationConstraints deliberateJson(String purpose) {
        return GenerationConstraints.builder().purpose(purpose).deliberate(true).expectJson(true).build();
    }
}
