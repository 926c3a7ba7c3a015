package com.gdin.inspection.originality.pipeline;

import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Getter
public class AnalysisRunStats {

    /** 同名分支（逐单元的作者身份分析）取最长耗时 */
    private final Map<String, Double> branchSeconds = new ConcurrentHashMap<>();

    @Setter
    private double totalSeconds;

    public void record(String branch, double seconds) {
        branchSeconds.merge(branch, seconds, Math::max);
    }

    public Map<String, Double> snapshot() {
        Map<String, Double> copy = new HashMap<>(branchSeconds);
        copy.put("total", totalSeconds);
        return copy;
    }
}
