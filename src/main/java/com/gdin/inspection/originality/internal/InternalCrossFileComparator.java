package com.gdin.inspection.originality.internal;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.models.InternalPairFinding;
import com.gdin.inspection.originality.models.MatchKind;
import com.gdin.inspection.originality.models.SimilarityMatch;
import com.gdin.inspection.originality.normalize.TextNormalizer;
import com.gdin.inspection.originality.similarity.LexicalComparison;
import com.gdin.inspection.originality.similarity.LexicalSimilarityMatcher;
import com.gdin.inspection.originality.structure.Skeleton;
import com.gdin.inspection.originality.structure.StructuralComparison;
import com.gdin.inspection.originality.structure.StructuralFingerprinter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * 同一提交内两两比对：原文词法、去注释/标点后的词法、代码结构三项加权
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InternalCrossFileComparator {

    private final TextNormalizer textNormalizer;
    private final LexicalSimilarityMatcher lexicalSimilarityMatcher;
    private final StructuralFingerprinter structuralFingerprinter;
    private final OriginalityProperties originalityProperties;

    public InternalComparisonResult compare(List<ContentUnit> units) {
        if (units == null || units.size() < 2) return InternalComparisonResult.empty();

        int n = units.size();
        String[] stripped = new String[n];
        Skeleton[] skeletons = new Skeleton[n];
        for (int i = 0; i < n; i++) {
            ContentUnit unit = units.get(i);
            stripped[i] = textNormalizer.stripForComparison(unit.getRawText(), unit.getContentKind());
            skeletons[i] = unit.isCode() ? structuralFingerprinter.fingerprint(unit) : null;
        }

        List<PairResult> retained = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("内部比对被中断，已完成 {} 个保留对", retained.size());
                    return toResult(retained, units);
                }
                PairResult pair;
                try {
                    pair = comparePair(i, j, units, stripped, skeletons);
                } catch (CancellationException e) {
                    log.warn("内部比对在 ({}, {}) 对齐时被中断，已完成 {} 个保留对", i, j, retained.size());
                    return toResult(retained, units);
                }
                if (pair.finding().getWeight() >= originalityProperties.getInternal().getRetainThreshold()) {
                    retained.add(pair);
                }
            }
        }
        return toResult(retained, units);
    }

    private PairResult comparePair(int i, int j, List<ContentUnit> units, String[] stripped, Skeleton[] skeletons) {
        OriginalityProperties.Internal weights = originalityProperties.getInternal();
        ContentUnit a = units.get(i);
        ContentUnit b = units.get(j);

        LexicalComparison lexical = lexicalSimilarityMatcher.compare(a.getNormalizedText(), b.getNormalizedText());
        double strippedScore = lexicalSimilarityMatcher.similarity(stripped[i], stripped[j]);

        StructuralComparison structural = null;
        boolean parseFailed = false;
        if (skeletons[i] != null && skeletons[j] != null) {
            structural = structuralFingerprinter.compare(skeletons[i], skeletons[j]);
            parseFailed = structural.parseFailed();
        }
        boolean structuralUsed = structural != null && !parseFailed;

        double weight;
        if (structuralUsed) {
            weight = weights.getLexicalWeight() * lexical.ratio()
                    + weights.getStrippedLexicalWeight() * strippedScore
                    + weights.getStructuralWeight() * structural.similarity();
        } else {
            // 去掉结构项后按剩余权重重新归一
            double total = weights.getLexicalWeight() + weights.getStrippedLexicalWeight();
            weight = (weights.getLexicalWeight() * lexical.ratio()
                    + weights.getStrippedLexicalWeight() * strippedScore) / total;
        }
        weight = Math.max(0.0, Math.min(1.0, weight));

        InternalPairFinding finding = InternalPairFinding.builder()
                .firstUnit(a.reference())
                .secondUnit(b.reference())
                .lexicalScore(lexical.ratio())
                .strippedLexicalScore(strippedScore)
                .structuralScore(structuralUsed ? structural.similarity() : 0.0)
                .structuralUsed(structuralUsed)
                .parseFailed(parseFailed)
                .weight(weight)
                .flagged(weight >= weights.getFlagThreshold())
                .build();
        return new PairResult(i, j, finding, lexical, structuralUsed ? structural : null);
    }

    private InternalComparisonResult toResult(List<PairResult> retained, List<ContentUnit> units) {
        retained.sort(Comparator.comparingDouble((PairResult p) -> p.finding().getWeight()).reversed()
                .thenComparingInt(PairResult::i)
                .thenComparingInt(PairResult::j));

        List<InternalPairFinding> findings = new ArrayList<>();
        List<SimilarityMatch> matches = new ArrayList<>();
        for (PairResult pair : retained) {
            findings.add(pair.finding());
            String source = units.get(pair.i()).reference();
            String target = units.get(pair.j()).reference();
            matches.add(SimilarityMatch.builder()
                    .sourceUnit(source)
                    .target(target)
                    .score(pair.lexical().ratio())
                    .kind(MatchKind.LEXICAL)
                    .spans(pair.lexical().spansOrWhole())
                    .truncated(pair.lexical().truncated())
                    .build());
            if (pair.structural() != null && !pair.structural().spans().isEmpty()) {
                matches.add(SimilarityMatch.builder()
                        .sourceUnit(source)
                        .target(target)
                        .score(pair.structural().similarity())
                        .kind(MatchKind.STRUCTURAL)
                        .spans(pair.structural().spans())
                        .build());
            }
        }
        log.info("内部比对完成：{} 个单元，保留 {} 对，其中 {} 对标记为重复", units.size(), findings.size(),
                findings.stream().filter(InternalPairFinding::isFlagged).count());
        return new InternalComparisonResult(List.copyOf(findings), List.copyOf(matches));
    }

    private record PairResult(int i, int j, InternalPairFinding finding, LexicalComparison lexical,
                              StructuralComparison structural) {
    }
}
