package com.gdin.inspection.originality.retrieval;

import com.gdin.inspection.originality.collaborator.CollaboratorCalls;
import com.gdin.inspection.originality.collaborator.EmbeddingClient;
import com.gdin.inspection.originality.collaborator.SearchFilter;
import com.gdin.inspection.originality.collaborator.SearchHit;
import com.gdin.inspection.originality.collaborator.VectorSearchClient;
import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.SubsystemUnavailableException;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.models.CrossSubmissionHit;
import com.gdin.inspection.originality.models.MatchKind;
import com.gdin.inspection.originality.models.SimilarityMatch;
import com.gdin.inspection.originality.models.Submission;
import com.gdin.inspection.originality.similarity.LexicalComparison;
import com.gdin.inspection.originality.similarity.LexicalSimilarityMatcher;
import com.gdin.inspection.originality.util.TokenUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 与历史提交做向量近邻检索。任何外部调用失败都只让本分支不可用，不影响整体分析
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrossSubmissionRetrievalClient {

    private final EmbeddingClient embeddingClient;
    private final VectorSearchClient vectorSearchClient;
    private final CollaboratorCalls collaboratorCalls;
    private final LexicalSimilarityMatcher lexicalSimilarityMatcher;
    private final TokenUtil tokenUtil;
    private final OriginalityProperties originalityProperties;

    public CrossSubmissionResult check(Submission submission) {
        OriginalityProperties.Retrieval config = originalityProperties.getRetrieval();
        List<CrossSubmissionHit> hits = new ArrayList<>();
        List<SimilarityMatch> matches = new ArrayList<>();
        Set<String> sources = new HashSet<>();

        try {
            long indexed = collaboratorCalls.call("vector-index-stats", vectorSearchClient::indexedCount);
            if (indexed <= 0) {
                throw new SubsystemUnavailableException(SubsystemUnavailableException.Reason.EMPTY_INDEX,
                        "no prior submissions indexed");
            }
            for (ContentUnit unit : submission.getUnits()) {
                checkUnit(submission, unit, config, hits, matches, sources);
            }
        } catch (SubsystemUnavailableException e) {
            log.warn("跨提交检索不可用 [{}]: {}，已找到的 {} 条匹配保留在报告中但不参与评分",
                    e.getReason(), e.getMessage(), hits.size());
            return new CrossSubmissionResult(false, sorted(hits), List.copyOf(matches), sources.size(),
                    e.getReason().name());
        }

        log.info("跨提交检索完成：{} 个单元，比对 {} 个历史提交，命中 {} 条", submission.getUnits().size(),
                sources.size(), hits.size());
        return new CrossSubmissionResult(true, sorted(hits), List.copyOf(matches), sources.size(), null);
    }

    private void checkUnit(Submission submission, ContentUnit unit, OriginalityProperties.Retrieval config,
                           List<CrossSubmissionHit> hits, List<SimilarityMatch> matches, Set<String> sources) {
        String query = tokenUtil.truncate(unit.getRawText(), config.getEmbeddingMaxTokens());
        float[] vector = collaboratorCalls.call("embed " + unit.reference(), () -> embeddingClient.embed(query));

        SearchFilter filter = SearchFilter.builder()
                .contentKind(unit.getContentKind())
                .excludeAuthorId(submission.getAuthorId())
                .excludeSubmissionId(submission.getId())
                .build();
        List<SearchHit> raw = collaboratorCalls.call("vector-search " + unit.reference(),
                () -> vectorSearchClient.search(vector, config.getTopK(), filter));

        // 同一历史提交只保留最相似的分块
        Map<String, SearchHit> bestBySubmission = new LinkedHashMap<>();
        for (SearchHit hit : raw) {
            if (!accepted(hit, submission, unit)) continue;
            sources.add(hit.getSubmissionId());
            SearchHit best = bestBySubmission.get(hit.getSubmissionId());
            if (best == null || clamp(hit.getScore()) > clamp(best.getScore())) {
                bestBySubmission.put(hit.getSubmissionId(), hit);
            }
        }

        for (SearchHit hit : bestBySubmission.values()) {
            double similarity = clamp(hit.getScore());
            if (similarity < config.getReportThreshold()) continue;
            String excerpt = excerpt(hit.getText(), config.getExcerptChars());
            hits.add(CrossSubmissionHit.builder()
                    .sourceUnit(unit.reference())
                    .submissionId(hit.getSubmissionId())
                    .authorId(hit.getAuthorId())
                    .similarity(similarity)
                    .excerpt(excerpt)
                    .build());
            LexicalComparison alignment = lexicalSimilarityMatcher.compare(unit.getRawText(), excerpt);
            matches.add(SimilarityMatch.builder()
                    .sourceUnit(unit.reference())
                    .target(hit.getSubmissionId())
                    .targetAuthor(hit.getAuthorId())
                    .score(similarity)
                    .kind(MatchKind.SEMANTIC)
                    .spans(alignment.spansOrWhole())
                    .truncated(alignment.truncated())
                    .build());
        }
    }

    private static boolean accepted(SearchHit hit, Submission submission, ContentUnit unit) {
        if (hit.getSubmissionId() == null) return false;
        if (Objects.equals(hit.getSubmissionId(), submission.getId())) return false;
        if (Objects.equals(hit.getAuthorId(), submission.getAuthorId())) return false;
        return hit.getContentKind() == null || hit.getContentKind() == unit.getContentKind();
    }

    private static List<CrossSubmissionHit> sorted(List<CrossSubmissionHit> hits) {
        List<CrossSubmissionHit> copy = new ArrayList<>(hits);
        copy.sort(Comparator.comparingDouble(CrossSubmissionHit::getSimilarity).reversed()
                .thenComparing(CrossSubmissionHit::getSubmissionId)
                .thenComparing(CrossSubmissionHit::getSourceUnit));
        return List.copyOf(copy);
    }

    private static String excerpt(String text, int maxChars) {
        if (text == null) return "";
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
