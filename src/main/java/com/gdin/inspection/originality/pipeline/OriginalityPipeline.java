package com.gdin.inspection.originality.pipeline;

import cn.hutool.core.util.IdUtil;
import com.gdin.inspection.originality.aggregate.AggregatedScore;
import com.gdin.inspection.originality.aggregate.OriginalityAggregator;
import com.gdin.inspection.originality.aggregate.OriginalitySignals;
import com.gdin.inspection.originality.authorship.AuthorshipClassifier;
import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.NoAnalyzableContentException;
import com.gdin.inspection.originality.internal.InternalComparisonResult;
import com.gdin.inspection.originality.internal.InternalCrossFileComparator;
import com.gdin.inspection.originality.models.AuthorshipVerdict;
import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.models.OriginalityReport;
import com.gdin.inspection.originality.models.SimilarityMatch;
import com.gdin.inspection.originality.models.Submission;
import com.gdin.inspection.originality.models.SubmissionInput;
import com.gdin.inspection.originality.models.SubsystemAvailability;
import com.gdin.inspection.originality.normalize.AssembledSubmission;
import com.gdin.inspection.originality.normalize.TextNormalizer;
import com.gdin.inspection.originality.recommend.RecommendationContext;
import com.gdin.inspection.originality.recommend.RecommendationResult;
import com.gdin.inspection.originality.recommend.RecommendationSynthesizer;
import com.gdin.inspection.originality.retrieval.CrossSubmissionResult;
import com.gdin.inspection.originality.retrieval.CrossSubmissionRetrievalClient;
import com.gdin.inspection.originality.retrieval.SubmissionIndexer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 一次提交的完整分析：并发执行内部比对、跨提交检索与逐单元作者身份分析，
 * 截止时间内汇总，超时分支视为不可用，再同步完成评分与建议。
 */
@Slf4j
@Component
public class OriginalityPipeline {

    static final String BRANCH_INTERNAL = "internal_comparison";
    static final String BRANCH_CROSS = "cross_submission";
    static final String BRANCH_AUTHORSHIP = "authorship";
    static final String STAGE_AGGREGATION = "aggregation";
    static final String STAGE_RECOMMENDATION = "recommendation";

    private final TextNormalizer textNormalizer;
    private final InternalCrossFileComparator internalComparator;
    private final CrossSubmissionRetrievalClient retrievalClient;
    private final AuthorshipClassifier authorshipClassifier;
    private final OriginalityAggregator aggregator;
    private final RecommendationSynthesizer recommendationSynthesizer;
    private final SubmissionIndexer submissionIndexer;
    private final ExecutorService analysisExecutor;
    private final Clock clock;
    private final OriginalityProperties originalityProperties;

    public OriginalityPipeline(TextNormalizer textNormalizer,
                               InternalCrossFileComparator internalComparator,
                               CrossSubmissionRetrievalClient retrievalClient,
                               AuthorshipClassifier authorshipClassifier,
                               OriginalityAggregator aggregator,
                               RecommendationSynthesizer recommendationSynthesizer,
                               SubmissionIndexer submissionIndexer,
                               @Qualifier("analysisExecutor") ExecutorService analysisExecutor,
                               Clock clock,
                               OriginalityProperties originalityProperties) {
        this.textNormalizer = textNormalizer;
        this.internalComparator = internalComparator;
        this.retrievalClient = retrievalClient;
        this.authorshipClassifier = authorshipClassifier;
        this.aggregator = aggregator;
        this.recommendationSynthesizer = recommendationSynthesizer;
        this.submissionIndexer = submissionIndexer;
        this.analysisExecutor = analysisExecutor;
        this.clock = clock;
        this.originalityProperties = originalityProperties;
    }

    /**
     * @throws NoAnalyzableContentException 提交中没有任何可分析的单元
     */
    public OriginalityReport analyze(SubmissionInput input) {
        long started = System.nanoTime();
        AnalysisRunStats stats = new AnalysisRunStats();

        AssembledSubmission assembled = textNormalizer.assemble(input);
        Submission submission = assembled.getSubmission();
        List<ContentUnit> units = submission.getUnits();
        if (units.isEmpty()) {
            throw new NoAnalyzableContentException("submission " + submission.getId()
                    + " has no analyzable content (" + assembled.getUnanalyzableUnits().size() + " unit(s) rejected)");
        }
        log.info("开始分析提交 {}：{} 个可分析单元，{} 个不可分析", submission.getId(), units.size(),
                assembled.getUnanalyzableUnits().size());

        long deadline = started + originalityProperties.getPipeline().getDeadline().toNanos();

        // 1. fan-out
        Future<InternalComparisonResult> internalFuture = analysisExecutor.submit(
                timed(stats, BRANCH_INTERNAL, () -> internalComparator.compare(units)));
        Future<CrossSubmissionResult> crossFuture = analysisExecutor.submit(
                timed(stats, BRANCH_CROSS, () -> retrievalClient.check(submission)));
        List<Future<AuthorshipVerdict>> authorshipFutures = new ArrayList<>();
        for (ContentUnit unit : units) {
            authorshipFutures.add(analysisExecutor.submit(
                    timed(stats, BRANCH_AUTHORSHIP, () -> authorshipClassifier.classify(unit))));
        }

        // 2. fan-in，截止时间后未完成的分支取消
        InternalComparisonResult internal = await(internalFuture, deadline, BRANCH_INTERNAL);
        CrossSubmissionResult cross = await(crossFuture, deadline, BRANCH_CROSS);

        List<AuthorshipVerdict> verdicts = new ArrayList<>();
        List<AuthorshipVerdict> counted = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            ContentUnit unit = units.get(i);
            AuthorshipVerdict verdict = await(authorshipFutures.get(i), deadline, BRANCH_AUTHORSHIP + " " + unit.reference());
            if (verdict == null) {
                verdicts.add(authorshipClassifier.heuristicVerdict(unit));
            } else {
                verdicts.add(verdict);
                counted.add(verdict);
            }
        }

        // 3. 评分
        long aggregationStarted = System.nanoTime();
        OriginalitySignals signals = OriginalityAggregator.signals(internal, cross, counted);
        AggregatedScore score = aggregator.aggregate(signals);
        stats.record(STAGE_AGGREGATION, seconds(aggregationStarted));

        SubsystemAvailability availability = SubsystemAvailability.builder()
                .internalComparisonCompleted(internal != null)
                .crossSubmissionChecked(cross != null && cross.isChecked())
                .authorshipClassified(counted.size() == units.size())
                .authorshipDegraded(verdicts.stream().anyMatch(AuthorshipVerdict::isDegradedConfidence))
                .build();

        // 4. 建议
        long recommendationStarted = System.nanoTime();
        RecommendationContext context = RecommendationContext.builder()
                .originalityScore(score.originalityScore())
                .riskLevel(score.riskLevel())
                .codeSubmission(units.stream().filter(ContentUnit::isCode).count() * 2 >= units.size())
                .internalPairs(internal == null ? List.of() : internal.getFindings())
                .crossSubmissionHits(cross == null ? List.of() : cross.getHits())
                .authorshipVerdicts(counted)
                .availability(availability)
                .build();
        RecommendationResult recommendations = recommendationSynthesizer.synthesize(context);
        stats.record(STAGE_RECOMMENDATION, seconds(recommendationStarted));
        stats.setTotalSeconds(seconds(started));

        List<SimilarityMatch> matches = new ArrayList<>();
        if (internal != null) matches.addAll(internal.getMatches());
        if (cross != null) matches.addAll(cross.getMatches());

        OriginalityReport report = OriginalityReport.builder()
                .reportId(IdUtil.getSnowflakeNextIdStr())
                .submissionId(submission.getId())
                .authorId(submission.getAuthorId())
                .originalityScore(score.originalityScore())
                .duplicationScore(score.duplicationScore())
                .authorshipScore(score.authorshipScore())
                .similarityMatches(matches)
                .internalPairs(internal == null ? List.of() : internal.getFindings())
                .crossSubmissionHits(cross == null ? List.of() : cross.getHits())
                .authorshipVerdicts(verdicts)
                .unanalyzableUnits(assembled.getUnanalyzableUnits())
                .sourcesChecked(cross == null ? 0 : cross.getSourcesChecked())
                .recommendations(recommendations.recommendations())
                .generatedAt(clock.instant())
                .availability(availability.toBuilder()
                        .recommendationsElaborated(recommendations.elaborated())
                        .build())
                .branchSeconds(stats.snapshot())
                .build();

        log.info("提交 {} 分析完成：originality={} risk={} 耗时 {}s", submission.getId(),
                String.format("%.1f", report.getOriginalityScore()), report.getRiskLevel().getValue(),
                String.format("%.2f", stats.getTotalSeconds()));

        if (originalityProperties.getPipeline().isIndexAfterAnalysis()) {
            submissionIndexer.index(submission);
        }
        return report;
    }

    private static <T> Callable<T> timed(AnalysisRunStats stats, String branch, Callable<T> task) {
        return () -> {
            long t0 = System.nanoTime();
            try {
                return task.call();
            } finally {
                stats.record(branch, seconds(t0));
            }
        };
    }

    /**
     * 等到截止时间；超时、中断或分支自身异常都返回 null，由调用方按不可用处理
     */
    private static <T> T await(Future<T> future, long deadlineNanos, String branch) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("分支 {} 未在截止时间内完成，视为不可用", branch);
            return null;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("分支 {} 等待被中断，视为不可用", branch);
            return null;
        } catch (ExecutionException e) {
            log.error("分支 {} 执行失败，视为不可用", branch, e.getCause());
            return null;
        }
    }

    private static double seconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
