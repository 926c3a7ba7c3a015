package com.gdin.inspection.originality.authorship;

import com.gdin.inspection.originality.models.AuthorshipVerdict;
import lombok.Getter;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 单个内容单元的判定状态机：
 * PENDING → TRIAGED → DONE（初筛直接定论）或 TRIAGED → DEEP_ANALYZED → DONE；
 * 外部调用失败时从 PENDING / TRIAGED 直接以启发式结果进入 DONE。
 * 非法迁移抛 IllegalStateException。
 */
@Getter
public class AuthorshipClassification {

    private static final Map<ClassificationState, Set<ClassificationState>> TRANSITIONS =
            new EnumMap<>(ClassificationState.class);

    static {
        TRANSITIONS.put(ClassificationState.PENDING,
                EnumSet.of(ClassificationState.TRIAGED, ClassificationState.DONE));
        TRANSITIONS.put(ClassificationState.TRIAGED,
                EnumSet.of(ClassificationState.DEEP_ANALYZED, ClassificationState.DONE));
        TRANSITIONS.put(ClassificationState.DEEP_ANALYZED, EnumSet.of(ClassificationState.DONE));
        TRANSITIONS.put(ClassificationState.DONE, EnumSet.noneOf(ClassificationState.class));
    }

    private final String unit;
    private ClassificationState state = ClassificationState.PENDING;
    private TriageOutcome triageOutcome;
    private AuthorshipVerdict verdict;

    public AuthorshipClassification(String unit) {
        this.unit = unit;
    }

    public void triaged(TriageOutcome outcome) {
        moveTo(ClassificationState.TRIAGED);
        this.triageOutcome = outcome;
    }

    /** 初筛已能定论 */
    public AuthorshipVerdict resolveByTriage(AuthorshipVerdict verdict) {
        if (triageOutcome == null || !triageOutcome.isConclusive()) {
            throw new IllegalStateException(unit + ": triage outcome " + triageOutcome + " is not conclusive");
        }
        moveTo(ClassificationState.DONE);
        this.verdict = verdict;
        return verdict;
    }

    public void deepAnalyzed(AuthorshipVerdict verdict) {
        if (triageOutcome != null && triageOutcome.isConclusive()) {
            throw new IllegalStateException(unit + ": conclusive triage must not proceed to deep analysis");
        }
        moveTo(ClassificationState.DEEP_ANALYZED);
        this.verdict = verdict;
    }

    public AuthorshipVerdict complete() {
        if (state != ClassificationState.DEEP_ANALYZED) {
            throw new IllegalStateException(unit + ": cannot complete from " + state);
        }
        moveTo(ClassificationState.DONE);
        return verdict;
    }

    /** 启发式兜底 */
    public AuthorshipVerdict fallBack(AuthorshipVerdict heuristic) {
        if (state == ClassificationState.DEEP_ANALYZED) {
            throw new IllegalStateException(unit + ": deep analysis already produced a verdict");
        }
        moveTo(ClassificationState.DONE);
        this.verdict = heuristic;
        return heuristic;
    }

    private void moveTo(ClassificationState next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException(unit + ": illegal transition " + state + " -> " + next);
        }
        state = next;
    }
}
