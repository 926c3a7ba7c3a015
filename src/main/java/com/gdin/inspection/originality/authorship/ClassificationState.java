package com.gdin.inspection.originality.authorship;

public enum ClassificationState {
    PENDING,
    TRIAGED,
    DEEP_ANALYZED,
    DONE
}
