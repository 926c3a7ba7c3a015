package com.gdin.inspection.originality.normalize;

import com.gdin.inspection.originality.models.Submission;
import com.gdin.inspection.originality.models.UnanalyzableUnit;
import lombok.Value;

import java.util.List;

@Value
public class AssembledSubmission {
    Submission submission;
    List<UnanalyzableUnit> unanalyzableUnits;
}
