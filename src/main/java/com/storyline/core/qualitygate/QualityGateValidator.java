package com.storyline.core.qualitygate;

import com.storyline.core.model.Deliverable;
import com.storyline.core.model.DodResult;
import com.storyline.core.model.DorResult;
import com.storyline.core.model.GateDecision;
import com.storyline.core.model.Story;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Definition-of-Ready and Definition-of-Done checks plus the gate decision.
 * <p>
 * All methods are pure: the same input always yields the same verdict and nothing is
 * written anywhere but the log.
 */
@Service
public class QualityGateValidator {

    private static final Logger log = LoggerFactory.getLogger(QualityGateValidator.class);

    /** Issue counts above this are rejected outright instead of escalated. */
    static final int MAX_ESCALATABLE_ISSUES = 2;

    /**
     * Checks that a story carries narrative, well-formed acceptance criteria,
     * quality requirements and a valid point estimate.
     *
     * @param story the backlog story
     * @return verdict with the missing field names in declaration order
     */
    public DorResult validateDoR(Story story) {
        List<String> missing = story.missingReadinessFields();
        if (missing.isEmpty()) {
            log.debug("DoR passed for {}", story.storyId());
        } else {
            log.info("DoR failed for {}: missing {}", story.storyId(), missing);
        }
        return new DorResult(missing.isEmpty(), missing);
    }

    /**
     * Checks a deliverable. Issues accumulate independently: a failed self-check, a missing
     * output path, and one issue per failed acceptance criterion.
     *
     * @param deliverable worker output for a task
     * @return verdict with every issue found
     */
    public DodResult validateDoD(Deliverable deliverable) {
        var issues = new ArrayList<String>();

        if (!deliverable.selfValidationPassed()) {
            issues.add("Self-validation failed");
        }
        if (!deliverable.hasOutput()) {
            issues.add("No output path provided");
        }
        var results = deliverable.acceptanceCriteriaResults();
        for (int i = 0; i < results.size(); i++) {
            var result = results.get(i);
            if (!result.passed()) {
                String criterion = result.criterion() != null && !result.criterion().isBlank()
                        ? result.criterion()
                        : "#" + (i + 1);
                issues.add("Acceptance criterion failed: " + criterion);
            }
        }

        log.info("DoD for {}: {} issue(s){}", deliverable.taskId(), issues.size(),
                issues.isEmpty() ? "" : " " + issues);
        return new DodResult(issues.isEmpty(), issues);
    }

    /**
     * Maps an issue list to a decision by size alone: none approves, one or two escalate
     * to a human, three or more reject.
     */
    public GateDecision gateDecision(List<String> issues) {
        int count = issues.size();
        if (count == 0) {
            return GateDecision.APPROVE;
        }
        return count <= MAX_ESCALATABLE_ISSUES ? GateDecision.ESCALATE : GateDecision.REJECT;
    }
}
