package com.storyline.core.engine;

import com.storyline.core.model.Escalation;
import com.storyline.core.model.Task;

/**
 * Outcome of resolving an escalation.
 *
 * @param escalation the resolved escalation
 * @param applied    verdict applied to the referenced task; {@link Verdict#NONE} when the task
 *                   was re-gated or there was no task in progress
 * @param task       the referenced task after the verdict, or {@code null}
 * @param regate     gate outcome when the task was re-gated, otherwise {@code null}
 */
public record Resolution(Escalation escalation, Verdict applied, Task task, GateOutcome regate) {}
