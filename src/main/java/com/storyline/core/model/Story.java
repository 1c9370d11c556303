package com.storyline.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A backlog item as produced by the authoring process. Never mutated by the core.
 *
 * @param storyId             backlog identifier (e.g. "STORY-042")
 * @param userStory           narrative text
 * @param acceptanceCriteria  3 to 7 checkbox-prefixed criteria ("[ ] Given ...", "[x] ...")
 * @param qualityRequirements named quality constraints (e.g. "charts" -> "max 2, sourced")
 * @param priority            P0 (highest) to P3; {@code null} means {@link Priority#DEFAULT}
 * @param storyPoints         estimate from {@link #VALID_POINTS}
 */
public record Story(
    String storyId,
    String userStory,
    List<String> acceptanceCriteria,
    Map<String, String> qualityRequirements,
    Priority priority,
    Integer storyPoints
) {

    public static final Set<Integer> VALID_POINTS = Set.of(1, 2, 3, 5, 8, 13);
    public static final int MIN_CRITERIA = 3;
    public static final int MAX_CRITERIA = 7;

    private static final Pattern CHECKBOX_PREFIX = Pattern.compile("^\\s*\\[[ xX]]\\s*\\S.*");

    public Priority effectivePriority() {
        return priority != null ? priority : Priority.DEFAULT;
    }

    /**
     * Readiness contract shared by DoR validation and task decomposition.
     * Returns the names of absent or malformed required fields, in declaration order.
     */
    public List<String> missingReadinessFields() {
        var missing = new ArrayList<String>();
        if (userStory == null || userStory.isBlank()) {
            missing.add("user_story");
        }
        if (!hasWellFormedCriteria()) {
            missing.add("acceptance_criteria");
        }
        if (qualityRequirements == null || qualityRequirements.isEmpty()) {
            missing.add("quality_requirements");
        }
        if (storyPoints == null || !VALID_POINTS.contains(storyPoints)) {
            missing.add("story_points");
        }
        return missing;
    }

    private boolean hasWellFormedCriteria() {
        if (acceptanceCriteria == null
                || acceptanceCriteria.size() < MIN_CRITERIA
                || acceptanceCriteria.size() > MAX_CRITERIA) {
            return false;
        }
        for (String criterion : acceptanceCriteria) {
            if (criterion == null || !CHECKBOX_PREFIX.matcher(criterion).matches()) {
                return false;
            }
        }
        return true;
    }
}
