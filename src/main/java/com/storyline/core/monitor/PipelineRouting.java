package com.storyline.core.monitor;

import com.storyline.core.NotFoundException;
import com.storyline.core.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed routing tables of the content pipeline: which worker role owns each phase,
 * and which role runs after each role.
 * <p>
 * The tables are validated on construction, so a broken table fails application startup:
 * every phase has a role, every role has a successor or is the single terminal role, and
 * following successors from the first phase's role visits every role exactly once.
 */
@Component
public class PipelineRouting {

    private static final Logger log = LoggerFactory.getLogger(PipelineRouting.class);

    private final Map<Phase, String> roleByPhase;
    /** Successor per role; the terminal role maps to {@code null}. */
    private final Map<String, String> nextRole;

    public PipelineRouting() {
        this(defaultRoles(), defaultSuccessors());
    }

    PipelineRouting(Map<Phase, String> roleByPhase, Map<String, String> nextRole) {
        this.roleByPhase = Collections.unmodifiableMap(new EnumMap<>(roleByPhase));
        this.nextRole = Collections.unmodifiableMap(new LinkedHashMap<>(nextRole));
        validate();
        log.debug("Pipeline routing: {}", String.join(" -> ", roles()));
    }

    private static Map<Phase, String> defaultRoles() {
        var roles = new EnumMap<Phase, String>(Phase.class);
        roles.put(Phase.RESEARCH, "research");
        roles.put(Phase.WRITING, "writer");
        roles.put(Phase.EDITING, "editor");
        roles.put(Phase.GRAPHICS, "graphics");
        roles.put(Phase.FINAL_REVIEW, "final-review");
        return roles;
    }

    private static Map<String, String> defaultSuccessors() {
        var next = new LinkedHashMap<String, String>();
        next.put("research", "writer");
        next.put("writer", "editor");
        next.put("editor", "graphics");
        next.put("graphics", "final-review");
        next.put("final-review", null);
        return next;
    }

    /**
     * Role that works the given phase.
     */
    public String roleFor(Phase phase) {
        String role = roleByPhase.get(phase);
        if (role == null) {
            throw new NotFoundException("Phase", phase.wireName());
        }
        return role;
    }

    /**
     * Phase worked by the given role.
     */
    public Phase phaseFor(String role) {
        for (var entry : roleByPhase.entrySet()) {
            if (entry.getValue().equals(role)) {
                return entry.getKey();
            }
        }
        throw new NotFoundException("Agent role", role);
    }

    /**
     * Role that runs after {@code role}, or empty when {@code role} is terminal.
     *
     * @throws NotFoundException if the role is not part of the pipeline
     */
    public Optional<String> nextRole(String role) {
        if (role == null || !nextRole.containsKey(role)) {
            throw new NotFoundException("Agent role", String.valueOf(role));
        }
        return Optional.ofNullable(nextRole.get(role));
    }

    public boolean isKnownRole(String role) {
        return role != null && nextRole.containsKey(role);
    }

    /** Roles in pipeline order. */
    public List<String> roles() {
        var ordered = new ArrayList<String>();
        String role = roleByPhase.get(firstPhase());
        while (role != null) {
            ordered.add(role);
            role = nextRole.get(role);
        }
        return ordered;
    }

    private Phase firstPhase() {
        return roleByPhase.keySet().iterator().next();
    }

    private void validate() {
        if (roleByPhase.isEmpty()) {
            throw new IllegalStateException("Pipeline routing has no phases");
        }
        for (var entry : roleByPhase.entrySet()) {
            if (!nextRole.containsKey(entry.getValue())) {
                throw new IllegalStateException("Role " + entry.getValue() + " for phase "
                        + entry.getKey().wireName() + " has no routing entry");
            }
        }
        long terminals = nextRole.values().stream().filter(v -> v == null).count();
        if (terminals != 1) {
            throw new IllegalStateException("Pipeline routing must have exactly one terminal role, found " + terminals);
        }
        for (var entry : nextRole.entrySet()) {
            String successor = entry.getValue();
            if (successor != null && !nextRole.containsKey(successor)) {
                throw new IllegalStateException("Role " + entry.getKey() + " routes to unknown role " + successor);
            }
        }

        var visited = new HashSet<String>();
        String role = roleByPhase.get(firstPhase());
        while (role != null) {
            if (!visited.add(role)) {
                throw new IllegalStateException("Pipeline routing loops back to role " + role);
            }
            role = nextRole.get(role);
        }
        if (!visited.equals(nextRole.keySet()) || !visited.containsAll(roleByPhase.values())) {
            throw new IllegalStateException("Pipeline routing does not reach every role from "
                    + roleByPhase.get(firstPhase()));
        }

        // Phase order and routing order must agree, since each phase depends on the previous one
        var phaseRoles = new ArrayList<>(roleByPhase.values());
        if (!phaseRoles.equals(roles())) {
            throw new IllegalStateException("Phase order " + phaseRoles + " disagrees with routing order " + roles());
        }
    }
}
