package com.phillippitts.meetingrouter.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * One action item extracted from a meeting transcript.
 *
 * @param task       concise task text (never empty)
 * @param owner      free-text owner, {@value #UNASSIGNED} when unknown
 * @param dueDate    ISO date or {@code null}
 * @param priority   task priority
 * @param confidence extraction confidence in [0,1]
 * @param evidence   supporting quote, may be empty
 */
public record ExtractedTaskItem(
        String task,
        String owner,
        String dueDate,
        Priority priority,
        double confidence,
        String evidence
) {

    public static final String UNASSIGNED = "Unassigned";

    public ExtractedTaskItem {
        Objects.requireNonNull(task, "task must not be null");
        if (task.isEmpty()) {
            throw new IllegalArgumentException("task must not be empty");
        }
        owner = owner == null ? UNASSIGNED : owner;
        priority = priority == null ? Priority.MEDIUM : priority;
        confidence = clampConfidence(confidence);
        evidence = evidence == null ? "" : evidence;
    }

    /**
     * Clamps a confidence value to [0,1]; NaN and infinities become 0.
     */
    public static double clampConfidence(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public enum Priority {
        HIGH, MEDIUM, LOW;

        /**
         * Parses {@code high|medium|low} exactly as the extraction contract spells them; anything
         * else maps to {@link #MEDIUM}.
         */
        public static Priority fromWire(String value) {
            if (value == null) {
                return MEDIUM;
            }
            return switch (value) {
                case "high" -> HIGH;
                case "low" -> LOW;
                default -> MEDIUM;
            };
        }

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
