package org.agentville.runtime.agent;

import java.time.LocalDateTime;

/**
 * Tick-scoped signal telling the planner whether a new calendar day began since the previous
 * tick.
 */
public enum DayFlag {
    /** The agent had no recorded time: this is its first tick. */
    FIRST_DAY,
    /** The calendar day changed since the previous tick. */
    NEW_DAY,
    /** Same calendar day as the previous tick. */
    NO_SIGNAL;

    /**
     * @param previous The previously stored time, or null if none was recorded.
     * @param current The time of the current tick.
     * @return The flag for the current tick.
     */
    public static DayFlag between(LocalDateTime previous, LocalDateTime current) {
        if (previous == null) {
            return FIRST_DAY;
        }
        return previous.toLocalDate().equals(current.toLocalDate()) ? NO_SIGNAL : NEW_DAY;
    }
}
