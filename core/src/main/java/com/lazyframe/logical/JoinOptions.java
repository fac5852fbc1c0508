package com.lazyframe.logical;

import java.util.List;
import java.util.Objects;

/**
 * Operator-specific parameters of a {@link Join}.
 *
 * @param suffix appended to right column names that collide with left names
 * @param asofStrategy match direction of as-of joins
 * @param tolerance maximum key distance of an as-of match: a {@link Number} for numeric
 *                  keys or a {@link com.lazyframe.temporal.Duration} for temporal keys;
 *                  null for no limit
 * @param leftBy left columns that must be equal for an as-of match
 * @param rightBy right columns that must be equal for an as-of match
 * @param buildSide which side the hash join builds its table from
 */
public record JoinOptions(String suffix, AsofStrategy asofStrategy, Object tolerance,
                          List<String> leftBy, List<String> rightBy, BuildSide buildSide) {

    /**
     * Direction in which an as-of join searches the right side.
     */
    public enum AsofStrategy {
        /** Last right row whose key is less than or equal to the left key. */
        BACKWARD,
        /** First right row whose key is greater than or equal to the left key. */
        FORWARD,
        /** Right row with the smallest distance; ties prefer the earlier row. */
        NEAREST
    }

    /**
     * Build side of a hash join.
     */
    public enum BuildSide {
        /** Left unset; the smaller input is hashed. */
        AUTO,
        LEFT,
        RIGHT
    }

    public static final JoinOptions DEFAULT =
        new JoinOptions("_right", AsofStrategy.BACKWARD, null, List.of(), List.of(), BuildSide.AUTO);

    public JoinOptions {
        Objects.requireNonNull(suffix, "suffix must not be null");
        Objects.requireNonNull(asofStrategy, "asofStrategy must not be null");
        Objects.requireNonNull(buildSide, "buildSide must not be null");
        leftBy = List.copyOf(Objects.requireNonNull(leftBy, "leftBy must not be null"));
        rightBy = List.copyOf(Objects.requireNonNull(rightBy, "rightBy must not be null"));
        if (suffix.isEmpty()) {
            throw new IllegalArgumentException("suffix must not be empty");
        }
    }

    public JoinOptions withSuffix(String newSuffix) {
        return new JoinOptions(newSuffix, asofStrategy, tolerance, leftBy, rightBy, buildSide);
    }

    public JoinOptions withAsof(AsofStrategy strategy, Object newTolerance) {
        return new JoinOptions(suffix, strategy, newTolerance, leftBy, rightBy, buildSide);
    }

    public JoinOptions withBy(List<String> left, List<String> right) {
        return new JoinOptions(suffix, asofStrategy, tolerance, left, right, buildSide);
    }

    public JoinOptions withBuildSide(BuildSide side) {
        return new JoinOptions(suffix, asofStrategy, tolerance, leftBy, rightBy, side);
    }
}
