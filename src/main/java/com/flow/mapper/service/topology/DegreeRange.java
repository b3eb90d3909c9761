package com.flow.mapper.service.topology;

/**
 * Inclusive bounds on a node degree. {@code max} of {@link #UNBOUNDED} means no upper bound.
 */
public record DegreeRange(int min, int max) {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static DegreeRange exactly(int count) {
        return new DegreeRange(count, count);
    }

    public static DegreeRange atLeast(int count) {
        return new DegreeRange(count, UNBOUNDED);
    }

    public static DegreeRange atMost(int count) {
        return new DegreeRange(0, count);
    }

    public static DegreeRange between(int min, int max) {
        return new DegreeRange(min, max);
    }

    public boolean contains(long count) {
        return count >= min && count <= max;
    }

    public String describe() {
        if (min == max) {
            return min == 0 ? "0" : "exactly " + min;
        }
        if (max == UNBOUNDED) {
            return "at least " + min;
        }
        if (min == 0) {
            return "0 or " + max;
        }
        return min + "-" + max;
    }
}
