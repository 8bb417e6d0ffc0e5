package com.ryuqq.runlist.testkit.contract;

import com.ryuqq.runlist.core.model.Run;
import com.ryuqq.runlist.core.spi.MergePolicy;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assertion helpers shared by the contract suites.
 *
 * @author RunList Team
 * @since 1.0.0
 */
public final class RunAssertions {

    // Utility class - prevent instantiation
    private RunAssertions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Asserts the stored runs are sorted by begin, non-overlapping and, under
     * COALESCE_ADJACENT, non-touching.
     *
     * @param runs the stored runs in iteration order
     * @param policy the merge policy the store was configured with
     */
    public static void assertStructuralInvariant(List<Run<Long>> runs, MergePolicy policy) {
        for (int i = 1; i < runs.size(); i++) {
            Run<Long> previous = runs.get(i - 1);
            Run<Long> current = runs.get(i);
            if (policy == MergePolicy.COALESCE_ADJACENT) {
                assertThat(previous.end())
                    .as("runs %s and %s must be separated by a gap", previous, current)
                    .isLessThan(current.begin());
            } else {
                assertThat(previous.end())
                    .as("runs %s and %s must not overlap", previous, current)
                    .isLessThanOrEqualTo(current.begin());
            }
        }
    }

    /**
     * Shorthand for building an expected run list.
     *
     * @param bounds begin/end pairs
     * @return runs in the given order
     */
    public static List<Run<Long>> runs(long... bounds) {
        if (bounds.length % 2 != 0) {
            throw new IllegalArgumentException("bounds must come in begin/end pairs");
        }
        List<Run<Long>> result = new ArrayList<>();
        for (int i = 0; i < bounds.length; i += 2) {
            result.add(Run.of(bounds[i], bounds[i + 1]));
        }
        return result;
    }
}
