package com.ryuqq.runlist.adapter.inmemory.store;

import com.ryuqq.runlist.core.model.Run;
import com.ryuqq.runlist.core.spi.MergePolicy;
import com.ryuqq.runlist.core.spi.RunStore;
import com.ryuqq.runlist.core.spi.RunStoreConfig;
import com.ryuqq.runlist.testkit.contract.ReferenceRunStore;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Randomized comparison of {@link TreeMapRunStore} against the linear-scan
 * {@link ReferenceRunStore}.
 *
 * <p>Both stores merge and cut exactly the same runs, so their snapshots must be
 * identical after every step, under either merge policy.</p>
 *
 * @author RunList Team
 * @since 1.0.0
 */
class TreeMapRunStoreOracleTest {

    private static final int DOMAIN_SIZE = 1_000;
    private static final int STEPS = 2_000;

    @ParameterizedTest
    @EnumSource(MergePolicy.class)
    void randomInsertAndRemove_MatchesReferenceAfterEveryStep(MergePolicy policy) {
        for (long seed = 0; seed < 5; seed++) {
            // Given
            RunStoreConfig config = new RunStoreConfig(policy);
            RunStore<Long> subject = new TreeMapRunStore<>(config);
            RunStore<Long> oracle = new ReferenceRunStore<>(config);
            Random random = new Random(seed);

            for (int step = 0; step < STEPS; step++) {
                long b = random.nextInt(DOMAIN_SIZE);
                long e = b + 1 + random.nextInt(25);
                Run<Long> run = Run.of(b, e);

                // When
                if (random.nextInt(5) < 3) {
                    subject.insert(run);
                    oracle.insert(run);
                } else {
                    subject.remove(run);
                    oracle.remove(run);
                }

                // Then
                assertThat(subject.runs())
                    .as("seed %d, step %d, %s", seed, step, run)
                    .isEqualTo(oracle.runs());
            }

            for (long key = -1; key <= DOMAIN_SIZE + 30; key++) {
                assertThat(subject.floor(key)).isEqualTo(oracle.floor(key));
            }
        }
    }
}
