package com.mingle.backend.modules.topic.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class ActivityRankingTest {

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    private final ActivityRanking evenWeights = new ActivityRanking(1, 1, 1);

    @Test
    void scoreSumsEveryEngagementKind() {
        PostActivity activity = new PostActivity(UUID.randomUUID(), T0, 2, 1, 4);

        assertThat(evenWeights.score(activity)).isEqualTo(7);
        assertThat(new ActivityRanking(2, 0, 3).score(activity)).isEqualTo(16);
    }

    @Test
    void highestScoreWins() {
        PostActivity quiet = new PostActivity(UUID.randomUUID(), T0, 1, 0, 0);
        PostActivity busy = new PostActivity(UUID.randomUUID(), T0.plusMinutes(1), 2, 1, 0);

        assertThat(evenWeights.mostActive(List.of(quiet, busy))).contains(busy);
    }

    @Test
    void tieIsBrokenByEarliestCreationThenId() {
        PostActivity earlier = new PostActivity(UUID.fromString("7fffffff-0000-0000-0000-000000000000"), T0, 1, 0, 0);
        PostActivity later = new PostActivity(UUID.fromString("00000000-0000-0000-0000-000000000001"), T0.plusSeconds(1), 0, 1, 0);

        assertThat(evenWeights.mostActive(List.of(later, earlier))).contains(earlier);

        PostActivity sameInstantLowId = new PostActivity(UUID.fromString("00000000-0000-0000-0000-000000000002"), T0, 0, 0, 1);
        assertThat(evenWeights.mostActive(List.of(earlier, sameInstantLowId))).contains(sameInstantLowId);
    }

    @Test
    void emptyCandidatesHaveNoWinner() {
        assertThat(evenWeights.mostActive(List.of())).isEmpty();
    }
}
