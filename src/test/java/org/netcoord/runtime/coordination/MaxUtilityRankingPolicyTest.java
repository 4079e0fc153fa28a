package org.netcoord.runtime.coordination;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.Proposal;
import org.netcoord.runtime.model.ProposalResult;
import org.netcoord.runtime.spi.IRankingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("MaxUtilityRankingPolicy")
class MaxUtilityRankingPolicyTest {

    private final MaxUtilityRankingPolicy policy = new MaxUtilityRankingPolicy();

    private static ProposalResult.Success success(int index, String agentId, double utility) {
        return new ProposalResult.Success(index, new Proposal(agentId, Action.noop(), utility));
    }

    private static List<String> ids(List<IRankingPolicy.Ranked> ranking) {
        return ranking.stream().map(ranked -> ranked.result().agentId()).toList();
    }

    @Test
    @DisplayName("The highest utility wins whatever the input order")
    void highestUtility_winsRegardlessOfOrder() {
        List<ProposalResult.Success> successes = new ArrayList<>(List.of(
                success(0, "a", 0.2), success(1, "b", 0.9), success(2, "c", 0.5), success(3, "d", -1.0)));
        Random shuffler = new Random(5L);

        for (int i = 0; i < 20; i++) {
            Collections.shuffle(successes, shuffler);
            assertThat(ids(policy.rank(successes))).containsExactly("b", "c", "a", "d");
        }
    }

    @Test
    @DisplayName("Equal utilities go to the lower registry index")
    void tie_lowerIndexWins() {
        List<ProposalResult.Success> successes = new ArrayList<>(List.of(
                success(2, "late", 1.0), success(0, "early", 1.0), success(1, "middle", 1.0)));

        for (int i = 0; i < 10; i++) {
            Collections.rotate(successes, 1);
            List<IRankingPolicy.Ranked> ranking = policy.rank(successes);
            assertThat(ids(ranking)).containsExactly("early", "middle", "late");
            assertThat(ranking.get(0).score()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("No successes, empty ranking")
    void empty() {
        assertThat(policy.rank(List.of())).isEmpty();
    }
}
