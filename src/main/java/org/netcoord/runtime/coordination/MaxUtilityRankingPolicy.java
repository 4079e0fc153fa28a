package org.netcoord.runtime.coordination;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.netcoord.runtime.model.ProposalResult;
import org.netcoord.runtime.spi.IRankingPolicy;

/**
 * Ranks proposals by their own utility, highest first; equal utilities go to the lower registry
 * index.
 */
public class MaxUtilityRankingPolicy implements IRankingPolicy {

    /** Score descending, then registry index ascending. */
    static final Comparator<Ranked> ORDER = Comparator
            .comparingDouble(Ranked::score).reversed()
            .thenComparingInt(ranked -> ranked.result().index());

    @Override
    public List<Ranked> rank(List<ProposalResult.Success> successes) {
        List<Ranked> ranked = new ArrayList<>(successes.size());
        for (ProposalResult.Success success : successes) {
            ranked.add(new Ranked(success, success.proposal().utility()));
        }
        ranked.sort(ORDER);
        return ranked;
    }
}
