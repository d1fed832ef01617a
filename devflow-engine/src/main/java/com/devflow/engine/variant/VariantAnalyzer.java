package com.devflow.engine.variant;

import com.devflow.process.model.Case;
import com.devflow.process.model.Variant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Groups cases by activity skeleton and ranks the resulting variants.
 *
 * <p>The dominant variant is the one with most cases. Among equal counts the variant whose first case comes
 * earliest in case-processing order wins; the ranking never depends on hash or arrival order.
 */
@Component
public class VariantAnalyzer {

    private static final Comparator<Group> RANKING =
            Comparator.comparingInt(Group::size).reversed().thenComparingInt(Group::firstOrdinal);

    public VariantSummary analyze(List<Case> cases) {
        Accumulator accumulator = new Accumulator();
        for (int ordinal = 0; ordinal < cases.size(); ordinal++) {
            accumulator.add(ordinal, cases.get(ordinal));
        }
        return rank(accumulator);
    }

    public VariantSummary rank(Accumulator accumulator) {
        List<Group> groups = new ArrayList<>(accumulator.groups.values());
        groups.sort(RANKING);
        List<Variant> variants = new ArrayList<>(groups.size());
        for (Group group : groups) {
            variants.add(group.toVariant());
        }
        return new VariantSummary(variants, accumulator.caseCount);
    }

    /**
     * Per-worker grouping state. Cases are recorded with their global ordinal so partial accumulators can be merged
     * in any order and still rank identically.
     */
    public static final class Accumulator {
        private final Map<List<String>, Group> groups = new HashMap<>();
        private int caseCount;

        public void add(int ordinal, Case c) {
            List<String> skeleton = c.activities();
            groups.computeIfAbsent(skeleton, Group::new).add(new Member(ordinal, c.caseId()));
            caseCount++;
        }

        public Accumulator merge(Accumulator other) {
            other.groups.forEach((skeleton, group) ->
                    groups.computeIfAbsent(skeleton, Group::new).members.addAll(group.members));
            caseCount += other.caseCount;
            return this;
        }

        public int caseCount() {
            return caseCount;
        }
    }

    private record Member(int ordinal, String caseId) {}

    private static final class Group {
        private final List<String> activities;
        private final List<Member> members = new ArrayList<>();

        Group(List<String> activities) {
            this.activities = activities;
        }

        void add(Member member) {
            members.add(member);
        }

        int size() {
            return members.size();
        }

        int firstOrdinal() {
            int first = Integer.MAX_VALUE;
            for (Member member : members) {
                first = Math.min(first, member.ordinal());
            }
            return first;
        }

        Variant toVariant() {
            List<String> caseIds = members.stream()
                    .sorted(Comparator.comparingInt(Member::ordinal))
                    .map(Member::caseId)
                    .toList();
            return new Variant(activities, caseIds);
        }
    }
}
