package com.vidnyan.conclint.domain.rule;

import com.vidnyan.conclint.domain.model.Location;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges per-task finding buffers into the final ordered list.
 * Findings are sorted by position then rule id, and exact (rule id, location)
 * duplicates keep their first occurrence. Rule failures all share the engine id and
 * the top of the file, so they are told apart by the failing rule named in their message.
 */
public final class FindingAggregator {

    private FindingAggregator() {
    }

    public static List<Finding> aggregate(Collection<? extends Collection<Finding>> buffers) {
        List<Finding> all = new ArrayList<>();
        buffers.forEach(all::addAll);
        all.sort(Finding.ORDER);

        Set<Key> seen = new HashSet<>();
        List<Finding> result = new ArrayList<>(all.size());
        for (Finding finding : all) {
            if (seen.add(Key.of(finding))) {
                result.add(finding);
            }
        }
        return List.copyOf(result);
    }

    private record Key(String ruleId, Location location, String failure) {

        static Key of(Finding finding) {
            String failure = Finding.RULE_FAILED_ID.equals(finding.ruleId()) ? finding.message() : null;
            return new Key(finding.ruleId(), finding.location(), failure);
        }
    }
}
