package org.sensiblaw.semantic.identity;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set difference of two identity-hash collections. All three lists are sorted
 * lexicographically and duplicates collapse.
 */
public record IdentityDiff(List<String> added, List<String> removed, List<String> unchanged) {
    public IdentityDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        unchanged = List.copyOf(unchanged);
    }

    public static IdentityDiff of(Collection<String> oldHashes, Collection<String> newHashes) {
        Set<String> left = new TreeSet<>(oldHashes);
        Set<String> right = new TreeSet<>(newHashes);
        TreeSet<String> added = new TreeSet<>(right);
        added.removeAll(left);
        TreeSet<String> removed = new TreeSet<>(left);
        removed.removeAll(right);
        TreeSet<String> unchanged = new TreeSet<>(left);
        unchanged.retainAll(right);
        return new IdentityDiff(List.copyOf(added), List.copyOf(removed), List.copyOf(unchanged));
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
