package com.setcubes.line;

import com.setcubes.exception.IntegrationException;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Assignment of each token position of a line to a group.
 * <p>
 * Labels are canonical: the group of position 0 is 0, and each new group met while
 * scanning left to right gets the next label. Two partitions with the same shape
 * are therefore equal.
 */
public final class GroupPartition {

    private final int[] labels;
    private final int groupCount;

    private GroupPartition(int[] canonicalLabels, int groupCount) {
        this.labels = canonicalLabels;
        this.groupCount = groupCount;
    }

    /**
     * Build a partition from arbitrary labels; equal labels mean the same group.
     */
    public static GroupPartition of(int... labels) {
        int[] canonical = new int[labels.length];
        int[] seen = new int[labels.length];
        int[] assigned = new int[labels.length];
        int next = 0;
        for (int i = 0; i < labels.length; i++) {
            int found = -1;
            for (int j = 0; j < next; j++) {
                if (seen[j] == labels[i]) {
                    found = assigned[j];
                    break;
                }
            }
            if (found < 0) {
                seen[next] = labels[i];
                assigned[next] = next;
                found = next;
                next++;
            }
            canonical[i] = found;
        }
        return new GroupPartition(canonical, next);
    }

    /**
     * Every token in its own group.
     */
    public static GroupPartition singletons(int size) {
        int[] labels = new int[size];
        for (int i = 0; i < size; i++) {
            labels[i] = i;
        }
        return new GroupPartition(labels, size);
    }

    /**
     * Contiguous groups of the given sizes, left to right.
     */
    public static GroupPartition fromComposition(int... sizes) {
        int total = Arrays.stream(sizes).sum();
        int[] labels = new int[total];
        int position = 0;
        for (int group = 0; group < sizes.length; group++) {
            if (sizes[group] <= 0) {
                throw new IntegrationException("Group sizes must be positive: " + Arrays.toString(sizes));
            }
            for (int k = 0; k < sizes[group]; k++) {
                labels[position++] = group;
            }
        }
        return new GroupPartition(labels, sizes.length);
    }

    public int size() {
        return labels.length;
    }

    public int groupCount() {
        return groupCount;
    }

    public int groupOf(int position) {
        return labels[position];
    }

    /**
     * Positions belonging to the group, ascending.
     */
    public int[] members(int group) {
        return IntStream.range(0, labels.length)
                .filter(i -> labels[i] == group)
                .toArray();
    }

    public int groupSize(int group) {
        int count = 0;
        for (int label : labels) {
            if (label == group) {
                count++;
            }
        }
        return count;
    }

    public boolean isSingleton(int group) {
        return groupSize(group) == 1;
    }

    /**
     * Leftmost position of a group. With canonical labels this is the first occurrence.
     */
    public int leftmost(int group) {
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == group) {
                return i;
            }
        }
        throw new IntegrationException("No group " + group + " in " + this);
    }

    public boolean isContiguous() {
        for (int i = 1; i < labels.length; i++) {
            if (labels[i] != labels[i - 1] && labels[i] != labels[i - 1] + 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * The partition restricted to positions {@code [from, to)}.
     *
     * @return empty if a group has members both inside and outside the range
     */
    public Optional<GroupPartition> slice(int from, int to) {
        for (int i = 0; i < labels.length; i++) {
            boolean inside = i >= from && i < to;
            if (inside) {
                continue;
            }
            for (int j = from; j < to; j++) {
                if (labels[j] == labels[i]) {
                    return Optional.empty();
                }
            }
        }
        return Optional.of(of(Arrays.copyOfRange(labels, from, to)));
    }

    /**
     * This partition followed by another one; no group spans the seam.
     */
    public GroupPartition concat(GroupPartition other) {
        int[] joined = Arrays.copyOf(labels, labels.length + other.labels.length);
        for (int i = 0; i < other.labels.length; i++) {
            joined[labels.length + i] = groupCount + other.labels[i];
        }
        return new GroupPartition(joined, groupCount + other.groupCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupPartition other)) return false;
        return Arrays.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return Arrays.toString(labels);
    }
}
