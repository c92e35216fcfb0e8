package com.setcubes.solver;

import com.setcubes.line.GroupPartition;

import java.util.ArrayList;
import java.util.List;

/**
 * Contiguous groupings of a line.
 * <p>
 * Any contiguous grouping can be produced by some placement of tokens, so the solver
 * enumerates compositions of the line length instead of coordinates.
 */
final class Compositions {

    private Compositions() {
    }

    /**
     * All {@code 2^(length-1)} compositions of {@code length}; a single empty partition for 0.
     */
    static List<GroupPartition> of(int length) {
        if (length == 0) {
            return List.of(GroupPartition.singletons(0));
        }
        List<GroupPartition> result = new ArrayList<>(1 << (length - 1));
        // Bit i of cuts set means a group boundary between positions i and i + 1
        for (int cuts = (1 << (length - 1)) - 1; cuts >= 0; cuts--) {
            int[] labels = new int[length];
            int group = 0;
            for (int i = 1; i < length; i++) {
                if ((cuts & (1 << (i - 1))) != 0) {
                    group++;
                }
                labels[i] = group;
            }
            result.add(GroupPartition.of(labels));
        }
        return result;
    }
}
