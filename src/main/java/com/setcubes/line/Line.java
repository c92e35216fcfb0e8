package com.setcubes.line;

import com.setcubes.exception.IntegrationException;
import com.setcubes.token.Token;

import java.util.List;
import java.util.Optional;

/**
 * One line of a solution: tokens in left-to-right order plus their grouping.
 *
 * @param role      restriction or set-name
 * @param tokens    tokens ordered by ascending x
 * @param partition grouping of the token positions
 */
public record Line(LineRole role, List<Token> tokens, GroupPartition partition) {

    public Line {
        if (role == null) {
            throw new IntegrationException("Line role cannot be null");
        }
        tokens = List.copyOf(tokens);
        if (partition == null) {
            partition = GroupPartition.singletons(tokens.size());
        }
        if (partition.size() != tokens.size()) {
            throw new IntegrationException("Partition " + partition + " does not cover " + tokens.size() + " tokens");
        }
    }

    public static Line empty(LineRole role) {
        return new Line(role, List.of(), GroupPartition.singletons(0));
    }

    /**
     * A line with no multi-token groups: evaluated strictly left to right.
     */
    public static Line ungrouped(LineRole role, List<Token> tokens) {
        return new Line(role, tokens, GroupPartition.singletons(tokens.size()));
    }

    public static Line setName(List<Token> tokens, GroupPartition partition) {
        return new Line(LineRole.SET_NAME, tokens, partition);
    }

    public static Line restriction(List<Token> tokens, GroupPartition partition) {
        return new Line(LineRole.RESTRICTION, tokens, partition);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token token(int position) {
        return tokens.get(position);
    }

    /**
     * Tokens {@code [from, to)} with their own slice of the grouping.
     *
     * @return empty if a group straddles the cut
     */
    public Optional<Line> sub(int from, int to) {
        return partition.slice(from, to)
                .map(slice -> new Line(role, tokens.subList(from, to), slice));
    }

    /**
     * Token notation of the line; multi-token contiguous groups are bracketed.
     */
    public String notation() {
        StringBuilder sb = new StringBuilder();
        if (!partition.isContiguous()) {
            for (int i = 0; i < tokens.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(tokens.get(i).symbol()).append('#').append(partition.groupOf(i));
            }
            return sb.toString();
        }
        for (int i = 0; i < tokens.size(); i++) {
            int group = partition.groupOf(i);
            boolean grouped = !partition.isSingleton(group);
            boolean opens = grouped && (i == 0 || partition.groupOf(i - 1) != group);
            boolean closes = grouped && (i == tokens.size() - 1 || partition.groupOf(i + 1) != group);
            if (i > 0) sb.append(' ');
            if (opens) sb.append('[');
            sb.append(tokens.get(i).symbol());
            if (closes) sb.append(']');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return role + "(" + notation() + ")";
    }
}
