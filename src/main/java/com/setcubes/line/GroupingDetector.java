package com.setcubes.line;

import com.setcubes.exception.IntegrationException;
import com.setcubes.token.PlacedToken;
import com.setcubes.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Derives a line's grouping from where its tokens were placed.
 * <p>
 * Two tokens touch when both their horizontal and vertical distance is below
 * {@code tokenExtent + touchTolerance}. Groups are the connected components of the
 * touching relation. This is the only class that reads token positions.
 */
public class GroupingDetector {

    private static final Logger log = LoggerFactory.getLogger(GroupingDetector.class);

    public static final double DEFAULT_TOKEN_EXTENT = 80;
    public static final double DEFAULT_TOUCH_TOLERANCE = 15;

    private final double tokenExtent;
    private final double touchTolerance;

    public GroupingDetector() {
        this(DEFAULT_TOKEN_EXTENT, DEFAULT_TOUCH_TOLERANCE);
    }

    public GroupingDetector(double tokenExtent, double touchTolerance) {
        if (tokenExtent <= 0 || touchTolerance < 0) {
            throw new IntegrationException("Invalid grouping geometry: extent=" + tokenExtent
                    + ", tolerance=" + touchTolerance);
        }
        this.tokenExtent = tokenExtent;
        this.touchTolerance = touchTolerance;
    }

    /**
     * Order placed tokens by x and derive their grouping.
     *
     * @param role   role of the line
     * @param placed tokens with positions, in any order
     * @return line with tokens in x order
     */
    public Line place(LineRole role, List<PlacedToken> placed) {
        List<PlacedToken> sorted = placed.stream()
                .sorted(Comparator.comparingDouble(PlacedToken::x))
                .toList();
        List<Token> tokens = sorted.stream().map(PlacedToken::token).toList();
        GroupPartition partition = detect(sorted);
        Line line = new Line(role, tokens, partition);
        log.trace("Placed {} tokens into {}", placed.size(), line);
        return line;
    }

    /**
     * Group tokens that are already in x order.
     */
    public GroupPartition detect(List<PlacedToken> sortedByX) {
        int n = sortedByX.size();
        int[] labels = new int[n];
        boolean[] visited = new boolean[n];
        int group = 0;

        for (int start = 0; start < n; start++) {
            if (visited[start]) {
                continue;
            }
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int current = queue.poll();
                labels[current] = group;
                for (int j = 0; j < n; j++) {
                    if (!visited[j] && touching(sortedByX.get(current), sortedByX.get(j))) {
                        visited[j] = true;
                        queue.add(j);
                    }
                }
            }
            group++;
        }
        return GroupPartition.of(labels);
    }

    boolean touching(PlacedToken a, PlacedToken b) {
        double reach = tokenExtent + touchTolerance;
        return Math.abs(a.x() - b.x()) < reach && Math.abs(a.y() - b.y()) < reach;
    }

    public double tokenExtent() {
        return tokenExtent;
    }

    public double touchTolerance() {
        return touchTolerance;
    }
}
