package com.setcubes.solver;

import com.setcubes.card.CardSet;
import com.setcubes.card.Universe;
import com.setcubes.core.Puzzle;
import com.setcubes.evaluation.EvaluationResult;
import com.setcubes.evaluation.ExpressionEvaluator;
import com.setcubes.evaluation.RestrictionEvaluator;
import com.setcubes.line.GroupPartition;
import com.setcubes.line.Line;
import com.setcubes.line.LineRole;
import com.setcubes.syntax.SyntaxValidator;
import com.setcubes.token.Operator;
import com.setcubes.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Exhaustive search over every arrangement of a token pool.
 * <p>
 * For each sub-multiset of the pool (by ascending size) the search walks:
 * <ol>
 *   <li>distinct permutations, same-valued tokens being interchangeable, abandoning
 *       prefixes the {@link ArrangementAutomaton} rejects;</li>
 *   <li>every cut into a restriction line holding the one restriction operator and a
 *       non-empty set-name line, or no cut when there is no restriction operator;</li>
 *   <li>every contiguous grouping of each side, the restriction operator always alone;</li>
 *   <li>every resolution of the wildcards.</li>
 * </ol>
 * Each fully specified candidate is validated and evaluated with the same evaluators the
 * live board uses.
 */
public class ExhaustiveSolvabilitySearch implements SolvabilitySearch {

    private static final Logger log = LoggerFactory.getLogger(ExhaustiveSolvabilitySearch.class);

    private final SyntaxValidator validator;
    private final ExpressionEvaluator evaluator;
    private final RestrictionEvaluator restrictionEvaluator;

    public ExhaustiveSolvabilitySearch(SyntaxValidator validator,
                                       ExpressionEvaluator evaluator,
                                       RestrictionEvaluator restrictionEvaluator) {
        this.validator = validator;
        this.evaluator = evaluator;
        this.restrictionEvaluator = restrictionEvaluator;
    }

    @Override
    public ShortestSolution shortestSolution(Puzzle puzzle, SearchBudget budget) {
        Search search = new Search(puzzle, budget.start());
        Solution[] first = new Solution[1];
        search.run(solution -> {
            first[0] = solution;
            return true;
        });

        ShortestSolution result;
        if (first[0] != null) {
            result = ShortestSolution.found(first[0]);
        } else if (search.tracker.exhausted()) {
            result = ShortestSolution.unknown();
        } else {
            result = ShortestSolution.notFound();
        }
        log.debug("Shortest solution for goal {}: {} after {} candidates ({})",
                puzzle.goal(), result.outcome(), search.tracker.steps(),
                first[0] != null ? first[0] : "no witness");
        return result;
    }

    @Override
    public SolutionStats solutionStats(Puzzle puzzle, SearchBudget budget) {
        Search search = new Search(puzzle, budget.start());
        long[] count = new long[1];
        int[] shortest = {0};
        int[] longest = {0};
        search.run(solution -> {
            int length = solution.tokenCount();
            if (count[0] == 0 || length < shortest[0]) {
                shortest[0] = length;
            }
            longest[0] = Math.max(longest[0], length);
            count[0]++;
            log.trace("Solution #{}: {}", count[0], solution);
            return false;
        });

        SolutionStats stats = new SolutionStats(count[0], shortest[0], longest[0],
                !search.tracker.exhausted(), search.tracker.steps());
        log.debug("Solution stats for goal {}: {}", puzzle.goal(), stats);
        return stats;
    }

    /** Receives each solution; returns true to stop the search. */
    @FunctionalInterface
    private interface SolutionVisitor {
        boolean visit(Solution solution);
    }

    /**
     * State of one search call. Never shared between calls or threads.
     */
    private final class Search {

        private final Universe universe;
        private final int goal;
        private final SearchBudget.Tracker tracker;
        private final ArrangementAutomaton automaton;
        private final Token[] values;
        private final int[] available;
        private final int requiredIndex;
        private final boolean solvable;
        private final List<List<GroupPartition>> compositions = new ArrayList<>();

        private SolutionVisitor visitor;
        private boolean stopped;

        Search(Puzzle puzzle, SearchBudget.Tracker tracker) {
            this.universe = puzzle.universe();
            this.goal = puzzle.goal();
            this.tracker = tracker;
            boolean restrictions = puzzle.pool().restrictionsEnabled();
            this.automaton = new ArrangementAutomaton(restrictions);

            // With restrictions disabled their operators never leave the pool
            List<Token> usable = new ArrayList<>();
            List<Integer> counts = new ArrayList<>();
            for (Map.Entry<Token, Integer> entry : puzzle.pool().counts().entrySet()) {
                if (restrictions || !entry.getKey().isRestriction()) {
                    usable.add(entry.getKey());
                    counts.add(entry.getValue());
                }
            }
            this.values = usable.toArray(new Token[0]);
            this.available = counts.stream().mapToInt(Integer::intValue).toArray();

            Token required = puzzle.pool().required().orElse(null);
            this.requiredIndex = required == null ? -1 : usable.indexOf(required);
            boolean hasOperand = usable.stream().anyMatch(Token::isOperand);
            this.solvable = hasOperand && (required == null || requiredIndex >= 0);
            if (!solvable) {
                log.debug("Pool {} cannot produce any solution", puzzle.pool());
            }
        }

        void run(SolutionVisitor visitor) {
            if (!solvable) {
                return;
            }
            this.visitor = visitor;
            int total = Arrays.stream(available).sum();
            for (int size = 1; size <= total && !stopped; size++) {
                subsets(0, size, new int[values.length]);
            }
        }

        private void subsets(int valueIndex, int remaining, int[] chosen) {
            if (stopped) {
                return;
            }
            if (valueIndex == values.length) {
                if (remaining == 0 && (requiredIndex < 0 || chosen[requiredIndex] > 0)) {
                    int size = Arrays.stream(chosen).sum();
                    permute(chosen.clone(), new Token[size], 0, ArrangementAutomaton.START);
                }
                return;
            }
            for (int count = Math.min(available[valueIndex], remaining); count >= 0; count--) {
                chosen[valueIndex] = count;
                subsets(valueIndex + 1, remaining - count, chosen);
            }
            chosen[valueIndex] = 0;
        }

        private void permute(int[] remaining, Token[] sequence, int depth, int states) {
            if (stopped) {
                return;
            }
            if (depth == sequence.length) {
                if (automaton.accepts(states)) {
                    arrangements(List.of(sequence));
                }
                return;
            }
            for (int v = 0; v < values.length; v++) {
                if (remaining[v] == 0) {
                    continue;
                }
                int next = automaton.step(states, values[v]);
                if (next == ArrangementAutomaton.REJECTED) {
                    continue;
                }
                remaining[v]--;
                sequence[depth] = values[v];
                permute(remaining, sequence, depth + 1, next);
                remaining[v]++;
            }
        }

        private void arrangements(List<Token> sequence) {
            int restriction = -1;
            for (int i = 0; i < sequence.size(); i++) {
                if (sequence.get(i).isRestriction()) {
                    restriction = i;
                    break;
                }
            }
            if (restriction < 0) {
                setNames(Line.empty(LineRole.RESTRICTION), universe.all(), sequence);
                return;
            }
            for (int cut = restriction + 2; cut < sequence.size() && !stopped; cut++) {
                restrictions(sequence.subList(0, cut), restriction, sequence.subList(cut, sequence.size()));
            }
        }

        private void restrictions(List<Token> tokens, int operatorPosition, List<Token> setNameTokens) {
            for (List<Token> resolved : resolutions(tokens)) {
                if (!validator.isValidRestriction(Line.ungrouped(LineRole.RESTRICTION, resolved))) {
                    continue;
                }
                for (GroupPartition left : compositions(operatorPosition)) {
                    for (GroupPartition right : compositions(tokens.size() - operatorPosition - 1)) {
                        if (stopped || !step()) {
                            return;
                        }
                        GroupPartition partition = left
                                .concat(GroupPartition.singletons(1))
                                .concat(right);
                        Line line = Line.restriction(resolved, partition);
                        EvaluationResult violators = restrictionEvaluator.violators(line, universe);
                        if (!violators.isValid()) {
                            continue;
                        }
                        setNames(line, violators.cards().complementWithin(universe.all()), setNameTokens);
                    }
                }
            }
        }

        private void setNames(Line restriction, CardSet active, List<Token> tokens) {
            for (List<Token> resolved : resolutions(tokens)) {
                if (!validator.isValidExpression(resolved)) {
                    continue;
                }
                for (GroupPartition partition : compositions(tokens.size())) {
                    if (stopped || !step()) {
                        return;
                    }
                    Line line = Line.setName(resolved, partition);
                    EvaluationResult result = evaluator.evaluate(line, universe, active);
                    if (result.hasSize(goal) && visitor.visit(new Solution(restriction, line, result.cards()))) {
                        stopped = true;
                        return;
                    }
                }
            }
        }

        private boolean step() {
            if (tracker.tryStep()) {
                return true;
            }
            stopped = true;
            return false;
        }

        private List<GroupPartition> compositions(int length) {
            while (compositions.size() <= length) {
                compositions.add(Compositions.of(compositions.size()));
            }
            return compositions.get(length);
        }

        /**
         * Every way of resolving the wildcards among the tokens.
         */
        private List<List<Token>> resolutions(List<Token> tokens) {
            int[] wildcards = IntStream.range(0, tokens.size())
                    .filter(i -> tokens.get(i).isUnresolved())
                    .toArray();
            if (wildcards.length == 0) {
                return List.of(tokens);
            }
            List<Operator> choices = Operator.WILDCARD_CHOICES;
            int combinations = (int) Math.pow(choices.size(), wildcards.length);
            List<List<Token>> result = new ArrayList<>(combinations);
            for (int combination = 0; combination < combinations; combination++) {
                List<Token> resolved = new ArrayList<>(tokens);
                int digits = combination;
                for (int position : wildcards) {
                    resolved.set(position, tokens.get(position).resolve(choices.get(digits % choices.size())));
                    digits /= choices.size();
                }
                result.add(resolved);
            }
            return result;
        }
    }
}
