package com.setcubes.solver;

import com.setcubes.core.Puzzle;
import com.setcubes.exception.SetCubesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Checks many puzzles for solvability on a fixed pool of worker threads.
 * <p>
 * The search is stateless, so puzzles are fanned out without any coordination;
 * results come back in input order.
 */
public class BatchSolvabilityChecker {

    private static final Logger log = LoggerFactory.getLogger(BatchSolvabilityChecker.class);

    private final SolvabilitySearch search;
    private final SearchBudget budget;
    private final ExecutorService workers;

    public BatchSolvabilityChecker(SolvabilitySearch search, SearchBudget budget, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive");
        }
        this.search = search;
        this.budget = budget;
        this.workers = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        log.info("BatchSolvabilityChecker started with {} worker(s)", threads);
    }

    /**
     * Run a bounded existence check for each puzzle.
     *
     * @param puzzles puzzles to check
     * @return one outcome per puzzle, in the same order
     */
    public List<SearchOutcome> check(List<Puzzle> puzzles) {
        List<Callable<SearchOutcome>> tasks = new ArrayList<>(puzzles.size());
        for (Puzzle puzzle : puzzles) {
            tasks.add(() -> search.existsSolution(puzzle, budget));
        }

        long start = System.currentTimeMillis();
        List<SearchOutcome> outcomes = new ArrayList<>(puzzles.size());
        try {
            for (Future<SearchOutcome> future : workers.invokeAll(tasks)) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SetCubesException("Interrupted while checking " + puzzles.size() + " puzzles", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SetCubesException("Puzzle check failed", e.getCause());
        }

        long unsolvable = outcomes.stream().filter(o -> o == SearchOutcome.NOT_FOUND).count();
        long unknown = outcomes.stream().filter(o -> o == SearchOutcome.UNKNOWN).count();
        log.info("Checked {} puzzles in {}ms: {} unsolvable, {} undecided",
                puzzles.size(), System.currentTimeMillis() - start, unsolvable, unknown);
        return outcomes;
    }

    public void shutdown() {
        workers.shutdown();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return workers.awaitTermination(timeout, unit);
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "setcubes-solver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
