package sokoban.client;

import sokoban.checker.CheckerRun;
import sokoban.domain.MoveSequence;
import sokoban.simulation.ReplayResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * What a pipeline run found: the decoded moves (if any), the per-engine
 * runtimes, and whether the moves actually reach the goal on the model.
 *
 * Rendered as the solution.txt file:
 * <pre>
 * rrDD
 * BDD engine runtime: 0.42 seconds
 * SAT engine runtime: 0.17 seconds
 * Replay: goal reached
 * </pre>
 */
public class SolutionReport {

    public static final String NO_SOLUTION = "There is no solution.";

    private final MoveSequence solution;
    private final List<CheckerRun> runs;
    private final ReplayResult replay;

    /**
     * @param solution decoded moves, or null if none were found
     * @param runs checker runs in engine order
     * @param replay replay of the solution, or null if there is no solution
     */
    public SolutionReport(MoveSequence solution, List<CheckerRun> runs, ReplayResult replay) {
        this.solution = solution;
        this.runs = Collections.unmodifiableList(new ArrayList<>(runs));
        this.replay = replay;
    }

    public Optional<MoveSequence> getSolution() {
        return Optional.ofNullable(solution);
    }

    public Optional<ReplayResult> getReplay() {
        return Optional.ofNullable(replay);
    }

    /**
     * @return the moves in LURD notation, or the no-solution sentence
     */
    public String solutionText() {
        return solution != null ? solution.toString() : NO_SOLUTION;
    }

    /**
     * @return the report as it is written to disk, newline-terminated
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(solutionText()).append('\n');
        for (CheckerRun run : runs) {
            sb.append(String.format(Locale.ROOT, "%s engine runtime: %.2f seconds",
                    run.engine.toUpperCase(Locale.ROOT), run.runtimeSeconds()));
            if (run.timedOut) {
                sb.append(" (timed out)");
            }
            sb.append('\n');
        }
        if (replay != null) {
            if (replay.goalReached) {
                sb.append("Replay: goal reached\n");
            } else {
                sb.append("Replay: goal not reached");
                if (!replay.allMovesApplied()) {
                    sb.append(" (move ").append(replay.firstBlockedMove + 1).append(" has no effect)");
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public void write(Path file) throws IOException {
        Files.writeString(file, render(), StandardCharsets.UTF_8);
    }
}
