package sokoban.trace;

import sokoban.checker.CheckerConfig;
import sokoban.domain.Move;
import sokoban.domain.MoveSequence;
import sokoban.encoding.Vocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes nuXmv's counterexample listing.
 *
 * Two tiers, first match wins:
 * 1. an explicit "Solution: LURD moves: rrDD" annotation, taken verbatim;
 * 2. every "move = X" line of the trace, in order, keeping X only if it is
 *    a single LURD symbol.
 *
 * nuXmv lists only the variables that changed between states, so two equal
 * consecutive moves appear once in the trace.
 */
public class NuXmvTraceDecoder implements TraceDecoder {

    private static final Pattern SOLUTION_PATTERN =
            Pattern.compile("Solution:\\s*LURD moves:\\s*([" + Move.ALPHABET + "]+)");

    private static final Pattern ASSIGNMENT_PATTERN =
            Pattern.compile("(?<![\\w.\\[])" + Vocabulary.MOVE + "\\s*=\\s*(\\S+)\\s*$");

    @Override
    public Optional<MoveSequence> decode(String checkerOutput) {
        if (checkerOutput == null || checkerOutput.isEmpty()) {
            return Optional.empty();
        }

        // Tier 1: explicit annotation
        Matcher solution = SOLUTION_PATTERN.matcher(checkerOutput);
        if (solution.find()) {
            return Optional.of(MoveSequence.parse(solution.group(1)));
        }

        // Tier 2: move selector assignments in trace order
        List<Move> moves = new ArrayList<>();
        for (String line : checkerOutput.split("\\R")) {
            Matcher assignment = ASSIGNMENT_PATTERN.matcher(line);
            if (!assignment.find()) {
                continue;
            }
            String value = assignment.group(1);
            if (value.length() == 1 && Move.isSymbol(value.charAt(0))) {
                moves.add(Move.fromSymbol(value.charAt(0)));
            } else if (CheckerConfig.isVerbose()) {
                System.err.println("[NuXmvTraceDecoder] Skipping non-move value '" + value + "'");
            }
        }

        if (moves.isEmpty()) {
            if (CheckerConfig.isNormal()) {
                System.err.println("[NuXmvTraceDecoder] No solution annotation or move assignment found");
            }
            return Optional.empty();
        }
        return Optional.of(new MoveSequence(moves));
    }
}
