package sokoban.client;

import sokoban.checker.CheckerConfig;
import sokoban.checker.CheckerRun;
import sokoban.checker.ModelChecker;
import sokoban.checker.NuXmvChecker;
import sokoban.domain.Board;
import sokoban.domain.MoveSequence;
import sokoban.encoding.ModelSynthesizer;
import sokoban.simulation.ModelSimulator;
import sokoban.simulation.ReplayResult;
import sokoban.smv.SmvModule;
import sokoban.smv.SmvPrinter;
import sokoban.trace.NuXmvTraceDecoder;
import sokoban.trace.TraceDecoder;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Command-line entry point: compiles a board, runs the checker, decodes
 * its answer.
 *
 * Pipeline:
 * 1. Copy the board file into the output directory
 * 2. Parse the board and write board.smv
 * 3. Run the checker once per configured engine (bdd, then sat)
 * 4. Decode the first engine's output and replay it on the model
 * 5. Write solution.txt and print the extracted solution
 *
 * Debug output goes to stderr; the extracted solution goes to stdout.
 *
 * Usage: {@code Client <input_board.xsb> <output_directory>}
 */
public class Client {

    private static final String USAGE = "Usage: Client <input_board.xsb> <output_directory>";

    /** Result output stream */
    private final PrintStream out;

    /** Debug output stream */
    private final PrintStream debugOut;

    /** Checker configuration */
    private final CheckerConfig config;

    private final ModelChecker checker;
    private final TraceDecoder decoder;

    /**
     * Creates a new Client with standard streams, nuXmv and configuration from the environment.
     */
    public Client() {
        this(System.out, System.err, CheckerConfig.fromEnvironment());
    }

    /**
     * Creates a new Client with custom streams and config, using nuXmv.
     */
    public Client(PrintStream out, PrintStream debug, CheckerConfig config) {
        this(out, debug, config, new NuXmvChecker(config), new NuXmvTraceDecoder());
    }

    /**
     * Creates a new Client with every collaborator supplied (for testing).
     */
    public Client(PrintStream out, PrintStream debug, CheckerConfig config,
                  ModelChecker checker, TraceDecoder decoder) {
        this.out = out;
        this.debugOut = debug;
        this.config = config;
        this.checker = checker;
        this.decoder = decoder;
    }

    /**
     * Main entry point.
     *
     * @param args input board file and output directory
     */
    public static void main(String[] args) {
        if (args.length != 2) {
            System.err.println(USAGE);
            System.exit(1);
        }
        try {
            Client client = new Client();
            client.run(Paths.get(args[0]), Paths.get(args[1]));
        } catch (Exception e) {
            System.err.println("Client error: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }

    /**
     * Runs the whole pipeline.
     *
     * @param boardFile the XSB board
     * @param outputDir directory for the copied board, model, scripts, outputs and report
     * @return the report that was written to solution.txt
     * @throws IOException if a file cannot be read or written, or the checker cannot start
     * @throws MalformedBoardException if the board is not usable
     */
    public SolutionReport run(Path boardFile, Path outputDir) throws IOException {
        // Step 1: Prepare output directory
        Files.createDirectories(outputDir);
        Path boardCopy = outputDir.resolve(boardFile.getFileName().toString());
        if (!boardCopy.toAbsolutePath().normalize().equals(boardFile.toAbsolutePath().normalize())) {
            Files.copy(boardFile, boardCopy, StandardCopyOption.REPLACE_EXISTING);
        }

        // Step 2: Compile
        Board board = new BoardParser().parseFile(boardFile);
        if (CheckerConfig.isNormal()) {
            debugOut.println("[Client] Board " + board.getWidth() + "x" + board.getHeight()
                    + ", boxes: " + board.getNumBoxes() + ", targets: " + board.getNumTargets());
            debugOut.println(board.toGridString());
        }

        SmvModule module = new ModelSynthesizer(board).synthesize();
        Path modelFile = outputDir.resolve(CheckerConfig.MODEL_FILE_NAME);
        Files.writeString(modelFile, SmvPrinter.print(module), StandardCharsets.UTF_8);
        if (CheckerConfig.isNormal()) {
            debugOut.println("[Client] Model written to " + modelFile);
        }

        // Step 3: Check with every engine
        List<CheckerRun> runs = new ArrayList<>();
        for (String engine : config.getEngines()) {
            if (CheckerConfig.isMinimal()) {
                debugOut.println("[Client] Running " + checker.getName() + " with engine " + engine + "...");
            }
            CheckerRun run = checker.check(modelFile, engine, outputDir);
            runs.add(run);
            if (CheckerConfig.isMinimal()) {
                debugOut.println(String.format(Locale.ROOT, "[Client] %s (%s) finished in %.2f seconds",
                        checker.getName(), engine, run.runtimeSeconds()));
            }
        }

        // Step 4: Decode the first engine's answer
        Optional<MoveSequence> solution = decoder.decode(runs.get(0).output);
        ReplayResult replay = null;
        if (solution.isPresent()) {
            replay = new ModelSimulator(module).replay(solution.get());
            if (!replay.goalReached && CheckerConfig.isMinimal()) {
                debugOut.println("[Client] WARNING: decoded moves do not reach the goal: " + replay);
            }
        }

        // Step 5: Report
        SolutionReport report = new SolutionReport(solution.orElse(null), runs, replay);
        Path solutionFile = outputDir.resolve(CheckerConfig.SOLUTION_FILE_NAME);
        report.write(solutionFile);

        out.println("Extracted solution: " + report.solutionText());
        if (CheckerConfig.isNormal()) {
            debugOut.println("[Client] Solution file saved to " + solutionFile);
        }
        return report;
    }
}
