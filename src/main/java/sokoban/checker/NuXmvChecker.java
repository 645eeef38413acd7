package sokoban.checker;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs nuXmv in batch mode: {@code nuXmv -source nuxmv_<engine>.cmd board.smv}.
 *
 * stderr is merged into stdout and redirected straight to
 * {@code nuxmv_<engine>.out} in the work directory. A non-zero exit code is not an error; the output is
 * still returned for decoding. On timeout the process is killed.
 */
public class NuXmvChecker implements ModelChecker {

    /** How long to wait for a killed process to exit */
    static final long KILL_WAIT_MS = 5_000;

    private final CheckerConfig config;
    private final CommandScriptWriter scriptWriter;

    public NuXmvChecker(CheckerConfig config) {
        this(config, new CommandScriptWriter());
    }

    public NuXmvChecker(CheckerConfig config, CommandScriptWriter scriptWriter) {
        this.config = config;
        this.scriptWriter = scriptWriter;
    }

    @Override
    public String getName() {
        return "nuXmv";
    }

    /**
     * @return the command line for one engine run
     */
    List<String> commandLine(Path script, Path model) {
        return List.of(config.getExecutable(), "-source", script.toString(), model.toString());
    }

    @Override
    public CheckerRun check(Path model, String engine, Path workDir) throws IOException {
        Path script = workDir.resolve("nuxmv_" + engine + ".cmd");
        Path outputFile = workDir.resolve("nuxmv_" + engine + ".out");
        scriptWriter.write(engine, script);

        ProcessBuilder builder = new ProcessBuilder(commandLine(script, model));
        builder.redirectErrorStream(true);
        builder.redirectOutput(outputFile.toFile());

        if (CheckerConfig.isNormal()) {
            System.err.println("[NuXmv] Running engine " + engine + ": " + String.join(" ", builder.command()));
        }

        long startTime = System.nanoTime();
        Process process = builder.start();
        boolean finished = false;
        try {
            finished = process.waitFor(config.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for nuXmv (" + engine + ")");
        } finally {
            if (!finished) {
                kill(process, engine);
            }
        }
        long runtime = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);

        int exitCode = finished ? process.exitValue() : -1;
        String output = Files.readString(outputFile, StandardCharsets.UTF_8);

        if (!finished && CheckerConfig.isMinimal()) {
            System.err.println("[NuXmv] Engine " + engine + " timed out after " + config.getTimeoutMs() + "ms");
        } else if (exitCode != 0 && CheckerConfig.isNormal()) {
            System.err.println("[NuXmv] Engine " + engine + " exited with code " + exitCode);
        }

        return new CheckerRun(engine, output, runtime, exitCode, !finished);
    }

    /**
     * Kills the process and waits up to {@link #KILL_WAIT_MS} for it to exit,
     * so its output file is complete before it is read.
     */
    private static void kill(Process process, String engine) {
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_MS, TimeUnit.MILLISECONDS) && CheckerConfig.isMinimal()) {
                System.err.println("[NuXmv] Engine " + engine + " still running " + KILL_WAIT_MS + "ms after kill");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
