package sokoban.checker;

/**
 * Result of one model checker invocation with one engine.
 */
public final class CheckerRun {

    public final String engine;

    /** Combined stdout and stderr */
    public final String output;

    /** Wall-clock time from process start to exit (or to the timeout) */
    public final long runtimeMillis;

    /** Process exit code, or -1 if it was killed on timeout */
    public final int exitCode;

    public final boolean timedOut;

    public CheckerRun(String engine, String output, long runtimeMillis, int exitCode, boolean timedOut) {
        this.engine = engine;
        this.output = output;
        this.runtimeMillis = runtimeMillis;
        this.exitCode = exitCode;
        this.timedOut = timedOut;
    }

    /**
     * @return runtime in seconds, for reports
     */
    public double runtimeSeconds() {
        return runtimeMillis / 1000.0;
    }

    @Override
    public String toString() {
        return "CheckerRun[engine=" + engine + ", runtimeMillis=" + runtimeMillis
                + ", exitCode=" + exitCode + ", timedOut=" + timedOut + "]";
    }
}
