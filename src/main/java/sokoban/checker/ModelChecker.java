package sokoban.checker;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs an external model checker on a generated model file.
 *
 * Implementations block until the checker finishes or times out and
 * must not leave the checker process running when they return.
 */
public interface ModelChecker {

    /**
     * Checks the model's LTL specification with one engine.
     *
     * @param model the .smv file
     * @param engine engine name, e.g. "bdd" or "sat"
     * @param workDir directory for the command script and the captured output
     * @return the captured run
     * @throws IOException if the checker cannot be started or its files written
     */
    CheckerRun check(Path model, String engine, Path workDir) throws IOException;

    /**
     * @return the name of this checker (for logging)
     */
    String getName();
}
