package sokoban.checker;

import sokoban.encoding.Vocabulary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the nuXmv batch script that selects an engine, builds the model
 * and checks the goal property.
 */
public class CommandScriptWriter {

    /**
     * @param engine engine name passed to "set engine"
     * @return the script lines
     */
    public List<String> commands(String engine) {
        return List.of(
                "set engine " + engine,
                "go",
                "check_ltlspec -p \"F " + Vocabulary.WIN + "\"",
                "quit");
    }

    /**
     * Writes the script for an engine.
     *
     * @param engine engine name
     * @param file destination
     * @throws IOException if the file cannot be written
     */
    public void write(String engine, Path file) throws IOException {
        Files.writeString(file, String.join("\n", commands(engine)), StandardCharsets.UTF_8);
    }
}
