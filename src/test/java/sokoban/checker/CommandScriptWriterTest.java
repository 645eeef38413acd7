package sokoban.checker;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandScriptWriterTest {

    @Test
    void testScript(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("nuxmv_sat.cmd");
        new CommandScriptWriter().write("sat", script);

        assertThat(Files.readString(script, StandardCharsets.UTF_8))
                .isEqualTo("set engine sat\ngo\ncheck_ltlspec -p \"F win\"\nquit");
    }

    @Test
    void testConfigDefaults() {
        CheckerConfig config = CheckerConfig.defaults();

        assertThat(config.getExecutable()).isEqualTo("nuXmv");
        assertThat(config.getEngines()).containsExactly("bdd", "sat");
        assertThat(config.getTimeoutMs()).isPositive();
    }
}
