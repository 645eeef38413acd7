package sokoban.checker;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Runs the checker against shell scripts standing in for the nuXmv binary. */
@EnabledOnOs({OS.LINUX, OS.MAC})
class NuXmvCheckerTest {

    private static Path fakeExecutable(Path dir, String body) throws Exception {
        Path script = dir.resolve("fake-nuxmv.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    @Test
    void testCapturesOutputAndExitCode(@TempDir Path dir) throws Exception {
        Path exe = fakeExecutable(dir, "echo \"args: $1 $3\"\necho \"    move = r\"\necho oops >&2\nexit 3");
        Path model = dir.resolve("board.smv");
        Files.writeString(model, "MODULE main\n", StandardCharsets.UTF_8);
        CheckerConfig config = new CheckerConfig(exe.toString(), 30_000, List.of("bdd"));

        CheckerRun run = new NuXmvChecker(config).check(model, "bdd", dir);

        assertThat(run.engine).isEqualTo("bdd");
        assertThat(run.exitCode).isEqualTo(3);
        assertThat(run.timedOut).isFalse();
        assertThat(run.output).contains("args: -source " + model, "move = r", "oops");
        assertThat(Files.readString(dir.resolve("nuxmv_bdd.out"), StandardCharsets.UTF_8)).isEqualTo(run.output);
        assertThat(Files.readString(dir.resolve("nuxmv_bdd.cmd"), StandardCharsets.UTF_8)).startsWith("set engine bdd\n");
    }

    @Test
    void testTimeoutKillsProcess(@TempDir Path dir) throws Exception {
        Path exe = fakeExecutable(dir, "echo started\nexec sleep 30");
        Path model = dir.resolve("board.smv");
        Files.writeString(model, "MODULE main\n", StandardCharsets.UTF_8);
        CheckerConfig config = new CheckerConfig(exe.toString(), 300, List.of("sat"));

        CheckerRun run = new NuXmvChecker(config).check(model, "sat", dir);

        assertThat(run.timedOut).isTrue();
        assertThat(run.exitCode).isEqualTo(-1);
        assertThat(run.runtimeMillis).isBetween(300L, 30_000L);
        // the killed process has exited, so its output is complete on disk
        assertThat(run.output).contains("started");
        assertThat(Files.readString(dir.resolve("nuxmv_sat.out"), StandardCharsets.UTF_8)).isEqualTo(run.output);
    }
}
