package velab.ui;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import velab.program.Program;

class ElabConfigTest {
  @TempDir
  Path dir;

  File write(String content) throws IOException {
    File file = dir.resolve("config.yaml").toFile();
    Files.writeString(file.toPath(), content);
    return file;
  }

  @Test
  void testDefaults() throws IOException, DesignFormatException {
    ElabConfig config = ElabConfig.load(write(""));
    Assertions.assertTrue(config.typecheck);
    Assertions.assertEquals(Program.DEFAULT_MAX_LOOP_ITERATIONS, config.max_loop_iterations);
    Assertions.assertFalse(config.inline);
  }

  @Test
  void testLoad() throws IOException, DesignFormatException {
    ElabConfig config = ElabConfig.load(write("typecheck: false\nmax_loop_iterations: 12\ninline: true\n"));
    Assertions.assertFalse(config.typecheck);
    Assertions.assertEquals(12, config.max_loop_iterations);
    Assertions.assertTrue(config.inline);

    Program program = new Program().configure(config);
    Assertions.assertEquals(12, program.getMaxLoopIterations());
  }

  @Test
  void testUnknownKey() throws IOException {
    File file = write("max_iterations: 3\n");
    Assertions.assertThrows(DesignFormatException.class, () -> ElabConfig.load(file));
  }

  @ParameterizedTest
  @ValueSource(strings = {"0", "-4"})
  void testNonPositiveLimitRejectedOnLoad(String limit) throws IOException {
    File file = write("max_loop_iterations: " + limit + "\n");
    Assertions.assertThrows(DesignFormatException.class, () -> ElabConfig.load(file));
  }

  @Test
  void testInvalidLimit() {
    ElabConfig config = new ElabConfig();
    config.max_loop_iterations = 0;
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Program().configure(config));
  }
}
