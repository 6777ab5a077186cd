package ca.gc.cra.blog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter printed;

  @BeforeEach
  void captureOutput() {
    printed = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(printed, true));
  }

  @AfterEach
  void restore() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(printed.toString().contains("pipe"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(printed.toString().contains("usage: blog pipe"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"tail"}));
  }

  @Test
  void pipeHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"pipe", "--help"}));
    assertTrue(printed.toString().contains("BLOG pipe"));
  }
}
