package org.proplogic;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

  String output() {
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  void evaluatesUnderAssignment() {
    assertEquals(0, Main.run(new String[] {"-e", "a and not b", "-a", "a=1,b=0"}, out));
    assertThat(output(), containsString("[I] Formula: (a ∧ ¬b)"));
    assertThat(output(), containsString("[I] Valutazione con {a=true, b=false}: 1"));
    assertThat(output(), not(containsString("Tabella")));
  }

  @Test
  void defaultOutputShowsLinearFormAndTable() {
    assertEquals(0, Main.run(new String[] {"-e", "p ∨ ¬p"}, out));
    assertThat(output(), containsString("[I] Forma lineare: pp¬∨"));
    assertThat(output(), containsString("p | =\n"));
    assertThat(output(), containsString("[I] Tautologia"));
  }

  @Test
  void reportsParseErrorsWithPosition() {
    assertEquals(1, Main.run(new String[] {"-e", "∧ a"}, out));
    assertThat(output(), containsString("[E] Formula non valida: malformed binary operator (posizione 0)"));
  }

  @Test
  void reportsTablesOverTheLimit() {
    assertEquals(0, Main.run(new String[] {"-e", "a ∧ b ∧ c ∧ d ∧ e", "-tt"}, out));
    assertThat(output(), containsString("[W] Tabella di verità non generata"));
  }

  @Test
  void readsFormulaFromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("formula.txt");
    Files.writeString(file, "  p -> q \n", StandardCharsets.UTF_8);

    assertEquals(0, Main.run(new String[] {"-f", file.toString(), "-rpn"}, out));
    assertThat(output(), containsString("[I] Formula letta: p -> q"));
    assertThat(output(), containsString("[I] Forma lineare: pq→"));
  }

  @Test
  void helpAndInvalidArguments() {
    assertEquals(0, Main.run(new String[] {"-h"}, out));
    assertThat(output(), containsString("USO:"));

    assertEquals(1, Main.run(new String[0], out));
    assertEquals(1, Main.run(new String[] {"-x"}, out));
    assertThat(output(), containsString("Parametro sconosciuto: -x"));
    assertEquals(1, Main.run(new String[] {"-tt"}, out));
    assertEquals(1, Main.run(new String[] {"-e", "a", "-e", "b"}, out));
    assertEquals(1, Main.run(new String[] {"-f", "/percorso/inesistente.txt"}, out));
  }

  @Test
  void parsesAssignments() {
    Main.ArgumentParser parser = new Main.ArgumentParser();

    Map<String, Boolean> assignment = parser.parseAssignment("p=1, q=Falso,r=T");
    assertEquals(Map.of("p", true, "q", false, "r", true), assignment);

    assertThrows(IllegalArgumentException.class, () -> parser.parseAssignment("p"));
    assertThrows(IllegalArgumentException.class, () -> parser.parseAssignment("p=forse"));
    assertThrows(IllegalArgumentException.class, () -> parser.parseAssignment("=1"));
  }
}
