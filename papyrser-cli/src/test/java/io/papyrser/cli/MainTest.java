package io.papyrser.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.papyrser.io.PapyrusFilter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
  @TempDir Path tmp;

  private ByteArrayOutputStream outContent;
  private ByteArrayOutputStream errContent;
  private PrintStream originalOut;
  private PrintStream originalErr;
  private Path idp;
  private Path configFile;

  @BeforeEach
  void setUp() throws IOException {
    outContent = new ByteArrayOutputStream();
    errContent = new ByteArrayOutputStream();
    originalOut = System.out;
    originalErr = System.err;
    System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));

    idp = IdpTree.create(tmp.resolve("idp"));
    configFile =
        Files.writeString(
            tmp.resolve(PapyrserConfig.FILE_NAME),
            String.join(
                "\n",
                "target=100",
                "mainPath=" + tmp,
                "papyriDataPath=" + tmp.resolve("papyri_data"),
                "idpDataPath=" + idp,
                "tmIndexPath=" + tmp.resolve("tm_index.json")));
  }

  @AfterEach
  void tearDown() {
    System.setOut(originalOut);
    System.setErr(originalErr);
  }

  private int execute(String... args) {
    return new CommandLine(new Main()).execute(args);
  }

  private String getOutput() {
    return outContent.toString(StandardCharsets.UTF_8);
  }

  private String getError() {
    return errContent.toString(StandardCharsets.UTF_8);
  }

  private String file(String relative) {
    return idp.resolve(relative).toString();
  }

  @Test
  void convertPrintsText() {
    int exitCode = execute("convert", file("DDB_EpiDoc_XML/bgu/bgu.1/bgu.1.1.xml"));

    assertEquals(0, exitCode);
    assertEquals(IdpTree.CLEAN_TEXT, getOutput().strip());
  }

  @Test
  void convertPrintsJson() {
    int exitCode = execute("convert", "-f", "json", file("DCLP/1/300.xml"));

    assertEquals(0, exitCode);
    assertTrue(getOutput().contains("\"text_blocks\""));
    assertTrue(getOutput().contains("\"ΑΒΓ[---]ΔΕ\""));
  }

  @Test
  void convertMissingFile() {
    int exitCode = execute("convert", tmp.resolve("absent.xml").toString());

    assertEquals(1, exitCode);
    assertTrue(getError().contains("File not found"));
  }

  @Test
  void convertFailsOnUnsupportedSymbol() {
    int exitCode = execute("convert", file("DDB_EpiDoc_XML/cpr/cpr.1/cpr.1.1.xml"));

    assertEquals(1, exitCode);
    assertTrue(getError().contains("Error: "), getError());
    assertTrue(getError().contains("chi"), getError());
  }

  @Test
  void convertIgnoringIssues() {
    int exitCode = execute("convert", "-i", file("DDB_EpiDoc_XML/cpr/cpr.1/cpr.1.1.xml"));

    assertEquals(0, exitCode);
    assertEquals("ΜΙΣΘΟΥ", getOutput().strip());
  }

  @Test
  void convertRejectsUnknownFormat() {
    int exitCode = execute("convert", "-f", "xml", file("DCLP/1/300.xml"));

    assertEquals(CommandLine.ExitCode.USAGE, exitCode);
  }

  @Test
  void runUsesConfiguredTarget() {
    int exitCode = execute("-c", configFile.toString());

    assertEquals(0, exitCode, getError());
    assertTrue(getOutput().contains("Converted 1 of 1 TM numbers to export/100"));
    assertTrue(Files.exists(tmp.resolve("export/100/txt/100_bgu.1.1.txt")));
  }

  @Test
  void runWithTargets() {
    int exitCode = execute("-c", configFile.toString(), "run", "--no-json", "bgu");

    assertEquals(0, exitCode, getError());
    assertTrue(getOutput().contains("Converted 2 of 2 TM numbers to export/bgu"));
    assertTrue(Files.exists(tmp.resolve("export/bgu/txt/101_bgu.1.2.txt")));
    assertFalse(Files.exists(tmp.resolve("export/bgu/json")));
  }

  @Test
  void runWithFilter() {
    int exitCode =
        execute(
            "-c",
            configFile.toString(),
            "run",
            "--filter",
            "DCLP",
            "--title",
            "homer",
            "--filter-name",
            "homer");

    assertEquals(0, exitCode, getError());
    assertTrue(Files.exists(tmp.resolve("export/homer/txt/300_300.txt")));
  }

  @Test
  void runReportsInvalidTarget() {
    int exitCode = execute("-c", configFile.toString(), "run", "100", "bgu");

    assertEquals(1, exitCode);
    assertTrue(getError().contains("only TM numbers or only collection names"));
  }

  @Test
  void runCountsSkippedDocuments() {
    int exitCode = execute("-c", configFile.toString(), "run", "100", "200");

    assertEquals(0, exitCode, getError());
    assertTrue(getOutput().contains("Converted 1 of 2 TM numbers to export/100-200"));
  }

  @Test
  void indexCommand() {
    int exitCode = execute("-c", configFile.toString(), "index");

    assertEquals(0, exitCode, getError());
    assertTrue(getOutput().contains("Indexed 5 TM references"));
    assertTrue(Files.exists(tmp.resolve("tm_index.json")));
  }

  @Test
  void indexCommandWithoutData() throws IOException {
    Path empty =
        Files.writeString(
            tmp.resolve("empty.properties"), "idpDataPath=" + tmp.resolve("missing"));

    int exitCode = execute("-c", empty.toString(), "index");

    assertEquals(1, exitCode);
    assertTrue(getError().contains("Indexing failed"));
  }

  @Test
  void helpListsSubcommands() {
    int exitCode = execute("--help");

    assertEquals(0, exitCode);
    for (String command : List.of("run", "convert", "index", "download")) {
      assertTrue(getOutput().contains(command), command);
    }
  }

  @Test
  void runOptionsOverrideConfig() {
    Main.RunCommand run = new Main.RunCommand();
    new CommandLine(run).parseArgs("-i", "--update", "--no-txt", "bgu", "cpr");

    PapyrserConfig config = run.apply(PapyrserConfig.defaults(), run.targets);

    assertEquals("bgu,cpr", config.target());
    assertNull(config.filter());
    assertTrue(config.ignoreFormattingIssues());
    assertTrue(config.alwaysUpdateGithub());
    assertFalse(config.alwaysDoIndexing());
    assertTrue(config.writeToJson());
    assertFalse(config.writeToTxt());
  }

  @Test
  void filterOptions() {
    Main.RunCommand run = new Main.RunCommand();
    new CommandLine(run).parseArgs("--filter", "ALL", "--place", "Hermopolis", "--all-match");

    PapyrserConfig config = run.apply(PapyrserConfig.defaults(), run.targets);

    assertNotNull(config.filter());
    assertEquals(PapyrusFilter.Source.ALL, config.filter().source());
    assertFalse(config.filter().singleMatchSuffices());
    assertEquals("37203", config.target());
  }

  @Test
  void debugFromArguments() {
    assertTrue(Main.debugRequested(new String[] {"--debug", "run"}));
    assertFalse(Main.debugRequested(new String[] {"-c", configFile.toString(), "run"}));
  }

  @Test
  void debugFromConfigFile() throws IOException {
    Path debug = Files.writeString(tmp.resolve("debug.properties"), "debugMode=true");

    assertTrue(Main.debugRequested(new String[] {"-c", debug.toString()}));
    assertTrue(Main.debugRequested(new String[] {"--config=" + debug}));
  }
}
