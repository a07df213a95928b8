package io.papyrser.cli;

import io.papyrser.core.api.ConversionOptions;
import io.papyrser.core.api.D5Converter;
import io.papyrser.core.api.PapyrserException;
import io.papyrser.core.format.FormattedTranscription;
import io.papyrser.io.ExportWriter;
import io.papyrser.io.PapyriDownloader;
import io.papyrser.io.PapyrusFilter;
import io.papyrser.io.TeiReader;
import io.papyrser.io.TmExtractor;
import io.papyrser.io.TmIndex;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "papyrser",
    description = "Converts EpiDoc editions of Greek papyri to D5 plain text",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      Main.RunCommand.class,
      Main.ConvertCommand.class,
      Main.IndexCommand.class,
      Main.DownloadCommand.class
    })
public final class Main implements Callable<Integer> {
  static final String DEBUG_OPTION = "--debug";
  static final String CONFIG_OPTION = "--config";

  @CommandLine.Option(
      names = {"-c", CONFIG_OPTION},
      description = "Configuration file (default: ${DEFAULT-VALUE})",
      defaultValue = PapyrserConfig.FILE_NAME)
  Path configFile;

  @CommandLine.Option(
      names = DEBUG_OPTION,
      description = "Trace every conversion step to papyrser.log; disables parallel conversion")
  boolean debug;

  public static void main(String[] args) {
    // slf4j-simple reads its settings once, before the first logger is created
    if (debugRequested(args)) {
      enableDebugLogging();
    }
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    // no subcommand: convert the configured target
    return runWith(List.of(), new RunCommand());
  }

  static boolean debugRequested(String[] args) {
    Path config = Paths.get(PapyrserConfig.FILE_NAME);
    for (int i = 0; i < args.length; i++) {
      if (DEBUG_OPTION.equals(args[i])) {
        return true;
      }
      if ((CONFIG_OPTION.equals(args[i]) || "-c".equals(args[i])) && i + 1 < args.length) {
        config = Paths.get(args[i + 1]);
      } else if (args[i].startsWith(CONFIG_OPTION + "=")) {
        config = Paths.get(args[i].substring(CONFIG_OPTION.length() + 1));
      }
    }
    if (!Files.isRegularFile(config)) {
      return false;
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(config)) {
      props.load(reader);
    } catch (IOException e) {
      return false;
    }
    return Boolean.parseBoolean(props.getProperty("debugMode", "false"));
  }

  static void enableDebugLogging() {
    System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    System.setProperty("org.slf4j.simpleLogger.logFile", "papyrser.log");
    System.setProperty("org.slf4j.simpleLogger.showDateTime", "true");
  }

  PapyrserConfig config() throws IOException {
    PapyrserConfig config = PapyrserConfig.load(configFile);
    return debug
        ? config.withFlags(
            true,
            config.ignoreFormattingIssues(),
            config.alwaysUpdateGithub(),
            config.alwaysDoIndexing())
        : config;
  }

  Integer runWith(List<String> targets, RunCommand options) {
    try {
      PapyrserConfig config = options.apply(config(), targets);
      ConversionRunner.Summary summary = new ConversionRunner(config).run();
      System.out.printf(
          "Converted %d of %d TM numbers to export/%s%n",
          summary.converted(), summary.targets(), summary.exportDirectory());
      return 0;
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  @CommandLine.Command(
      name = "run",
      description = "Convert a TM number, TM numbers, DDB collections or a filtered selection",
      mixinStandardHelpOptions = true)
  static final class RunCommand implements Callable<Integer> {
    @CommandLine.ParentCommand Main parent;

    @CommandLine.Parameters(
        arity = "0..*",
        paramLabel = "TARGET",
        description = "TM numbers or DDB collection names; overrides the configured target")
    List<String> targets = new ArrayList<>();

    @CommandLine.Option(
        names = "--filter",
        description = "Select by metadata from DCLP, DDB or ALL instead of a target")
    PapyrusFilter.Source filterSource;

    @CommandLine.Option(names = "--title", description = "Title substring")
    String title;

    @CommandLine.Option(names = "--place", description = "Place of origin substring")
    String place;

    @CommandLine.Option(names = "--dclp-hybrid", description = "DCLP hybrid identifier substring")
    String dclpHybrid;

    @CommandLine.Option(
        names = "--all-match",
        description = "Every given filter criterion must match")
    boolean allMatch;

    @CommandLine.Option(names = "--filter-name", description = "Export directory of the filter")
    String filterName;

    @CommandLine.Option(
        names = {"-i", "--ignore-formatting-issues"},
        description = "Write output despite formatting issues")
    boolean ignoreFormattingIssues;

    @CommandLine.Option(names = "--update", description = "Download idp.data before converting")
    boolean update;

    @CommandLine.Option(names = "--reindex", description = "Rebuild the TM index")
    boolean reindex;

    @CommandLine.Option(names = "--no-json", description = "Do not write JSON output")
    boolean noJson;

    @CommandLine.Option(names = "--no-txt", description = "Do not write text output")
    boolean noTxt;

    @Override
    public Integer call() {
      return parent.runWith(targets, this);
    }

    PapyrserConfig apply(PapyrserConfig config, List<String> targetArgs) {
      PapyrserConfig result =
          config
              .withFlags(
                  config.debugMode(),
                  config.ignoreFormattingIssues() || ignoreFormattingIssues,
                  config.alwaysUpdateGithub() || update,
                  config.alwaysDoIndexing() || reindex)
              .withOutputs(config.writeToJson() && !noJson, config.writeToTxt() && !noTxt);
      if (filterSource != null) {
        PapyrusFilter filter =
            PapyrusFilter.builder(filterSource)
                .title(title)
                .place(place)
                .dclpHybrid(dclpHybrid)
                .singleMatchSuffices(!allMatch)
                .name(filterName)
                .build();
        return result.withTarget(result.target(), filter);
      }
      if (!targetArgs.isEmpty()) {
        return result.withTarget(String.join(",", targetArgs), null);
      }
      return result;
    }
  }

  @CommandLine.Command(
      name = "convert",
      description = "Convert a single TEI file and print the result",
      mixinStandardHelpOptions = true)
  static final class ConvertCommand implements Callable<Integer> {
    enum Format {
      txt,
      json
    }

    @CommandLine.ParentCommand Main parent;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "EpiDoc XML file")
    Path file;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "txt")
    Format format;

    @CommandLine.Option(
        names = {"-i", "--ignore-formatting-issues"},
        description = "Print output despite formatting issues")
    boolean ignoreFormattingIssues;

    @Override
    public Integer call() {
      if (!Files.exists(file)) {
        System.err.println("Error: File not found: " + file);
        return 1;
      }
      ConversionOptions options =
          ConversionOptions.builder()
              .ignoreFormattingIssues(ignoreFormattingIssues)
              .debugMode(parent != null && parent.debug)
              .build();
      try {
        FormattedTranscription result =
            new D5Converter(options).convert(new TeiReader().read(file), null);
        if (format == Format.json) {
          System.out.println(ExportWriter.toJsonString(result));
        } else {
          System.out.println(String.join("\n", result.lines()));
        }
        return 0;
      } catch (PapyrserException | IOException e) {
        System.err.println("Error: " + e.getMessage());
        return 1;
      }
    }
  }

  @CommandLine.Command(
      name = "index",
      description = "Rebuild the TM index of the local idp.data copy",
      mixinStandardHelpOptions = true)
  static final class IndexCommand implements Callable<Integer> {
    @CommandLine.ParentCommand Main parent;

    @Override
    public Integer call() {
      try {
        PapyrserConfig config = parent.config();
        TmIndex index =
            TmIndex.build(
                config.idpDataPath(),
                new TmExtractor(new TeiReader()),
                Runtime.getRuntime().availableProcessors() + 1);
        index.save(config.tmIndexPath());
        System.out.printf("Indexed %d TM references to %s%n", index.size(), config.tmIndexPath());
        return 0;
      } catch (IOException e) {
        System.err.println("Error: " + e.getMessage());
        return 1;
      }
    }
  }

  @CommandLine.Command(
      name = "download",
      description = "Download the idp.data archive from GitHub",
      mixinStandardHelpOptions = true)
  static final class DownloadCommand implements Callable<Integer> {
    @CommandLine.ParentCommand Main parent;

    @Override
    public Integer call() {
      try {
        PapyrserConfig config = parent.config();
        int files = new PapyriDownloader().download(config.papyriDataPath(), config.tmIndexPath());
        System.out.printf("Extracted %d files to %s%n", files, config.papyriDataPath());
        return 0;
      } catch (IOException e) {
        System.err.println("Error: " + e.getMessage());
        return 1;
      }
    }
  }
}
