package io.papyrser.cli;

import io.papyrser.core.api.ConversionOptions;
import io.papyrser.core.api.D5Converter;
import io.papyrser.core.api.FormattingException;
import io.papyrser.core.api.PapyrserException;
import io.papyrser.core.api.TeiParseException;
import io.papyrser.core.api.UnsupportedSymbolException;
import io.papyrser.core.format.FormattedTranscription;
import io.papyrser.io.ExportWriter;
import io.papyrser.io.PapyriDownloader;
import io.papyrser.io.TeiReader;
import io.papyrser.io.TmExtractor;
import io.papyrser.io.TmIndex;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch conversion: makes sure idp.data and the TM index are present, resolves the configured
 * target to TM numbers and converts every file of every TM number.
 *
 * <p>Documents that fail are skipped with a message; the run itself only fails when its
 * prerequisites are missing.
 */
public final class ConversionRunner {
  private static final Logger log = LoggerFactory.getLogger(ConversionRunner.class);

  private final PapyrserConfig config;
  private final PapyriDownloader downloader;
  private final TeiReader reader = new TeiReader();
  private final D5Converter converter;

  /** Outcome of a run. */
  public record Summary(String exportDirectory, int targets, List<String> skipped) {
    public int converted() {
      return targets - skipped.size();
    }
  }

  /** TM numbers of a run and the export folder they are written to. */
  record Targets(String exportDirectory, List<Integer> tms) {}

  public ConversionRunner(PapyrserConfig config) {
    this(config, new PapyriDownloader());
  }

  ConversionRunner(PapyrserConfig config, PapyriDownloader downloader) {
    this.config = config;
    this.downloader = downloader;
    this.converter =
        new D5Converter(
            ConversionOptions.builder()
                .ignoreFormattingIssues(config.ignoreFormattingIssues())
                .debugMode(config.debugMode())
                .build());
  }

  public Summary run() throws IOException {
    Files.createDirectories(config.mainPath().resolve(ExportWriter.EXPORT));
    Files.createDirectories(config.papyriDataPath());
    if ((config.usesDownloadedData() && !Files.exists(config.idpDataPath()))
        || config.alwaysUpdateGithub()) {
      downloader.download(config.papyriDataPath(), config.tmIndexPath());
    }
    TmIndex index = prepareIndex();
    Targets targets = resolve(index);
    log.info("Set export directory to {}", targets.exportDirectory());
    ExportWriter writer = new ExportWriter(config.mainPath(), targets.exportDirectory());
    List<String> skipped = convertAll(targets.tms(), index, writer);
    Summary summary = new Summary(targets.exportDirectory(), targets.tms().size(), skipped);
    log.info(
        "Converted {} of {} TM numbers to {}",
        summary.converted(),
        summary.targets(),
        writer.exportRoot());
    return summary;
  }

  /** Loads the TM index, building it first when it is missing or rebuilding is requested. */
  TmIndex prepareIndex() throws IOException {
    if (!Files.exists(config.tmIndexPath()) || config.alwaysDoIndexing()) {
      TmIndex index = TmIndex.build(config.idpDataPath(), new TmExtractor(reader), threads());
      index.save(config.tmIndexPath());
      return index;
    }
    return TmIndex.load(config.tmIndexPath());
  }

  Targets resolve(TmIndex index) throws IOException {
    if (config.filter() != null) {
      return new Targets(
          config.filter().name(), config.filter().filter(config.idpDataPath(), reader, threads()));
    }
    List<String> items =
        Arrays.stream(config.target().split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    if (items.isEmpty()) {
      throw new IllegalArgumentException("No target configured");
    }
    long numeric = items.stream().filter(ConversionRunner::isNumber).count();
    if (numeric == items.size()) {
      List<Integer> tms =
          items.stream().map(Integer::valueOf).distinct().sorted().collect(Collectors.toList());
      String dir =
          tms.size() == 1
              ? tms.get(0).toString()
              : tms.get(0) + "-" + tms.get(tms.size() - 1);
      return new Targets(dir, tms);
    }
    if (numeric > 0) {
      throw new IllegalArgumentException(
          "Invalid target '"
              + config.target()
              + "': a list must either contain only TM numbers or only collection names");
    }
    return new Targets(String.join("-", items), collectionTms(items, index));
  }

  private List<Integer> collectionTms(List<String> collections, TmIndex index)
      throws IOException {
    Path ddb = config.idpDataPath().resolve(TmIndex.DDB);
    Set<String> available;
    try (Stream<Path> dirs = Files.list(ddb)) {
      available =
          dirs.filter(Files::isDirectory)
              .map(p -> p.getFileName().toString())
              .collect(Collectors.toSet());
    }
    List<Path> files = new ArrayList<>();
    for (String collection : collections) {
      String name = collection.toLowerCase(Locale.ROOT);
      if (available.contains(name)) {
        files.addAll(TmIndex.xmlFiles(ddb.resolve(name)));
      } else if (collections.size() == 1) {
        throw new IllegalArgumentException(
            "Collection " + collection + " not found. Please enter a valid collection name");
      } else {
        log.error("Collection {} not found", collection);
      }
    }
    return index.tmNumbersOf(files);
  }

  private static boolean isNumber(String s) {
    return s.chars().allMatch(Character::isDigit);
  }

  private List<String> convertAll(List<Integer> targets, TmIndex index, ExportWriter writer)
      throws IOException {
    List<Integer> tms = new ArrayList<>(new LinkedHashSet<>(targets));
    int cpus = Runtime.getRuntime().availableProcessors();
    List<String> skipped = new ArrayList<>();
    if (tms.size() <= cpus || config.debugMode()) {
      for (int tm : tms) {
        process(tm, index, writer).ifPresent(skipped::add);
      }
    } else {
      ExecutorService executor = Executors.newFixedThreadPool(cpus + 1);
      try {
        List<Future<Optional<String>>> futures = new ArrayList<>(tms.size());
        for (int tm : tms) {
          futures.add(executor.submit(() -> process(tm, index, writer)));
        }
        for (int i = 0; i < futures.size(); i++) {
          try {
            futures.get(i).get().ifPresent(skipped::add);
          } catch (ExecutionException e) {
            skipped.add("TM " + tms.get(i) + " failed: " + e.getCause().getMessage());
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("Conversion interrupted", e);
      } finally {
        executor.shutdownNow();
      }
    }
    skipped.forEach(log::warn);
    return skipped;
  }

  /**
   * Converts every file declaring {@code tm}.
   *
   * @return the reason the TM number was skipped, empty when all files were written
   */
  Optional<String> process(int tm, TmIndex index, ExportWriter writer) {
    List<Path> files = index.pathsFor(tm);
    if (files.isEmpty()) {
      return Optional.of("Could not find any XML file(s) associated with TM number " + tm + ".");
    }
    for (Path file : files) {
      String name = ExportWriter.baseName(file);
      if (config.debugMode()) {
        log.debug("Processing {} (TM {})", file, tm);
      }
      try {
        FormattedTranscription result = converter.convert(reader.read(file), Integer.toString(tm));
        if (result.isEmpty()) {
          log.debug("{} holds no text", file);
          continue;
        }
        if (config.writeToJson()) {
          writer.writeJson(tm, name, result);
        }
        if (config.writeToTxt()) {
          writer.writeTxt(tm, name, result);
        }
      } catch (UnsupportedSymbolException | FormattingException e) {
        return Optional.of("TM " + tm + " skipped due to formatting errors: " + e.getMessage());
      } catch (TeiParseException e) {
        return Optional.of("TM " + tm + " skipped: " + e.getMessage());
      } catch (PapyrserException | IOException e) {
        return Optional.of("TM " + tm + " failed in " + file + ": " + e.getMessage());
      }
    }
    return Optional.empty();
  }

  private static int threads() {
    return Runtime.getRuntime().availableProcessors() + 1;
  }
}
