package io.papyrser.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
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
 * Maps TM numbers to the edition files of a local idp.data copy.
 *
 * <p>The index covers the {@code DCLP} and {@code DDB_EpiDoc_XML} trees and is persisted as a
 * JSON array of {@code {"tm": ..., "path": ...}} objects.
 */
public final class TmIndex {
  private static final Logger log = LoggerFactory.getLogger(TmIndex.class);

  public static final String DCLP = "DCLP";
  public static final String DDB = "DDB_EpiDoc_XML";

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  /** One file declaring one TM number. */
  public record Entry(int tm, String path) {}

  private final List<Entry> entries;
  private final Map<Integer, List<Path>> byTm;

  public TmIndex(List<Entry> entries) {
    this.entries = List.copyOf(entries);
    Map<Integer, List<Path>> map = new LinkedHashMap<>();
    for (Entry entry : this.entries) {
      List<Path> paths = map.computeIfAbsent(entry.tm(), k -> new ArrayList<>());
      Path path = Paths.get(entry.path());
      if (!paths.contains(path)) {
        paths.add(path);
      }
    }
    this.byTm = map;
  }

  /**
   * Indexes every XML file below {@code DCLP} and {@code DDB_EpiDoc_XML}.
   *
   * @param idpDataPath root of the idp.data copy
   * @param extractor reads TM numbers from a file
   * @param threads size of the worker pool
   * @return the index
   * @throws IOException if neither source tree holds any XML file
   */
  public static TmIndex build(Path idpDataPath, TmExtractor extractor, int threads)
      throws IOException {
    List<Path> files = new ArrayList<>();
    for (String source : List.of(DCLP, DDB)) {
      Path dir = idpDataPath.resolve(source);
      if (Files.isDirectory(dir)) {
        files.addAll(xmlFiles(dir));
      } else {
        log.error("Could not find {}", dir);
      }
    }
    if (files.isEmpty()) {
      throw new IOException(
          "Indexing failed: no XML files below "
              + idpDataPath
              + "; the directory must hold DCLP and DDB_EpiDoc_XML from papyri/idp.data");
    }
    log.info("Indexing {} files with {} threads", files.size(), threads);

    ExecutorService executor = Executors.newFixedThreadPool(Math.max(threads, 1));
    try {
      List<Future<List<Integer>>> futures = new ArrayList<>(files.size());
      for (Path file : files) {
        futures.add(executor.submit(() -> extractor.tmNumbers(file)));
      }
      List<Entry> entries = new ArrayList<>();
      for (int i = 0; i < files.size(); i++) {
        String path = files.get(i).toString();
        try {
          for (Integer tm : futures.get(i).get()) {
            entries.add(new Entry(tm, path));
          }
        } catch (ExecutionException e) {
          log.warn("Skipping {}: {}", path, e.getCause().getMessage());
        }
      }
      log.info("Indexed {} TM references", entries.size());
      return new TmIndex(entries);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Indexing interrupted", e);
    } finally {
      executor.shutdownNow();
    }
  }

  /** XML files below {@code dir}, sorted by path. */
  public static List<Path> xmlFiles(Path dir) throws IOException {
    try (Stream<Path> stream = Files.walk(dir)) {
      return stream
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(".xml"))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  public static TmIndex load(Path indexFile) throws IOException {
    try (Reader reader = Files.newBufferedReader(indexFile, StandardCharsets.UTF_8)) {
      List<Entry> entries = GSON.fromJson(reader, new TypeToken<List<Entry>>() {}.getType());
      return new TmIndex(entries == null ? List.of() : entries);
    } catch (JsonParseException e) {
      throw new IOException("Corrupt TM index " + indexFile + ": " + e.getMessage(), e);
    }
  }

  public void save(Path indexFile) throws IOException {
    Path parent = indexFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(indexFile, StandardCharsets.UTF_8)) {
      GSON.toJson(entries, writer);
    }
  }

  /** Files declaring {@code tm}, empty when the number is unknown. */
  public List<Path> pathsFor(int tm) {
    return Collections.unmodifiableList(byTm.getOrDefault(tm, List.of()));
  }

  /** TM numbers declared by any of {@code files}, in index order. */
  public List<Integer> tmNumbersOf(List<Path> files) {
    Set<Path> wanted = files.stream().map(TmIndex::canonical).collect(Collectors.toSet());
    return entries.stream()
        .filter(e -> wanted.contains(canonical(Paths.get(e.path()))))
        .map(Entry::tm)
        .distinct()
        .collect(Collectors.toList());
  }

  private static Path canonical(Path path) {
    return path.toAbsolutePath().normalize();
  }

  public List<Entry> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }
}
