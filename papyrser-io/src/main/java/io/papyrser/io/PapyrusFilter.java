package io.papyrser.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

/**
 * Selects editions by metadata: a case-insensitive substring of the title, the place of origin
 * or, for DCLP files, the dclp-hybrid identifier.
 *
 * @param source which trees of idp.data to search
 * @param title substring of {@code titleStmt/title}, may be null
 * @param place substring of {@code origin/origPlace}, may be null
 * @param dclpHybrid substring of {@code idno[@type="dclp-hybrid"]}, ignored for DDB
 * @param singleMatchSuffices whether one matching criterion selects a file; otherwise all criteria
 *     that are set must match
 * @param name export directory name, derived from the criteria when null
 */
public record PapyrusFilter(
    Source source,
    String title,
    String place,
    String dclpHybrid,
    boolean singleMatchSuffices,
    String name) {
  private static final Logger log = LoggerFactory.getLogger(PapyrusFilter.class);

  static final String TITLE_XPATH = "//*[local-name()='titleStmt']/*[local-name()='title']";
  static final String PLACE_XPATH = "//*[local-name()='origin']/*[local-name()='origPlace']";
  static final String HYBRID_XPATH =
      "//*[local-name()='publicationStmt']/*[local-name()='idno'][@type='dclp-hybrid']";

  public enum Source {
    DCLP,
    DDB,
    ALL
  }

  public PapyrusFilter {
    if (source == null) {
      throw new IllegalArgumentException("source must be set");
    }
    if (source == Source.DDB) {
      dclpHybrid = null;
    }
    if (blank(title) && blank(place) && blank(dclpHybrid)) {
      throw new IllegalArgumentException("title, place or dclpHybrid must be set");
    }
    if (blank(name)) {
      name =
          String.format(
              "filter-%s-%s-%s-%s-%s",
              source.name().toLowerCase(Locale.ROOT),
              title,
              place,
              dclpHybrid,
              singleMatchSuffices);
    }
  }

  public static Builder builder(Source source) {
    return new Builder(source);
  }

  private static boolean blank(String s) {
    return s == null || s.isBlank();
  }

  public boolean matches(Document document, boolean dclpFile) {
    List<Boolean> results = new ArrayList<>();
    if (!blank(title)) {
      results.add(firstContains(document, TITLE_XPATH, title));
    }
    if (!blank(place)) {
      results.add(firstContains(document, PLACE_XPATH, place));
    }
    if (!blank(dclpHybrid)) {
      results.add(dclpFile && firstContains(document, HYBRID_XPATH, dclpHybrid));
    }
    return singleMatchSuffices
        ? results.contains(Boolean.TRUE)
        : !results.isEmpty() && !results.contains(Boolean.FALSE);
  }

  private static boolean firstContains(Document document, String xpath, String needle) {
    List<String> values = TmExtractor.select(document, xpath);
    return !values.isEmpty()
        && values.get(0).toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
  }

  /**
   * TM numbers of every matching file.
   *
   * @param idpDataPath root of the idp.data copy
   * @param reader XML loader
   * @param threads size of the worker pool
   * @return distinct TM numbers in file order
   * @throws IOException if the source trees cannot be listed
   */
  public List<Integer> filter(Path idpDataPath, TeiReader reader, int threads)
      throws IOException {
    List<Path> files = new ArrayList<>();
    List<Boolean> dclp = new ArrayList<>();
    if (source != Source.DDB) {
      addFiles(idpDataPath.resolve(TmIndex.DCLP), true, files, dclp);
    }
    if (source != Source.DCLP) {
      addFiles(idpDataPath.resolve(TmIndex.DDB), false, files, dclp);
    }
    ExecutorService executor = Executors.newFixedThreadPool(Math.max(threads, 1));
    try {
      List<Future<List<Integer>>> futures = new ArrayList<>(files.size());
      for (int i = 0; i < files.size(); i++) {
        Path file = files.get(i);
        boolean isDclp = dclp.get(i);
        futures.add(
            executor.submit(
                () -> {
                  Document document = reader.read(file);
                  return matches(document, isDclp)
                      ? TmExtractor.tmNumbers(document)
                      : List.<Integer>of();
                }));
      }
      Set<Integer> tms = new LinkedHashSet<>();
      for (int i = 0; i < futures.size(); i++) {
        try {
          tms.addAll(futures.get(i).get());
        } catch (ExecutionException e) {
          log.warn("Skipping {}: {}", files.get(i), e.getCause().getMessage());
        }
      }
      log.info("Filter {} selected {} TM numbers from {} files", name, tms.size(), files.size());
      return new ArrayList<>(tms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Filtering interrupted", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private static void addFiles(Path dir, boolean isDclp, List<Path> files, List<Boolean> dclp)
      throws IOException {
    if (!Files.isDirectory(dir)) {
      log.warn("Could not find {}", dir);
      return;
    }
    for (Path file : TmIndex.xmlFiles(dir)) {
      files.add(file);
      dclp.add(isDclp);
    }
  }

  public static class Builder {
    private final Source source;
    private String title;
    private String place;
    private String dclpHybrid;
    private boolean singleMatchSuffices = true;
    private String name;

    private Builder(Source source) {
      this.source = source;
    }

    public Builder title(String value) {
      this.title = value;
      return this;
    }

    public Builder place(String value) {
      this.place = value;
      return this;
    }

    public Builder dclpHybrid(String value) {
      this.dclpHybrid = value;
      return this;
    }

    public Builder singleMatchSuffices(boolean value) {
      this.singleMatchSuffices = value;
      return this;
    }

    public Builder name(String value) {
      this.name = value;
      return this;
    }

    public PapyrusFilter build() {
      return new PapyrusFilter(source, title, place, dclpHybrid, singleMatchSuffices, name);
    }
  }
}
