package io.papyrser.cli;

import io.papyrser.io.PapyrusFilter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of a conversion run. Loads from {@code papyrser.properties} in the working directory
 * by default; command line options override individual values.
 *
 * @param target TM number, comma separated TM numbers, DDB collection name or comma separated
 *     collection names
 * @param filter metadata filter replacing {@code target} when set, may be null
 * @param debugMode detailed tracing at DEBUG level; disables parallel conversion
 * @param ignoreFormattingIssues write output despite validation errors
 * @param writeToJson write {@code json/} output
 * @param writeToTxt write {@code txt/} output
 * @param alwaysUpdateGithub download idp.data on every run
 * @param alwaysDoIndexing rebuild the TM index on every run
 * @param mainPath directory holding the {@code export} folder
 * @param papyriDataPath download directory
 * @param idpDataPath local idp.data copy
 * @param tmIndexPath TM index file
 */
public record PapyrserConfig(
    String target,
    PapyrusFilter filter,
    boolean debugMode,
    boolean ignoreFormattingIssues,
    boolean writeToJson,
    boolean writeToTxt,
    boolean alwaysUpdateGithub,
    boolean alwaysDoIndexing,
    Path mainPath,
    Path papyriDataPath,
    Path idpDataPath,
    Path tmIndexPath) {

  public static final String FILE_NAME = "papyrser.properties";
  static final String DEFAULT_TARGET = "37203";
  static final String IDP_DATA_MASTER = "idp.data-master";

  public static PapyrserConfig defaults() {
    return fromProperties(new Properties());
  }

  /**
   * Loads {@code papyrser.properties} from the working directory.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static PapyrserConfig load() throws IOException {
    return load(Path.of(FILE_NAME));
  }

  public static PapyrserConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      return defaults();
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  static PapyrserConfig fromProperties(Properties props) {
    Path mainPath = Path.of(props.getProperty("mainPath", "."));
    Path papyriDataPath = path(props, "papyriDataPath", mainPath.resolve("papyri_data"));
    Path idpDataPath = path(props, "idpDataPath", papyriDataPath.resolve(IDP_DATA_MASTER));
    Path tmIndexPath = path(props, "tmIndexPath", papyriDataPath.resolve("tm_index.json"));

    return new PapyrserConfig(
        props.getProperty("target", DEFAULT_TARGET).trim(),
        filter(props),
        Boolean.parseBoolean(props.getProperty("debugMode", "false")),
        Boolean.parseBoolean(props.getProperty("ignoreFormattingIssues", "false")),
        Boolean.parseBoolean(props.getProperty("writeToJson", "true")),
        Boolean.parseBoolean(props.getProperty("writeToTxt", "true")),
        Boolean.parseBoolean(props.getProperty("alwaysUpdateGithub", "false")),
        Boolean.parseBoolean(props.getProperty("alwaysDoIndexing", "false")),
        mainPath,
        papyriDataPath,
        idpDataPath,
        tmIndexPath);
  }

  private static Path path(Properties props, String key, Path fallback) {
    String value = props.getProperty(key);
    return value == null || value.isBlank() ? fallback : Path.of(value.trim());
  }

  private static PapyrusFilter filter(Properties props) {
    String source = props.getProperty("filter.source");
    if (source == null || source.isBlank()) {
      return null;
    }
    return PapyrusFilter.builder(
            PapyrusFilter.Source.valueOf(source.trim().toUpperCase(Locale.ROOT)))
        .title(props.getProperty("filter.title"))
        .place(props.getProperty("filter.place"))
        .dclpHybrid(props.getProperty("filter.dclpHybrid"))
        .singleMatchSuffices(
            Boolean.parseBoolean(props.getProperty("filter.singleMatchSuffices", "true")))
        .name(props.getProperty("filter.name"))
        .build();
  }

  /** Whether the idp.data copy is the one this tool downloads. */
  public boolean usesDownloadedData() {
    return idpDataPath.normalize().equals(papyriDataPath.resolve(IDP_DATA_MASTER).normalize());
  }

  public PapyrserConfig withTarget(String value, PapyrusFilter filterValue) {
    return new PapyrserConfig(
        value,
        filterValue,
        debugMode,
        ignoreFormattingIssues,
        writeToJson,
        writeToTxt,
        alwaysUpdateGithub,
        alwaysDoIndexing,
        mainPath,
        papyriDataPath,
        idpDataPath,
        tmIndexPath);
  }

  public PapyrserConfig withFlags(
      boolean debug, boolean ignoreIssues, boolean updateGithub, boolean doIndexing) {
    return new PapyrserConfig(
        target,
        filter,
        debug,
        ignoreIssues,
        writeToJson,
        writeToTxt,
        updateGithub,
        doIndexing,
        mainPath,
        papyriDataPath,
        idpDataPath,
        tmIndexPath);
  }

  public PapyrserConfig withOutputs(boolean json, boolean txt) {
    return new PapyrserConfig(
        target,
        filter,
        debugMode,
        ignoreFormattingIssues,
        json,
        txt,
        alwaysUpdateGithub,
        alwaysDoIndexing,
        mainPath,
        papyriDataPath,
        idpDataPath,
        tmIndexPath);
  }
}
