package io.papyrser.core.symbols;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.papyrser.core.model.Token;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup tables that map attribute values of the edition to D5 symbols.
 *
 * <p>The tables are loaded from JSON, by default from the bundled {@code d5-symbols.json}. A
 * missing key is never answered with a guess: callers receive an empty {@link Optional} and the
 * formatter reports it. The only exception is the abbreviation table, which may declare a fallback
 * symbol for expansions it does not know.
 */
public final class SymbolTables {
  private static final Logger log = LoggerFactory.getLogger(SymbolTables.class);

  public static final String ABBREVIATIONS = "abbreviation";
  public static final String GLYPH_TYPES = "glyph type";
  public static final String MILESTONES = "milestone";
  public static final String RENDITIONS = "rendition";
  public static final String PLACEMENTS = "add placement";

  private static final String RESOURCE = "d5-symbols.json";

  private final String version;
  private final int abbreviationKeyLength;
  private final String abbreviationFallback;
  private final Map<String, String> abbreviations;
  private final Map<String, String> glyphTypes;
  private final Map<String, String> milestones;
  private final Map<String, RenditionStyle> renditions;
  private final Map<String, AddPlacement> placements;
  private final String uncertainMark;
  private final String extraVocabulary;

  private SymbolTables(Builder b) {
    this.version = b.version;
    this.abbreviationKeyLength = b.abbreviationKeyLength;
    this.abbreviationFallback = b.abbreviationFallback;
    this.abbreviations = Map.copyOf(b.abbreviations);
    this.glyphTypes = Map.copyOf(b.glyphTypes);
    this.milestones = Map.copyOf(b.milestones);
    this.renditions = Map.copyOf(b.renditions);
    this.placements = Map.copyOf(b.placements);
    this.uncertainMark = b.uncertainMark;
    this.extraVocabulary = b.extraVocabulary;
  }

  private static final class Holder {
    private static final SymbolTables INSTANCE = loadBundled();
  }

  /** Tables bundled with the library. */
  public static SymbolTables defaults() {
    return Holder.INSTANCE;
  }

  private static SymbolTables loadBundled() {
    try (InputStream in = SymbolTables.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing bundled resource " + RESOURCE);
      }
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
  }

  /**
   * Loads symbol tables from a JSON stream.
   *
   * @param in table document; sections other than {@code abbreviations} may be omitted
   * @return the tables
   * @throws IOException if the stream cannot be read or does not hold valid tables
   */
  public static SymbolTables load(InputStream in) throws IOException {
    String json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    try {
      return parse(json);
    } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
      throw new IOException("Invalid symbol tables: " + e.getMessage(), e);
    }
  }

  private static SymbolTables parse(String json) {
    JsonObject root = JsonParser.parseString(json).getAsJsonObject();
    Builder b = new Builder();
    b.version = root.has("version") ? root.get("version").getAsString() : "unversioned";

    JsonObject abbreviations = root.getAsJsonObject("abbreviations");
    if (abbreviations != null) {
      if (abbreviations.has("keyLength")) {
        b.abbreviationKeyLength = abbreviations.get("keyLength").getAsInt();
      }
      if (abbreviations.has("fallback")) {
        b.abbreviationFallback = abbreviations.get("fallback").getAsString();
      }
      b.abbreviations.putAll(stringMap(abbreviations.getAsJsonObject("entries")));
    }
    b.glyphTypes.putAll(stringMap(root.getAsJsonObject("glyphTypes")));
    b.milestones.putAll(stringMap(root.getAsJsonObject("milestones")));
    b.renditions.putAll(objectMap(root.getAsJsonObject("renditions"), SymbolTables::rendition));
    b.placements.putAll(
        objectMap(root.getAsJsonObject("addPlacements"), SymbolTables::placement));

    JsonObject vocabulary = root.getAsJsonObject("vocabulary");
    if (vocabulary != null) {
      if (vocabulary.has("uncertainMark")) {
        b.uncertainMark = vocabulary.get("uncertainMark").getAsString();
      }
      if (vocabulary.has("extra")) {
        b.extraVocabulary = vocabulary.get("extra").getAsString();
      }
    }

    SymbolTables tables = new SymbolTables(b);
    log.debug(
        "Loaded symbol tables {}: {} abbreviations, {} glyph types, {} renditions",
        tables.version,
        tables.abbreviations.size(),
        tables.glyphTypes.size(),
        tables.renditions.size());
    return tables;
  }

  private static Map<String, String> stringMap(JsonObject object) {
    Map<String, String> result = new HashMap<>();
    if (object != null) {
      for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
        result.put(entry.getKey(), entry.getValue().getAsString());
      }
    }
    return result;
  }

  private static <T> Map<String, T> objectMap(
      JsonObject object, Function<JsonObject, T> converter) {
    Map<String, T> result = new HashMap<>();
    if (object != null) {
      for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
        result.put(entry.getKey(), converter.apply(entry.getValue().getAsJsonObject()));
      }
    }
    return result;
  }

  private static RenditionStyle rendition(JsonObject data) {
    String scope = data.has("scope") ? data.get("scope").getAsString() : "trailing";
    return new RenditionStyle(
        data.get("mark").getAsString(),
        RenditionStyle.Scope.valueOf(scope.toUpperCase(Locale.ROOT)));
  }

  private static AddPlacement placement(JsonObject data) {
    String marker = data.has("marker") ? data.get("marker").getAsString() : "";
    String target = data.get("target").getAsString();
    boolean singleGlyph =
        data.has("inlineSingleGlyph") && data.get("inlineSingleGlyph").getAsBoolean();
    if ("inline".equals(target)) {
      return new AddPlacement(marker, true, Token.Target.NONE, singleGlyph);
    }
    return new AddPlacement(
        marker, false, Token.Target.valueOf(target.toUpperCase(Locale.ROOT)), singleGlyph);
  }

  public String version() {
    return version;
  }

  /**
   * Abbreviation table key for an expansion: its first characters up to the configured key
   * length.
   */
  public String abbreviationKey(String expansion) {
    int length = expansion.codePointCount(0, expansion.length());
    if (length <= abbreviationKeyLength) {
      return expansion;
    }
    return expansion.substring(0, expansion.offsetByCodePoints(0, abbreviationKeyLength));
  }

  /**
   * Symbol for an abbreviated word.
   *
   * @param expansion normalized editorial expansion
   * @return the table symbol, the fallback symbol when the key is unknown, or empty when the table
   *     declares no fallback
   */
  public Optional<String> abbreviation(String expansion) {
    String symbol = abbreviations.get(abbreviationKey(expansion));
    if (symbol != null) {
      return Optional.of(symbol);
    }
    return Optional.ofNullable(abbreviationFallback);
  }

  public boolean isAbbreviationFallback(String symbol) {
    return abbreviationFallback != null && abbreviationFallback.equals(symbol);
  }

  public Optional<String> glyph(String type) {
    return Optional.ofNullable(glyphTypes.get(type));
  }

  public Optional<String> milestone(String rendition) {
    return Optional.ofNullable(milestones.get(rendition));
  }

  public Optional<RenditionStyle> rendition(String rend) {
    return Optional.ofNullable(renditions.get(rend));
  }

  public Optional<AddPlacement> placement(String place) {
    return Optional.ofNullable(placements.get(place));
  }

  public String uncertainMark() {
    return uncertainMark;
  }

  /**
   * Every character a table can emit, together with the uncertainty mark and the extra characters
   * the vocabulary section allows.
   */
  public Set<Integer> symbolCodePoints() {
    Set<Integer> result = new HashSet<>();
    abbreviations.values().forEach(s -> s.codePoints().forEach(result::add));
    if (abbreviationFallback != null) {
      abbreviationFallback.codePoints().forEach(result::add);
    }
    glyphTypes.values().forEach(s -> s.codePoints().forEach(result::add));
    milestones.values().forEach(s -> s.codePoints().forEach(result::add));
    renditions.values().forEach(r -> r.mark().codePoints().forEach(result::add));
    placements.values().forEach(p -> p.marker().codePoints().forEach(result::add));
    uncertainMark.codePoints().forEach(result::add);
    extraVocabulary.codePoints().forEach(result::add);
    return result;
  }

  private static final class Builder {
    private String version;
    private int abbreviationKeyLength = 5;
    private String abbreviationFallback;
    private final Map<String, String> abbreviations = new HashMap<>();
    private final Map<String, String> glyphTypes = new HashMap<>();
    private final Map<String, String> milestones = new HashMap<>();
    private final Map<String, RenditionStyle> renditions = new HashMap<>();
    private final Map<String, AddPlacement> placements = new HashMap<>();
    private String uncertainMark = CharacterNormalizer.COMBINING_DOT_BELOW;
    private String extraVocabulary = "";
  }
}
