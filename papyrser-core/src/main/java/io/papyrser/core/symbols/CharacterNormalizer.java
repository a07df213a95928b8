package io.papyrser.core.symbols;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Reduces characters of a Greek transcription to diacritic-free majuscules.
 *
 * <p>A character is decomposed (NFD), its combining marks are discarded and the remaining base
 * letter is looked up in the majuscule table. Characters listed as {@code strip} (punctuation,
 * editorial signs, whitespace) disappear. Characters outside the table are upper-cased and kept,
 * so that the formatter can report them.
 *
 * <p>The tables are data: see {@code greek-characters.json} next to this class. Instances are
 * immutable and may be shared between threads.
 */
public final class CharacterNormalizer {

  public static final String COMBINING_DOT_BELOW = "̣";

  private static final String RESOURCE = "greek-characters.json";

  // NFD of a single character never nests deeper than this
  private static final int MAX_DEPTH = 4;

  private final Map<Integer, Integer> majuscules;
  private final Set<Integer> strip;
  private final Map<Integer, Integer> latinLookalikes;

  private CharacterNormalizer(
      Map<Integer, Integer> majuscules, Set<Integer> strip, Map<Integer, Integer> lookalikes) {
    this.majuscules = Map.copyOf(majuscules);
    this.strip = Set.copyOf(strip);
    this.latinLookalikes = Map.copyOf(lookalikes);
  }

  private static final class Holder {
    private static final CharacterNormalizer INSTANCE = loadBundled();
  }

  /** Normalizer backed by the bundled character table. */
  public static CharacterNormalizer defaults() {
    return Holder.INSTANCE;
  }

  private static CharacterNormalizer loadBundled() {
    try (InputStream in = CharacterNormalizer.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing bundled resource " + RESOURCE);
      }
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
  }

  /**
   * Loads a character table.
   *
   * @param in JSON with {@code majuscules}, {@code strip} and {@code latinLookalikes}
   * @return the normalizer
   * @throws IOException if the stream cannot be read or is not a valid table
   */
  public static CharacterNormalizer load(InputStream in) throws IOException {
    String json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    try {
      JsonObject root = JsonParser.parseString(json).getAsJsonObject();
      Map<Integer, Integer> majuscules = codePointMap(root.getAsJsonObject("majuscules"));
      Set<Integer> strip = new HashSet<>();
      if (root.has("strip")) {
        root.get("strip").getAsString().codePoints().forEach(strip::add);
      }
      Map<Integer, Integer> lookalikes =
          root.has("latinLookalikes")
              ? codePointMap(root.getAsJsonObject("latinLookalikes"))
              : Map.of();
      return new CharacterNormalizer(majuscules, strip, lookalikes);
    } catch (JsonParseException | IllegalStateException | NullPointerException e) {
      throw new IOException("Invalid character table: " + e.getMessage(), e);
    }
  }

  private static Map<Integer, Integer> codePointMap(JsonObject object) {
    Map<Integer, Integer> result = new HashMap<>();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue().getAsString();
      if (key.codePointCount(0, key.length()) != 1
          || value.codePointCount(0, value.length()) != 1) {
        throw new IllegalStateException("entries must map one character to one character: " + key);
      }
      result.put(key.codePointAt(0), value.codePointAt(0));
    }
    return result;
  }

  /**
   * Normalizes one character.
   *
   * @param codePoint raw character from the transcription
   * @return the majuscule base letter, another upper-cased character, or an empty string when the
   *     character is stripped
   */
  public String normalize(int codePoint) {
    StringBuilder out = new StringBuilder(2);
    append(codePoint, out, 0);
    return out.toString();
  }

  /** Normalizes every character of {@code text}. */
  public String normalize(CharSequence text) {
    StringBuilder out = new StringBuilder(text.length());
    text.codePoints().forEach(cp -> append(cp, out, 0));
    return out.toString();
  }

  private void append(int codePoint, StringBuilder out, int depth) {
    if (strip.contains(codePoint) || isBlank(codePoint) || isCombining(codePoint)) {
      return;
    }
    Integer mapped = majuscules.get(codePoint);
    if (mapped != null) {
      out.appendCodePoint(mapped);
      return;
    }
    if (depth < MAX_DEPTH) {
      String raw = new String(Character.toChars(codePoint));
      String decomposed = Normalizer.normalize(raw, Normalizer.Form.NFD);
      if (!decomposed.equals(raw)) {
        decomposed.codePoints().forEach(cp -> append(cp, out, depth + 1));
        return;
      }
      int upper = Character.toUpperCase(codePoint);
      if (upper != codePoint) {
        append(upper, out, depth + 1);
        return;
      }
    }
    out.appendCodePoint(codePoint);
  }

  /** Appends the combining dot below that marks an uncertain reading. */
  public String markUncertain(String base) {
    return base + COMBINING_DOT_BELOW;
  }

  /**
   * Greek letter a Latin capital is commonly mistyped for, e.g. Latin {@code A} for Alpha.
   *
   * @param codePoint a normalized character
   * @return the Greek replacement, or empty when the character is not a known look-alike
   */
  public OptionalInt latinLookalike(int codePoint) {
    Integer greek = latinLookalikes.get(codePoint);
    return greek == null ? OptionalInt.empty() : OptionalInt.of(greek);
  }

  /** Every character {@link #normalize(int)} can map a letter to. */
  public Set<Integer> majusculeLetters() {
    return Set.copyOf(majuscules.values());
  }

  static boolean isCombining(int codePoint) {
    int type = Character.getType(codePoint);
    return type == Character.NON_SPACING_MARK
        || type == Character.ENCLOSING_MARK
        || type == Character.COMBINING_SPACING_MARK;
  }

  private static boolean isBlank(int codePoint) {
    return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
  }
}
