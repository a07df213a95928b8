package io.papyrser.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.papyrser.core.format.FormattedPart;
import io.papyrser.core.format.FormattedTranscription;
import io.papyrser.core.format.LineRecord;
import io.papyrser.core.format.TokenRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes converted editions below {@code <mainPath>/export/<exportDirectory>}.
 *
 * <p>Text output goes to {@code txt/<tm>_<file>.txt}, one line per D5 line and no trailing
 * newline. JSON output goes to {@code json/<tm>_<file>.json} and carries the part metadata along
 * with the per-line records.
 */
public final class ExportWriter {
  private static final Logger log = LoggerFactory.getLogger(ExportWriter.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String EXPORT = "export";

  private final Path exportRoot;

  /**
   * @param mainPath directory holding the {@code export} folder
   * @param exportDirectory name of the folder for this run
   */
  public ExportWriter(Path mainPath, String exportDirectory) {
    this.exportRoot = mainPath.resolve(EXPORT).resolve(exportDirectory);
  }

  public Path exportRoot() {
    return exportRoot;
  }

  /** Name of an edition file without directory and {@code .xml} suffix. */
  public static String baseName(Path file) {
    String name = file.getFileName().toString();
    return name.endsWith(".xml") ? name.substring(0, name.length() - 4) : name;
  }

  public Path writeTxt(int tm, String fileName, FormattedTranscription result)
      throws IOException {
    Path dir = Files.createDirectories(exportRoot.resolve("txt"));
    Path path = dir.resolve(tm + "_" + fileName + ".txt");
    Files.writeString(path, String.join("\n", result.lines()), StandardCharsets.UTF_8);
    log.debug("Wrote {}", path);
    return path;
  }

  public Path writeJson(int tm, String fileName, FormattedTranscription result)
      throws IOException {
    Path dir = Files.createDirectories(exportRoot.resolve("json"));
    Path path = dir.resolve(tm + "_" + fileName + ".json");
    Files.write(path, MAPPER.writeValueAsBytes(toJson(result)));
    log.debug("Wrote {}", path);
    return path;
  }

  /** JSON document with one {@code text_blocks} entry per part. */
  static ObjectNode toJson(FormattedTranscription result) {
    ObjectNode root = MAPPER.createObjectNode();
    ArrayNode blocks = root.putArray("text_blocks");
    for (FormattedPart part : result.parts()) {
      ObjectNode block = blocks.addObject();
      block.put("n", part.n());
      block.put("subtype", part.subtype());
      block.put("lang", part.language());
      ArrayNode text = block.putArray("text");
      part.texts().forEach(text::add);
      ArrayNode lines = block.putArray("lines");
      for (LineRecord line : part.lines()) {
        ObjectNode node = lines.addObject();
        node.put("n", line.number());
        node.put("kind", line.kind().name().toLowerCase(Locale.ROOT));
        node.put("text", line.text());
        if (line.relocationId() >= 0) {
          node.put("relocation", line.relocationId());
        }
        node.set("tokens", tokens(line.tokens()));
      }
    }
    return root;
  }

  private static ArrayNode tokens(List<TokenRecord> records) {
    ArrayNode array = MAPPER.createArrayNode();
    for (TokenRecord record : records) {
      ObjectNode node = array.addObject();
      node.put("type", record.type());
      if (!record.detail().isEmpty()) {
        node.put("detail", record.detail());
      }
      node.put("rendered", record.rendered());
    }
    return array;
  }

  /** Pretty-printed JSON for a single edition, used by the {@code convert} command. */
  public static String toJsonString(FormattedTranscription result) throws IOException {
    return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
  }
}
