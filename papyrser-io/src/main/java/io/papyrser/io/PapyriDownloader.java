package io.papyrser.io;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the papyri.info {@code idp.data} repository archive and extracts the edition trees.
 *
 * <p>Only entries below {@code DCLP} and {@code DDB_EpiDoc_XML} are extracted. A successful
 * download invalidates the TM index, which has to be rebuilt afterwards.
 */
public final class PapyriDownloader {
  private static final Logger log = LoggerFactory.getLogger(PapyriDownloader.class);

  public static final URI DEFAULT_SOURCE =
      URI.create("https://github.com/papyri/idp.data/archive/refs/heads/master.zip");

  static final String TEMP_ZIP = "temp.zip";

  private final HttpClient client;
  private final URI source;

  public PapyriDownloader() {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        DEFAULT_SOURCE);
  }

  public PapyriDownloader(HttpClient client, URI source) {
    this.client = client;
    this.source = source;
  }

  /**
   * Downloads and extracts the archive into {@code papyriDataPath}.
   *
   * @param papyriDataPath directory receiving the extracted {@code idp.data-master} tree
   * @param tmIndexPath index file to delete once the data changed
   * @return number of extracted files
   * @throws IOException if the download fails or the archive is unreadable
   */
  public int download(Path papyriDataPath, Path tmIndexPath) throws IOException {
    Files.createDirectories(papyriDataPath);
    Path zip = papyriDataPath.resolve(TEMP_ZIP);
    log.info("Downloading papyri.info data from {}", source);
    HttpRequest request = HttpRequest.newBuilder().uri(source).GET().build();
    HttpResponse<Path> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofFile(zip));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      Files.deleteIfExists(zip);
      throw new IOException("Download interrupted", e);
    }
    try {
      if (response.statusCode() != 200) {
        throw new IOException("Download failed. Status code: " + response.statusCode());
      }
      log.info("Extracting files");
      int extracted = extract(zip, papyriDataPath);
      if (Files.deleteIfExists(tmIndexPath)) {
        log.info("Removed outdated TM index {}", tmIndexPath);
      }
      log.info("Extracted {} files to {}", extracted, papyriDataPath);
      return extracted;
    } finally {
      Files.deleteIfExists(zip);
    }
  }

  /**
   * Extracts the {@code DCLP} and {@code DDB_EpiDoc_XML} entries of an archive.
   *
   * @return number of files written
   * @throws IOException if an entry would be written outside {@code target}
   */
  public static int extract(Path zip, Path target) throws IOException {
    Path root = target.toAbsolutePath().normalize();
    int count = 0;
    try (InputStream in = Files.newInputStream(zip);
        ZipInputStream zin = new ZipInputStream(in)) {
      ZipEntry entry;
      while ((entry = zin.getNextEntry()) != null) {
        String name = entry.getName();
        if (!isEditionEntry(name)) {
          continue;
        }
        Path out = root.resolve(name).normalize();
        if (!out.startsWith(root)) {
          throw new IOException("Archive entry outside target directory: " + name);
        }
        if (entry.isDirectory()) {
          Files.createDirectories(out);
        } else {
          Files.createDirectories(out.getParent());
          Files.copy(zin, out, StandardCopyOption.REPLACE_EXISTING);
          count++;
        }
      }
    }
    return count;
  }

  static boolean isEditionEntry(String name) {
    for (String segment : name.split("/")) {
      if (TmIndex.DCLP.equals(segment) || TmIndex.DDB.equals(segment)) {
        return true;
      }
    }
    return false;
  }
}
