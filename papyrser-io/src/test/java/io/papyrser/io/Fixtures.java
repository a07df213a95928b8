package io.papyrser.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/** Copies the bundled idp.data excerpt into a writable directory. */
final class Fixtures {
  static final String BGU = "DDB_EpiDoc_XML/bgu/bgu.1/bgu.1.108.xml";
  static final String CPR = "DDB_EpiDoc_XML/cpr/cpr.1/cpr.1.1.xml";
  static final String DCLP = "DCLP/60/59000.xml";

  private static final List<String> ALL = List.of(BGU, CPR, DCLP);

  private Fixtures() {}

  static Path idpData(Path target) throws IOException {
    for (String file : ALL) {
      Path out = target.resolve(file);
      Files.createDirectories(out.getParent());
      try (InputStream in = Fixtures.class.getResourceAsStream("/idp/" + file)) {
        if (in == null) {
          throw new IOException("Missing fixture " + file);
        }
        Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
      }
    }
    return target;
  }

  static String read(String file) throws IOException {
    try (InputStream in = Fixtures.class.getResourceAsStream("/idp/" + file)) {
      if (in == null) {
        throw new IOException("Missing fixture " + file);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
