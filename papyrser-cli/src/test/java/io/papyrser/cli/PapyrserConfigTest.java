package io.papyrser.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.papyrser.io.PapyrusFilter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PapyrserConfigTest {

  @Test
  void defaults() {
    PapyrserConfig config = PapyrserConfig.defaults();

    assertThat(config.target()).isEqualTo("37203");
    assertThat(config.filter()).isNull();
    assertThat(config.debugMode()).isFalse();
    assertThat(config.ignoreFormattingIssues()).isFalse();
    assertThat(config.writeToJson()).isTrue();
    assertThat(config.writeToTxt()).isTrue();
    assertThat(config.alwaysUpdateGithub()).isFalse();
    assertThat(config.alwaysDoIndexing()).isFalse();
    assertThat(config.mainPath()).isEqualTo(Path.of("."));
    assertThat(config.papyriDataPath()).isEqualTo(Path.of(".", "papyri_data"));
    assertThat(config.idpDataPath()).isEqualTo(Path.of(".", "papyri_data", "idp.data-master"));
    assertThat(config.tmIndexPath()).isEqualTo(Path.of(".", "papyri_data", "tm_index.json"));
    assertThat(config.usesDownloadedData()).isTrue();
  }

  @Test
  void missingFileGivesDefaults(@TempDir Path tmp) throws IOException {
    assertThat(PapyrserConfig.load(tmp.resolve("absent.properties")))
        .isEqualTo(PapyrserConfig.defaults());
  }

  @Test
  void loadsFile(@TempDir Path tmp) throws IOException {
    Path file =
        Files.writeString(
            tmp.resolve(PapyrserConfig.FILE_NAME),
            String.join(
                "\n",
                "# conversion",
                "target = bgu, cpr",
                "ignoreFormattingIssues=true",
                "writeToJson=false",
                "alwaysDoIndexing=true",
                "mainPath=/data/papyri",
                "idpDataPath=/srv/idp.data"));

    PapyrserConfig config = PapyrserConfig.load(file);

    assertThat(config.target()).isEqualTo("bgu, cpr");
    assertThat(config.ignoreFormattingIssues()).isTrue();
    assertThat(config.writeToJson()).isFalse();
    assertThat(config.writeToTxt()).isTrue();
    assertThat(config.alwaysDoIndexing()).isTrue();
    assertThat(config.papyriDataPath()).isEqualTo(Path.of("/data/papyri/papyri_data"));
    assertThat(config.idpDataPath()).isEqualTo(Path.of("/srv/idp.data"));
    assertThat(config.tmIndexPath()).isEqualTo(Path.of("/data/papyri/papyri_data/tm_index.json"));
    assertThat(config.usesDownloadedData()).isFalse();
  }

  @Test
  void filterProperties() {
    Properties props = new Properties();
    props.setProperty("filter.source", "dclp");
    props.setProperty("filter.place", "Oxyrhynchus");
    props.setProperty("filter.singleMatchSuffices", "false");

    PapyrusFilter filter = PapyrserConfig.fromProperties(props).filter();

    assertThat(filter.source()).isEqualTo(PapyrusFilter.Source.DCLP);
    assertThat(filter.place()).isEqualTo("Oxyrhynchus");
    assertThat(filter.singleMatchSuffices()).isFalse();
    assertThat(filter.name()).isEqualTo("filter-dclp-null-Oxyrhynchus-null-false");
  }

  @Test
  void filterWithoutCriteria() {
    Properties props = new Properties();
    props.setProperty("filter.source", "ALL");

    assertThatThrownBy(() -> PapyrserConfig.fromProperties(props))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void copies() {
    PapyrserConfig config =
        PapyrserConfig.defaults()
            .withTarget("9297", null)
            .withFlags(true, true, true, true)
            .withOutputs(false, false);

    assertThat(config.target()).isEqualTo("9297");
    assertThat(config.debugMode()).isTrue();
    assertThat(config.ignoreFormattingIssues()).isTrue();
    assertThat(config.alwaysUpdateGithub()).isTrue();
    assertThat(config.alwaysDoIndexing()).isTrue();
    assertThat(config.writeToJson()).isFalse();
    assertThat(config.writeToTxt()).isFalse();
    assertThat(config.idpDataPath()).isEqualTo(PapyrserConfig.defaults().idpDataPath());
  }
}
