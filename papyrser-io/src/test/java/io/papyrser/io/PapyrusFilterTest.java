package io.papyrser.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.papyrser.io.PapyrusFilter.Source;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;

class PapyrusFilterTest {
  private final TeiReader reader = new TeiReader();

  @Nested
  class Construction {
    @Test
    void requiresSource() {
      assertThatThrownBy(() -> PapyrusFilter.builder(null).title("x").build())
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requiresCriterion() {
      assertThatThrownBy(() -> PapyrusFilter.builder(Source.ALL).title(" ").build())
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("title, place or dclpHybrid must be set");
    }

    @Test
    void hybridIsIgnoredForDdb() {
      assertThatThrownBy(() -> PapyrusFilter.builder(Source.DDB).dclpHybrid("p.oxy").build())
          .isInstanceOf(IllegalArgumentException.class);

      PapyrusFilter filter =
          PapyrusFilter.builder(Source.DDB).place("Oxyrhynchus").dclpHybrid("p.oxy").build();
      assertThat(filter.dclpHybrid()).isNull();
    }

    @Test
    void derivedName() {
      PapyrusFilter filter =
          PapyrusFilter.builder(Source.DCLP).title("Homer").singleMatchSuffices(false).build();
      assertThat(filter.name()).isEqualTo("filter-dclp-Homer-null-null-false");
    }

    @Test
    void explicitName() {
      PapyrusFilter filter =
          PapyrusFilter.builder(Source.ALL).place("Hermopolis").name("herm").build();
      assertThat(filter.name()).isEqualTo("herm");
      assertThat(filter.singleMatchSuffices()).isTrue();
    }
  }

  @Nested
  class Matching {
    private Document dclp() throws IOException {
      return reader.readString(Fixtures.read(Fixtures.DCLP));
    }

    @Test
    void titleIsCaseInsensitiveSubstring() throws IOException {
      assertThat(PapyrusFilter.builder(Source.ALL).title("iliad").build().matches(dclp(), true))
          .isTrue();
      assertThat(PapyrusFilter.builder(Source.ALL).title("odyssey").build().matches(dclp(), true))
          .isFalse();
    }

    @Test
    void placeOfOrigin() throws IOException {
      assertThat(PapyrusFilter.builder(Source.ALL).place("OXY").build().matches(dclp(), true))
          .isTrue();
    }

    @Test
    void hybridOnlyForDclpFiles() throws IOException {
      PapyrusFilter filter = PapyrusFilter.builder(Source.ALL).dclpHybrid("p.oxy;3").build();
      assertThat(filter.matches(dclp(), true)).isTrue();
      assertThat(filter.matches(dclp(), false)).isFalse();
    }

    @Test
    void singleMatchSuffices() throws IOException {
      PapyrusFilter filter =
          PapyrusFilter.builder(Source.ALL).title("odyssey").place("Oxyrhynchus").build();
      assertThat(filter.matches(dclp(), true)).isTrue();
    }

    @Test
    void allSetCriteriaMustMatch() throws IOException {
      PapyrusFilter.Builder builder =
          PapyrusFilter.builder(Source.ALL).place("Oxyrhynchus").singleMatchSuffices(false);
      assertThat(builder.build().matches(dclp(), true)).isTrue();
      assertThat(builder.title("Homer").build().matches(dclp(), true)).isTrue();
      assertThat(builder.title("odyssey").build().matches(dclp(), true)).isFalse();
    }

    @Test
    void missingMetadataDoesNotMatch() throws IOException {
      Document bare = reader.readString("<TEI xmlns=\"http://www.tei-c.org/ns/1.0\"/>");
      assertThat(PapyrusFilter.builder(Source.ALL).title("a").build().matches(bare, true))
          .isFalse();
    }
  }

  @Nested
  class Filtering {
    @TempDir Path tmp;

    @Test
    void searchesSelectedTrees() throws IOException {
      Path idp = Fixtures.idpData(tmp);
      PapyrusFilter all = PapyrusFilter.builder(Source.ALL).place("o").build();
      PapyrusFilter ddb = PapyrusFilter.builder(Source.DDB).place("o").build();
      PapyrusFilter dclp = PapyrusFilter.builder(Source.DCLP).place("o").build();

      assertThat(all.filter(idp, reader, 2)).containsExactly(59000, 9297, 12345, 12346);
      assertThat(ddb.filter(idp, reader, 2)).containsExactly(9297, 12345, 12346);
      assertThat(dclp.filter(idp, reader, 2)).containsExactly(59000);
    }

    @Test
    void selectsMatchingFiles() throws IOException {
      Path idp = Fixtures.idpData(tmp);
      PapyrusFilter filter = PapyrusFilter.builder(Source.ALL).title("lease").build();
      assertThat(filter.filter(idp, reader, 1)).containsExactly(12345, 12346);
    }

    @Test
    void malformedFilesAreSkipped() throws IOException {
      Path idp = Fixtures.idpData(tmp);
      Files.writeString(idp.resolve("DCLP/60/broken.xml"), "<TEI>");
      PapyrusFilter filter = PapyrusFilter.builder(Source.DCLP).title("homer").build();
      assertThat(filter.filter(idp, reader, 2)).containsExactly(59000);
    }

    @Test
    void missingTrees() throws IOException {
      PapyrusFilter filter = PapyrusFilter.builder(Source.ALL).title("homer").build();
      assertThat(filter.filter(tmp, reader, 2)).isEmpty();
    }
  }
}
