package io.papyrser.core.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.papyrser.core.format.FormattedTranscription;
import io.papyrser.core.parser.TeiDocuments;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** End-to-end conversion of single-line snippets wrapped as {@code Α<snippet>Β}. */
class D5ConverterTest {

  private final D5Converter converter = new D5Converter(ConversionOptions.DEFAULT);

  private List<String> convert(String snippet) throws PapyrserException {
    return converter.convert(TeiDocuments.line(snippet), "test").lines();
  }

  @Nested
  class Gaps {
    @Test
    void lostRangeUsesRoundedMean() throws Exception {
      assertThat(convert("<gap reason=\"lost\" atLeast=\"11\" atMost=\"15\" unit=\"character\"/>"))
          .containsExactly("Α[-------------]Β");
    }

    @Test
    void lineUnitsProduceNothing() throws Exception {
      assertThat(convert("<gap reason=\"lost\" quantity=\"7\" unit=\"line\"/>"))
          .containsExactly("ΑΒ");
      assertThat(convert("<gap reason=\"illegible\" quantity=\"5\" unit=\"line\"/>"))
          .containsExactly("ΑΒ");
    }

    @Test
    void illegibleKnownLengthIsBareDashes() throws Exception {
      assertThat(convert("<gap reason=\"illegible\" quantity=\"3\" unit=\"character\"/>"))
          .containsExactly("Α---Β");
    }

    @Test
    void illegibleUnknownLengthIsBracketedQuestionMark() throws Exception {
      assertThat(convert("<gap reason=\"illegible\" extent=\"unknown\" unit=\"character\"/>"))
          .containsExactly("Α[?]Β");
      assertThat(
              convert(
                  "<gap reason=\"illegible\" extent=\"unknown\" unit=\"character\">"
                      + "<desc>vestiges</desc></gap>"))
          .containsExactly("Α[?]Β");
    }

    @Test
    void halfwayMeanRoundsToEven() throws Exception {
      assertThat(convert("<gap reason=\"illegible\" atLeast=\"9\" atMost=\"10\" unit=\"character\"/>"))
          .containsExactly("Α----------Β");
    }
  }

  @Nested
  class Spaces {
    @Test
    void unknownVacat() throws Exception {
      assertThat(convert("<space extent=\"unknown\" unit=\"character\"/>"))
          .containsExactly("Α ? Β");
    }

    @Test
    void knownVacat() throws Exception {
      assertThat(convert("<space quantity=\"3\" unit=\"character\"/>")).containsExactly("Α   Β");
      assertThat(convert("<space atLeast=\"2\" atMost=\"5\" unit=\"character\"/>"))
          .containsExactly("Α    Β");
    }

    @Test
    void lineVacatProducesNothing() throws Exception {
      assertThat(convert("<space extent=\"unknown\" unit=\"line\"/>")).containsExactly("ΑΒ");
    }
  }

  @Nested
  class Additions {
    @Test
    void singleLetterAboveStaysInline() throws Exception {
      assertThat(convert("<add place=\"above\">Γ</add>")).containsExactly("ΑΓΒ");
    }

    @Test
    void longerAdditionAboveMovesToPreviousLine() throws Exception {
      assertThat(convert("<add place=\"above\">ΓΔ</add>")).containsExactly("ΓΔ", "Α↑Β");
    }

    @Test
    void belowMovesToNextLine() throws Exception {
      assertThat(convert("<add place=\"below\">Γ</add>")).containsExactly("Α↓Β", "Γ");
    }

    @Test
    void nestedAdditionGetsItsOwnLine() throws Exception {
      assertThat(convert("<add place=\"above\">ΓΔ<add place=\"above\">ΕΖ</add></add>"))
          .containsExactly("ΕΖ", "ΓΔ↑", "Α↑Β");
      assertThat(convert("<add place=\"above\">ΓΔ<add place=\"below\">ΕΖ</add></add>"))
          .containsExactly("ΓΔ↓", "ΕΖ", "Α↑Β");
    }

    @Test
    void leftAndRight() throws Exception {
      assertThat(convert("<add place=\"left\">Γ</add>")).containsExactly("Γ", "Α←Β");
      assertThat(convert("<add place=\"right\">Γ</add>")).containsExactly("Α→Β", "Γ");
    }

    @Test
    void interlinearLeavesNoMarker() throws Exception {
      assertThat(convert("<add place=\"interlinear\">Γ</add>")).containsExactly("Γ", "ΑΒ");
    }

    @Test
    void marginKeepsOnlyTheMarker() throws Exception {
      assertThat(convert("<add rend=\"sling\" place=\"margin\">Γ</add>")).containsExactly("Α↔Β");
    }
  }

  @Nested
  class Highlights {
    @Test
    void renditionsWithoutMark() throws Exception {
      assertThat(convert("<hi rend=\"tall\">Γ</hi>")).containsExactly("ΑΓΒ");
    }

    @Test
    void supralineMarksEveryLetter() throws Exception {
      assertThat(convert("<hi rend=\"supraline\">Γ</hi>")).containsExactly("ΑΓ\u0305Β");
      assertThat(convert("<hi rend=\"supraline\">ΓΔ</hi>")).containsExactly("ΑΓ\u0305Δ\u0305Β");
      assertThat(convert("<hi rend=\"supraline-underline\">Γ</hi>"))
          .containsExactly("ΑΓ\u0305\u0332Β");
    }

    @Test
    void supralineLeavesSuppliedLettersUnmarked() throws Exception {
      assertThat(convert("<hi rend=\"supraline\">ι<supplied reason=\"lost\">β</supplied></hi>"))
          .containsExactly("ΑΙ\u0305[-]Β");
      assertThat(
              convert(
                  "<hi rend=\"underline\"><supplied reason=\"lost\">δ</supplied>"
                      + "ι<gap reason=\"lost\" quantity=\"2\" unit=\"character\"/></hi>"))
          .containsExactly("Α[-]Ι\u0332[--]Β");
    }

    @Test
    void diacriticsAreReplacedByTheRenditionMark() throws Exception {
      assertThat(convert("υ<hi rend=\"diaeresis\">ἱ</hi>οῦ")).containsExactly("ΑΥΙ\u0308ΟΥΒ");
      assertThat(convert("<hi rend=\"asper\">ὧ</hi>")).containsExactly("ΑΩ\u0314Β");
      assertThat(convert("<hi rend=\"circumflex\">ὑ</hi>")).containsExactly("ΑΥ\u0342Β");
    }

    @Test
    void nestedRenditionsPutOuterMarkFirst() throws Exception {
      assertThat(convert("<hi rend=\"asper\"><hi rend=\"acute\">ἵ</hi></hi>"))
          .containsExactly("ΑΙ\u0314\u0301Β");
      assertThat(
              convert(
                  "<hi rend=\"asper\"><hi rend=\"acute\">"
                      + "<gap reason=\"illegible\" quantity=\"1\" unit=\"character\"/></hi></hi>"))
          .containsExactly("Α-\u0314\u0301Β");
    }

    @Test
    void marksFollowGaps() throws Exception {
      assertThat(
              convert(
                  "<hi rend=\"diaeresis\">"
                      + "<gap reason=\"illegible\" quantity=\"1\" unit=\"character\"/></hi>"))
          .containsExactly("Α-\u0308Β");
      assertThat(
              convert(
                  "<hi rend=\"acute\"><gap reason=\"lost\" quantity=\"1\" unit=\"character\"/></hi>"))
          .containsExactly("Α[-]\u0301Β");
    }

    @Test
    void highlightedGapsAtTheLineEdgesKeepTheirMarks() throws Exception {
      String lostAtStart =
          "<div n=\"test\" subtype=\"unittest\"><ab><lb n=\"1\"/>"
              + "<hi rend=\"acute\"><gap reason=\"lost\" quantity=\"1\" unit=\"character\"/></hi>"
              + "αβ</ab></div>";
      assertThat(converter.convert(TeiDocuments.parse(lostAtStart), "test").lines())
          .containsExactly("]\u0301ΑΒ");
      assertThat(convert("<hi rend=\"supraline\"><supplied reason=\"lost\">γ</supplied></hi>"))
          .containsExactly("Α[-]Β");
    }
  }

  @Nested
  class Editorial {
    @Test
    void supplied() throws Exception {
      assertThat(convert("<supplied reason=\"omitted\">γ</supplied>")).containsExactly("ΑΒ");
      assertThat(convert("<supplied reason=\"lost\">γ</supplied>")).containsExactly("Α[-]Β");
      assertThat(convert("<supplied evidence=\"parallel\" reason=\"undefined\">Πόσεις</supplied>"))
          .containsExactly("Α[------]Β");
    }

    @Test
    void transparentAndSkippedElements() throws Exception {
      assertThat(convert("<surplus>γ</surplus>")).containsExactly("ΑΓΒ");
      assertThat(convert("<del rend=\"erasure\">γ</del>")).containsExactly("ΑΒ");
      assertThat(convert("<abbr>γ</abbr>")).containsExactly("ΑΓΒ");
      assertThat(convert("<handShift new=\"m4\"/>")).containsExactly("ΑΒ");
      assertThat(convert("<note xml:lang=\"en\">BGU 1,108,r reprinted in WChr 227 </note>"))
          .containsExactly("ΑΒ");
      assertThat(convert("<q>γ</q>")).containsExactly("ΑΓΒ");
    }

    @Test
    void expansions() throws Exception {
      assertThat(convert("<expan>Γ<ex cert=\"low\">ανίδι</ex></expan>")).containsExactly("ΑΓΒ");
      assertThat(convert("<expan><ex>ἔτους</ex></expan>")).containsExactly("Α\uD800\uDD79Β");
    }

    @Test
    void choiceKeepsTheOriginalReading() throws Exception {
      assertThat(
              convert(
                  "<choice><reg>φρόντι<supplied reason=\"lost\">σ</supplied>ον</reg>"
                      + "<orig>φρόνδει<supplied reason=\"lost\">σ</supplied>"
                      + "<unclear>ο</unclear>ν</orig></choice>"))
          .containsExactly("ΑΦΡΟΝΔΕΙ[-]Ο\u0323ΝΒ");
      assertThat(
              convert(
                  "<choice><reg cert=\"low\">ἀνοίγεται </reg><reg cert=\"low\">ἀνοίεται </reg>"
                      + "<orig><unclear>ἀ</unclear>νύεται</orig></choice>"))
          .containsExactly("ΑΑ\u0323ΝΥΕΤΑΙΒ");
    }

    @Test
    void apparatusKeepsTheLemma() throws Exception {
      assertThat(
              convert(
                  "<app type=\"alternative\"><lem>Ὀχυρυγχίτου</lem>"
                      + "<rdg>Ὀξυρυγχίτου νομοῦ</rdg></app>"))
          .containsExactly("ΑΟΧΥΡΥΓΧΙΤΟΥΒ");
      assertThat(
              convert(
                  "<app type=\"alternative\"><lem>"
                      + "<gap reason=\"lost\" extent=\"unknown\" unit=\"character\"/>"
                      + "<gap reason=\"illegible\" quantity=\"1\" unit=\"character\"/>αμεν"
                      + "<gap reason=\"illegible\" quantity=\"1\" unit=\"character\"/>"
                      + "<unclear>ν</unclear></lem>"
                      + "<rdg><supplied reason=\"lost\">ἀπογρα</supplied>ψ<unclear>α</unclear>μένη"
                      + "<unclear>ν</unclear></rdg>"
                      + "<rdg><gap reason=\"lost\">θρε</gap>ψ<unclear>α</unclear>μένη"
                      + "<unclear>ν</unclear></rdg></app>"))
          .containsExactly("Α[?]-ΑΜΕΝ-Ν\u0323Β");
    }

    @Test
    void corrections() throws Exception {
      assertThat(
              convert(
                  "<subst><add place=\"inline\">τοῦ</add><del rend=\"corrected\">της</del></subst>"))
          .containsExactly("ΑΤΟΥΒ");
      assertThat(convert("<choice><corr>τιμὴν</corr><sic>τμμὴν</sic></choice>"))
          .containsExactly("ΑΤΜΜΗΝΒ");
      assertThat(
              convert(
                  "<app type=\"editorial\"><lem resp=\"BGU 1 p.357\"><num value=\"23\">κγ</num></lem>"
                      + "<rdg><num value=\"26\">κϛ</num></rdg></app>"))
          .containsExactly("ΑΚΓΒ");
    }
  }

  @Nested
  class Symbols {
    @Test
    void milestonesGetTheirOwnLine() throws Exception {
      assertThat(convert("<milestone rend=\"paragraphos\" unit=\"undefined\"/><lb n=\"2\"/>"))
          .containsExactly("Α", "⸏", "Β");
      assertThat(convert("<milestone rend=\"horizontal-rule\" unit=\"undefined\"/><lb n=\"2\"/>"))
          .containsExactly("Α", "―", "Β");
      assertThat(convert("<milestone rend=\"wavy-line\" unit=\"undefined\"/><lb n=\"2\"/>"))
          .containsExactly("Α", "∼", "Β");
      assertThat(convert("<milestone rend=\"diple-obelismene\" unit=\"undefined\"/><lb n=\"2\"/>"))
          .containsExactly("Α", "⸐", "Β");
      assertThat(convert("<milestone rend=\"coronis\" unit=\"undefined\"/><lb n=\"2\"/>"))
          .containsExactly("Α", "⸎", "Β");
    }

    @Test
    void glyphTypes() throws Exception {
      assertThat(convert("<unclear><g type=\"check\"/></unclear>")).containsExactly("Α⁄Β");
      assertThat(convert("<g type=\"chirho\"/>")).containsExactly("Α☧Β");
      assertThat(
              convert(
                  "<g type=\"parens-punctuation-opening\"/> "
                      + "<g type=\"parens-punctuation-closing\"/>"))
          .containsExactly("Α⎨⎬Β");
    }

    @Test
    void tickedNumeralGetsApostrophe() throws Exception {
      assertThat(convert("<num value=\"3\" rend=\"tick\">γ</num>")).containsExactly("ΑΓ'Β");
    }
  }

  @Test
  void worksThroughAFullLine() throws Exception {
    FormattedTranscription result =
        converter.convert(
            TeiDocuments.edition(
                "12345",
                "grc",
                "<ab><lb n=\"380\"/><supplied reason=\"lost\">Ἀρ</supplied><unclear>κά</unclear>"
                    + "δι τὸν γεγρα<supplied reason=\"lost\">μμένο</supplied>ν χρόν"
                    + "<unclear>ον</unclear><gap reason=\"lost\" quantity=\"1\" unit=\"character\"/>"
                    + "<gap reason=\"illegible\" quantity=\"4\" unit=\"character\"/></ab>"),
            null);

    assertThat(result.id()).isEqualTo("12345");
    assertThat(result.lines())
        .containsExactly("]Κ\u0323Α\u0323ΔΙΤΟΝΓΕΓΡΑ[-----]ΝΧΡΟΝΟ\u0323Ν\u0323[-]----");
    assertThat(result.report().isClean()).isTrue();
  }

  @Test
  void unknownGlyphTypeFailsInStrictMode() {
    assertThatThrownBy(() -> convert("<g type=\"chi\"/>"))
        .isInstanceOf(UnsupportedSymbolException.class)
        .satisfies(
            e -> {
              UnsupportedSymbolException ex = (UnsupportedSymbolException) e;
              assertThat(ex.getValue()).isEqualTo("chi");
              assertThat(ex.getElement()).isEqualTo("g");
              assertThat(ex.getLineNumber()).isEqualTo("1");
              assertThat(ex.getStage()).isEqualTo(PapyrserException.Stage.SYMBOL);
              assertThat(ex).hasMessage("No glyph type entry for 'chi' on <g> (line 1)");
            });
  }

  @Test
  void unknownGlyphTypeIsDroppedInLenientMode() throws Exception {
    D5Converter lenient = new D5Converter(ConversionOptions.LENIENT);

    FormattedTranscription result = lenient.convert(TeiDocuments.line("<g type=\"chi\"/>"), "t");

    assertThat(result.lines()).containsExactly("ΑΒ");
    assertThat(result.report().hasErrors()).isFalse();
    assertThat(result.report().warnings()).hasSize(1);
  }

  @Test
  void unsupportedElementWithTextFails() {
    assertThatThrownBy(() -> convert("<foo>γ</foo>"))
        .isInstanceOf(TeiParseException.class)
        .hasMessage("Unsupported element <foo> carries text 'γ' (line 1)")
        .satisfies(
            e -> {
              TeiParseException ex = (TeiParseException) e;
              assertThat(ex.getStage()).isEqualTo(PapyrserException.Stage.PARSE);
              assertThat(ex.getLineNumber()).isEqualTo("1");
            });
  }
}
