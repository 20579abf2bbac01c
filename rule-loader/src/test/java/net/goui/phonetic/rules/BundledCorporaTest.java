/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Resources;
import com.google.common.truth.Expect;
import java.io.IOException;
import net.goui.phonetic.EncoderOptions;
import net.goui.phonetic.Language;
import net.goui.phonetic.LanguageSet;
import net.goui.phonetic.NameType;
import net.goui.phonetic.PhoneticEngine;
import net.goui.phonetic.RuleCorpus;
import net.goui.phonetic.RuleType;
import net.goui.phonetic.corpus.CorpusLoader;
import net.goui.phonetic.testing.EncodingRegressionTester;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BundledCorporaTest {
  @Rule public final Expect expect = Expect.create();

  @Test
  public void testGenericGoldenData() throws IOException {
    assertGoldenData(NameType.GENERIC, "gen_golden.tsv");
  }

  @Test
  public void testAshkenaziGoldenData() throws IOException {
    assertGoldenData(NameType.ASHKENAZI, "ash_golden.tsv");
  }

  @Test
  public void testSephardicGoldenData() throws IOException {
    assertGoldenData(NameType.SEPHARDIC, "sep_golden.tsv");
  }

  private void assertGoldenData(NameType nameType, String goldenFile) throws IOException {
    RuleCorpus corpus = CorpusReader.of(RuleSource.bundled()).read(nameType);
    String goldenData =
        Resources.toString(
            Resources.getResource(BundledCorporaTest.class, "/golden/" + goldenFile), UTF_8);
    int count = EncodingRegressionTester.forCorpus(corpus, expect).assertGoldenData(goldenData);
    assertThat(count).isGreaterThan(0);
  }

  @Test
  public void testServicesAreRegistered() {
    for (NameType nameType : NameType.values()) {
      RuleCorpus corpus = CorpusLoader.load(nameType);
      assertThat(corpus.nameType()).isEqualTo(nameType);
      assertThat(corpus.hasFinalRules(RuleType.APPROX)).isTrue();
      assertThat(corpus.hasFinalRules(RuleType.EXACT)).isTrue();
    }
    assertThat(CorpusLoader.load(NameType.SEPHARDIC).languages())
        .containsExactly(Language.FRENCH, Language.ITALIAN, Language.PORTUGUESE, Language.SPANISH)
        .inOrder();
  }

  @Test
  public void testCreateEngine() {
    PhoneticEngine engine =
        CorpusLoader.createEngine(
            EncoderOptions.builder(NameType.GENERIC).setRuleType(RuleType.EXACT).build());
    assertThat(engine.encode("Thompson Kowalski")).isEqualTo("tompson-kovalski");
  }

  @Test
  public void testEveryLanguageCoversTheAlphabet() throws IOException {
    // Every table includes the Latin fallback rules, so any lower case letter can be encoded.
    String alphabet = "abcdefghijklmnopqrstuvwxyzäöüßéèçñłąęśżźőűăşţ'-";
    for (NameType nameType : NameType.values()) {
      RuleCorpus corpus = CorpusReader.of(RuleSource.bundled()).read(nameType);
      PhoneticEngine engine = PhoneticEngine.create(corpus, EncoderOptions.of(nameType));
      for (Language language : corpus.languages()) {
        expect
            .withMessage("%s rules for %s", nameType.id(), language)
            .that(engine.encode(alphabet, LanguageSet.of(language)))
            .isNotEmpty();
      }
    }
  }
}
