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
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.io.MoreFiles;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import net.goui.phonetic.EncoderOptions;
import net.goui.phonetic.Language;
import net.goui.phonetic.NameType;
import net.goui.phonetic.PhoneticEngine;
import net.goui.phonetic.RuleCorpus;
import net.goui.phonetic.RuleType;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CorpusReaderTest {
  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private static final RuleSource TEST_DATA =
      RuleSource.fromResources(CorpusReaderTest.class, "/testdata/");

  @Test
  public void testReadFromResources() throws IOException {
    RuleCorpus corpus = CorpusReader.of(TEST_DATA).read(NameType.SEPHARDIC);
    assertThat(corpus.nameType()).isEqualTo(NameType.SEPHARDIC);
    assertThat(corpus.languages()).containsExactly(Language.SPANISH);
    assertThat(corpus.guesser().getVotingLanguages()).containsExactly(Language.SPANISH);
    assertThat(corpus.getRules(Language.ANY).getName()).isEqualTo("sep_rules_any");
    // Included rules are part of the including table.
    assertThat(corpus.getRules(Language.SPANISH).size()).isEqualTo(29);
    assertThat(corpus.getFinalRules(RuleType.EXACT).getName()).isEqualTo("sep_exact_common");

    PhoneticEngine approx = PhoneticEngine.create(corpus, EncoderOptions.of(NameType.SEPHARDIC));
    assertThat(approx.encode("Muñoz")).isEqualTo("munos");
    assertThat(approx.encode("Lopez Castillo")).isEqualTo("lopes-(castilo|castijo)");
    PhoneticEngine exact =
        PhoneticEngine.create(
            corpus, EncoderOptions.builder(NameType.SEPHARDIC).setRuleType(RuleType.EXACT).build());
    assertThat(exact.encode("Muñoz")).isEqualTo("munjos");
  }

  @Test
  public void testMissingFiles() {
    // There are no generic rules in the test data.
    FileNotFoundException e =
        assertThrows(
            FileNotFoundException.class, () -> CorpusReader.of(TEST_DATA).read(NameType.GENERIC));
    assertThat(e).hasMessageThat().contains("/testdata/gen_languages.txt");
  }

  @Test
  public void testReadFromDirectory() throws IOException {
    Path dir = tmp.getRoot().toPath();
    write(dir, "ash_languages", "german");
    write(dir, "ash_lang", "\"sch\" \"\" \"\" \"german\"");
    write(dir, "ash_rules_any", "\"sch\" \"\" \"\" \"(S|sk)\"", "#include letters");
    write(dir, "ash_rules_german", "\"sch\" \"\" \"\" \"S\"", "#include letters");
    write(dir, "ash_approx_common", "#include letters");
    write(dir, "ash_exact_common", "#include letters");
    write(
        dir,
        "letters",
        "\"a\" \"\" \"\" \"a\"",
        "\"c\" \"\" \"\" \"k\"",
        "\"h\" \"\" \"\" \"h\"",
        "\"k\" \"\" \"\" \"k\"",
        "\"s\" \"\" \"\" \"s\"",
        "\"S\" \"\" \"\" \"S\"");

    RuleCorpus corpus = CorpusReader.of(RuleSource.fromDirectory(dir)).read(NameType.ASHKENAZI);
    PhoneticEngine engine = PhoneticEngine.create(corpus, EncoderOptions.of(NameType.ASHKENAZI));
    assertThat(engine.encode("Schach")).isEqualTo("Sakh");
    assertThat(engine.encode("Kasch")).isEqualTo("kaS");
    // No evidence for German, so the unrestricted rules apply.
    assertThat(engine.encode("Kash")).isEqualTo("kash");
  }

  @Test
  public void testMalformedFileInDirectory() throws IOException {
    Path dir = tmp.getRoot().toPath();
    write(dir, "gen_languages", "english", "elvish");
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> CorpusReader.of(RuleSource.fromDirectory(dir)).read(NameType.GENERIC));
    assertThat(e).hasMessageThat().startsWith("gen_languages:2:");
  }

  private static void write(Path dir, String name, String... lines) throws IOException {
    MoreFiles.asCharSink(dir.resolve(name + ".txt"), UTF_8).write(Joiner.on('\n').join(lines));
  }
}
