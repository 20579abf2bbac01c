/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import net.goui.phonetic.LanguageSet;
import net.goui.phonetic.Phoneme;
import net.goui.phonetic.PhonemeExpr;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PhonemeExprParserTest {
  @Test
  public void testSinglePhoneme() {
    assertThat(PhonemeExprParser.parse("tS")).isEqualTo(PhonemeExpr.of(Phoneme.of("tS")));
    assertThat(PhonemeExprParser.parse("")).isEqualTo(PhonemeExpr.of(Phoneme.of("")));
    assertThat(PhonemeExprParser.parse("x[german+polish]"))
        .isEqualTo(PhonemeExpr.of(Phoneme.of("x", LanguageSet.parse("german+polish"))));
  }

  @Test
  public void testAlternation() {
    assertThat(PhonemeExprParser.parse("(o|u[polish+czech])").toString())
        .isEqualTo("(o[any]|u[czech+polish])");
    // Leading and trailing separators denote empty alternatives.
    assertThat(PhonemeExprParser.parse("(|j)").toString()).isEqualTo("([any]|j[any])");
    assertThat(PhonemeExprParser.parse("(e|)").toString()).isEqualTo("(e[any]|[any])");
    // Duplicates are merged.
    assertThat(PhonemeExprParser.parse("(a|a)")).isEqualTo(PhonemeExpr.of(Phoneme.of("a")));
  }

  @Test
  public void testErrors() {
    assertThrows(IllegalArgumentException.class, () -> PhonemeExprParser.parse("(a|b"));
    assertThrows(IllegalArgumentException.class, () -> PhonemeExprParser.parse("a[german"));
    assertThrows(IllegalArgumentException.class, () -> PhonemeExprParser.parse("a[german]b"));
    assertThrows(IllegalArgumentException.class, () -> PhonemeExprParser.parse("a[]"));
    assertThrows(IllegalArgumentException.class, () -> PhonemeExprParser.parse("a]"));
    assertThrows(IllegalArgumentException.class, () -> PhonemeExprParser.parse("a[klingon]"));
    assertThrows(IllegalArgumentException.class, () -> PhonemeExprParser.parse("(a|(b))"));
  }
}
