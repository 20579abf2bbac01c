/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RuleTableTest {
  @Test
  public void testLongestMatchWins() {
    RuleTable table =
        table(rule("s", "", "", "s"), rule("sch", "", "", "S"), rule("sc", "", "", "sk"));
    assertThat(match(table, "schön", 0)).isEqualTo("sch");
    assertThat(match(table, "scot", 0)).isEqualTo("sc");
    assertThat(match(table, "sol", 0)).isEqualTo("s");
  }

  @Test
  public void testFirstDeclaredWinsTies() {
    RuleTable table = table(rule("ch", "", "", "x"), rule("ch", "", "", "tS"));
    assertThat(table.match("chaim", 0).map(Rule::phonetic))
        .isEqualTo(Optional.of(PhonemeExpr.of(Phoneme.of("x"))));
  }

  @Test
  public void testContexts() {
    RuleTable table =
        table(
            rule("s", "^", "[aeiou]", "z"),
            rule("h", "[aeiou]", "", ""),
            rule("d", "", "$", "t"),
            rule("s", "", "", "s"),
            rule("h", "", "", "h"),
            rule("d", "", "", "d"));
    assertThat(phonetic(table, "sonne", 0)).isEqualTo("z");
    // Only at the start of the word.
    assertThat(phonetic(table, "osa", 1)).isEqualTo("s");
    assertThat(phonetic(table, "sta", 0)).isEqualTo("s");
    assertThat(phonetic(table, "aha", 1)).isEqualTo("");
    assertThat(phonetic(table, "ha", 0)).isEqualTo("h");
    assertThat(phonetic(table, "rad", 2)).isEqualTo("t");
    assertThat(phonetic(table, "rado", 2)).isEqualTo("d");
  }

  @Test
  public void testLeftContextSeesWholePrefix() {
    RuleTable table = table(rule("e", "^sch", "", "E"), rule("e", "", "", "e"));
    assertThat(phonetic(table, "schem", 3)).isEqualTo("E");
    assertThat(phonetic(table, "xschem", 4)).isEqualTo("e");
  }

  @Test
  public void testNoMatch() {
    RuleTable table = table(rule("a", "", "", "a"));
    assertThat(table.match("ab", 1)).isEqualTo(Optional.empty());
    // Patterns cannot extend past the end of the text.
    assertThat(table(rule("ab", "", "", "x")).match("a", 0)).isEqualTo(Optional.empty());
    assertThrows(IndexOutOfBoundsException.class, () -> table.match("ab", 2));
  }

  @Test
  public void testLanguageRestrictedRules() {
    LanguageSet german = LanguageSet.parse("german");
    LanguageSet polish = LanguageSet.parse("polish");
    RuleTable table =
        RuleTable.of(
            "test",
            ImmutableList.of(
                Rule.create(0, "w", "", "", expr("v"), german),
                Rule.create(1, "w", "", "", expr("w"))));
    assertThat(table.match("wald", 0, german).get().index()).isEqualTo(0);
    assertThat(table.match("wald", 0, polish).get().index()).isEqualTo(1);
    // Unrestricted text can use any rule.
    assertThat(table.match("wald", 0).get().index()).isEqualTo(0);
  }

  @Test
  public void testIndexing() {
    RuleTable table =
        table(rule("a", "", "", "a"), rule("b", "", "", "b"), rule("ab", "", "", "x"));
    assertThat(table.getName()).isEqualTo("test");
    assertThat(table.size()).isEqualTo(3);
    assertThat(table.getLeadingCharacters()).containsExactly('a', 'b');
    assertThat(table.getRules('a').stream().map(Rule::pattern).collect(toImmutableList()))
        .containsExactly("a", "ab")
        .inOrder();
    assertThat(table.getRules('z')).isEmpty();
  }

  @Test
  public void testErrors() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            RuleTable.of(
                "test",
                ImmutableList.of(
                    Rule.create(1, "a", "", "", expr("a")),
                    Rule.create(0, "b", "", "", expr("b")))));
    assertThrows(IllegalArgumentException.class, () -> Rule.create(0, "", "", "", expr("a")));
    assertThrows(IllegalArgumentException.class, () -> table(rule("a", "[a", "", "a")));
  }

  private static PhonemeExpr expr(String text) {
    return PhonemeExpr.of(Phoneme.of(text));
  }

  private final List<Rule> declared = new ArrayList<>();

  private Rule rule(String pattern, String left, String right, String phonetic) {
    Rule rule = Rule.create(declared.size(), pattern, left, right, expr(phonetic));
    declared.add(rule);
    return rule;
  }

  private static RuleTable table(Rule... rules) {
    return RuleTable.of("test", ImmutableList.copyOf(rules));
  }

  private static String match(RuleTable table, String text, int position) {
    return table.match(text, position).get().pattern();
  }

  private static String phonetic(RuleTable table, String text, int position) {
    Rule rule = table.match(text, position).get();
    return ((PhonemeExpr.Single) rule.phonetic()).phoneme().text();
  }
}
