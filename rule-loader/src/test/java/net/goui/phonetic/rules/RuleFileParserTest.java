/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import net.goui.phonetic.Language;
import net.goui.phonetic.LanguageSet;
import net.goui.phonetic.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RuleFileParserTest {
  private final Map<String, String> files = new HashMap<>();

  private final RuleSource source =
      new RuleSource() {
        @Override
        public String read(String fileName) throws IOException {
          String text = files.get(fileName);
          if (text == null) {
            throw new FileNotFoundException(fileName);
          }
          return text;
        }
      };

  private void addFile(String name, String... lines) {
    files.put(name, Joiner.on('\n').join(lines));
  }

  private ImmutableList<Rule> parseRules(String fileName) throws IOException {
    return new RuleFileParser(source).parseRules(fileName);
  }

  @Test
  public void testRules() throws IOException {
    addFile(
        "test",
        "\"sch\" \"\" \"\" \"S\"",
        "  \"s\"   \"^\"  \"[aeiou]\"  \"z\"   // voiced at the start",
        "\"ch\" \"\" \"\" \"(x|tS[english])\" \"german+english\"");
    ImmutableList<Rule> rules = parseRules("test");
    assertThat(rules).hasSize(3);

    Rule first = rules.get(0);
    assertThat(first.index()).isEqualTo(0);
    assertThat(first.pattern()).isEqualTo("sch");
    assertThat(first.leftContext()).isEmpty();
    assertThat(first.languages()).isEqualTo(LanguageSet.any());

    Rule second = rules.get(1);
    assertThat(second.pattern()).isEqualTo("s");
    assertThat(second.leftContext()).isEqualTo("^");
    assertThat(second.rightContext()).isEqualTo("[aeiou]");
    assertThat(second.phonetic().toString()).isEqualTo("z[any]");

    Rule third = rules.get(2);
    assertThat(third.phonetic().toString()).isEqualTo("(x[any]|tS[english])");
    assertThat(third.languages()).isEqualTo(LanguageSet.parse("english+german"));
  }

  @Test
  public void testComments() throws IOException {
    addFile(
        "test",
        "// A comment.",
        "",
        "/* A single line comment block. */",
        "\"a\" \"\" \"\" \"a\"",
        "/*",
        "\"b\" \"\" \"\" \"b\"",
        " * More comment.",
        " */",
        "   ",
        "\"c\" \"\" \"\" \"c\"  // trailing comment");
    assertThat(patterns(parseRules("test"))).containsExactly("a", "c").inOrder();
  }

  @Test
  public void testTrailingCommentEndingInCommentClose() throws IOException {
    addFile("test", "\"a\" \"\" \"\" \"a\"  // closes */", "\"b\" \"\" \"\" \"b\"");
    ImmutableList<Rule> rules = parseRules("test");
    assertThat(patterns(rules)).containsExactly("a", "b").inOrder();
    assertThat(rules.get(1).index()).isEqualTo(1);
  }

  @Test
  public void testTrailingBlockCommentIsAnError() {
    addFile(
        "bad",
        "\"a\" \"\" \"\" \"a\"",
        "\"b\" \"\" \"\" \"b\" /* note */",
        "\"c\" \"\" \"\" \"c\"");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> parseRules("bad"));
    assertThat(e).hasMessageThat().startsWith("bad:2: invalid rule line");
  }

  @Test
  public void testIncludesPreserveDeclarationOrder() throws IOException {
    addFile("letters", "\"a\" \"\" \"\" \"a\"", "\"b\" \"\" \"\" \"b\"");
    addFile("extra", "\"x\" \"\" \"\" \"ks\"", "#include letters  // nested");
    addFile("test", "\"ab\" \"\" \"\" \"p\"", "#include extra", "\"ba\" \"\" \"\" \"q\"");
    ImmutableList<Rule> rules = parseRules("test");
    assertThat(patterns(rules)).containsExactly("ab", "x", "a", "b", "ba").inOrder();
    assertThat(rules.stream().map(Rule::index).collect(toImmutableList()))
        .containsExactly(0, 1, 2, 3, 4)
        .inOrder();
  }

  @Test
  public void testLanguageRules() throws IOException {
    addFile("test_lang", "\"sz\" \"\" \"\" \"polish+hungarian\"", "\"ski\" \"\" \"$\" \"polish\"");
    ImmutableList<Rule> rules = new RuleFileParser(source).parseLanguageRules("test_lang");
    assertThat(rules.get(0).languages()).isEqualTo(LanguageSet.parse("hungarian+polish"));
    assertThat(rules.get(1).rightContext()).isEqualTo("$");
    assertThat(rules.get(1).phonetic().toString()).isEqualTo("[any]");
  }

  @Test
  public void testLanguages() throws IOException {
    addFile("test_languages", "// Supported languages.", "any", "polish", "german  // comment");
    assertThat(new RuleFileParser(source).parseLanguages("test_languages"))
        .containsExactly(Language.GERMAN, Language.POLISH)
        .inOrder();
  }

  @Test
  public void testErrorsReportFileAndLine() {
    ImmutableMap.of(
            "not a rule", "invalid rule line",
            "\"a\" \"\" \"\"", "invalid rule line",
            "\"\" \"\" \"\" \"a\"", "invalid rule line",
            "\"a\" \"\" \"\" \"(a|b\"", "unterminated alternation",
            "\"a\" \"\" \"\" \"a[klingon]\"", "klingon",
            "\"a\" \"[a\" \"\" \"a\"", "invalid context",
            "\"a\" \"\" \"\" \"a\" \"any\" \"extra\"", "unknown language")
        .forEach(
            (line, message) -> {
              addFile("bad", "// Line 1", line);
              IllegalArgumentException e =
                  assertThrows(IllegalArgumentException.class, () -> parseRules("bad"));
              assertThat(e).hasMessageThat().startsWith("bad:2: ");
              assertThat(e).hasMessageThat().contains(message);
            });
  }

  @Test
  public void testIncludeErrors() {
    addFile("self", "#include other");
    addFile("other", "#include self");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> parseRules("self"));
    assertThat(e).hasMessageThat().contains("recursive include");

    addFile("missing", "#include nowhere");
    assertThrows(FileNotFoundException.class, () -> parseRules("missing"));

    addFile("unterminated", "\"a\" \"\" \"\" \"a\"", "/* never closed");
    assertThrows(IllegalArgumentException.class, () -> parseRules("unterminated"));
  }

  private static ImmutableList<String> patterns(ImmutableList<Rule> rules) {
    return rules.stream().map(Rule::pattern).collect(toImmutableList());
  }
}
