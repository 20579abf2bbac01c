/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.goui.phonetic.Language;
import net.goui.phonetic.LanguageSet;
import net.goui.phonetic.Phoneme;
import net.goui.phonetic.PhonemeExpr;
import net.goui.phonetic.Rule;

/**
 * Parser for rule files.
 *
 * <p>A rule file consists of lines of the form:
 *
 * <pre>{@code
 * "pattern" "left-context" "right-context" "phonetic" ["languages"]  // optional comment
 * }</pre>
 *
 * where contexts are regular expressions (possibly empty), the phonetic part is parsed by {@link
 * PhonemeExprParser} and the optional languages (e.g. "german+polish") restrict the rule. In
 * language guessing files, the fourth part holds the languages voted for by the rule instead of a
 * phonetic expression.
 *
 * <p>Blank lines, {@code //} comments and {@code /* ... *}{@code /} comments are ignored, and a
 * line of the form {@code #include other_file} inserts the rules of another file at that point.
 * Rules are numbered in the order in which they are read, including those which are included.
 */
public final class RuleFileParser {
  private static final Pattern RULE_LINE =
      Pattern.compile(
          "\"(.+?)\"\\s+\"(.*?)\"\\s+\"(.*?)\"\\s+\"(.*?)\"(?:\\s+\"(.*?)\")?\\s*(?://.*)?");
  private static final Pattern INCLUDE_LINE = Pattern.compile("#include\\s+([a-z_]+)\\s*(?://.*)?");
  private static final Pattern LANGUAGE_LINE = Pattern.compile("([a-z]+)\\s*(?://.*)?");

  private static final String SINGLE_LINE_COMMENT = "//";
  private static final String MULTI_LINE_COMMENT_START = "/*";
  private static final String MULTI_LINE_COMMENT_END = "*/";

  private static final Splitter LINES = Splitter.onPattern("\r?\n");

  private final RuleSource source;
  // Shared by all files read by this parser, so included rules are numbered in reading order.
  private int nextIndex = 0;

  public RuleFileParser(RuleSource source) {
    this.source = source;
  }

  /** Parses a file of rewrite rules, in declaration order. */
  public ImmutableList<Rule> parseRules(String fileName) throws IOException {
    ImmutableList.Builder<Rule> rules = ImmutableList.builder();
    parse(fileName, new ArrayDeque<>(), (m, index) -> rules.add(toRule(m, index)));
    return rules.build();
  }

  /** Parses a file of language guessing rules, in declaration order. */
  public ImmutableList<Rule> parseLanguageRules(String fileName) throws IOException {
    ImmutableList.Builder<Rule> rules = ImmutableList.builder();
    parse(fileName, new ArrayDeque<>(), (m, index) -> rules.add(toLanguageRule(m, index)));
    return rules.build();
  }

  /**
   * Parses a file listing one language identifier per line, returning the concrete languages
   * (i.e. ignoring "any").
   */
  public ImmutableSet<Language> parseLanguages(String fileName) throws IOException {
    Set<Language> languages = EnumSet.noneOf(Language.class);
    forEachLine(
        fileName,
        (line, lineNumber) -> {
          Matcher m = LANGUAGE_LINE.matcher(line);
          checkArgument(
              m.matches(), "%s:%s: invalid language line: %s", fileName, lineNumber, line);
          Language language = parseAt(fileName, lineNumber, () -> Language.of(m.group(1)));
          if (language != Language.ANY) {
            languages.add(language);
          }
        });
    return Sets.immutableEnumSet(languages);
  }

  private interface RuleConsumer {
    void accept(Matcher match, int index);
  }

  private interface LineConsumer {
    void accept(String line, int lineNumber) throws IOException;
  }

  private interface Parse<T> {
    T get();
  }

  private void parse(String fileName, Deque<String> includeStack, RuleConsumer consumer)
      throws IOException {
    checkArgument(
        !includeStack.contains(fileName),
        "recursive include of '%s' via: %s",
        fileName,
        includeStack);
    includeStack.push(fileName);
    forEachLine(
        fileName,
        (line, lineNumber) -> {
          Matcher include = INCLUDE_LINE.matcher(line);
          if (include.matches()) {
            parse(include.group(1), includeStack, consumer);
            return;
          }
          Matcher rule = RULE_LINE.matcher(line);
          checkArgument(rule.matches(), "%s:%s: invalid rule line: %s", fileName, lineNumber, line);
          int index = nextIndex++;
          parseAt(
              fileName,
              lineNumber,
              () -> {
                consumer.accept(rule, index);
                return null;
              });
        });
    includeStack.pop();
  }

  private void forEachLine(String fileName, LineConsumer consumer) throws IOException {
    List<String> lines = LINES.splitToList(source.read(fileName));
    boolean inComment = false;
    for (int n = 0; n < lines.size(); n++) {
      String line = lines.get(n).trim();
      if (inComment) {
        inComment = !line.endsWith(MULTI_LINE_COMMENT_END);
      } else if (line.startsWith(MULTI_LINE_COMMENT_START)) {
        // A comment opened and closed on the same line ("/* ... */") is skipped.
        inComment = line.length() < 4 || !line.endsWith(MULTI_LINE_COMMENT_END);
      } else if (!line.isEmpty() && !line.startsWith(SINGLE_LINE_COMMENT)) {
        consumer.accept(line, n + 1);
      }
    }
    checkArgument(!inComment, "%s: unterminated multi-line comment", fileName);
  }

  private static <T> T parseAt(String fileName, int lineNumber, Parse<T> parse) {
    try {
      return parse.get();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("%s:%d: %s", fileName, lineNumber, e.getMessage()), e);
    }
  }

  private static Rule toRule(Matcher m, int index) {
    PhonemeExpr phonetic = PhonemeExprParser.parse(m.group(4));
    LanguageSet languages = m.group(5) != null ? LanguageSet.parse(m.group(5)) : LanguageSet.any();
    return Rule.create(index, m.group(1), m.group(2), m.group(3), phonetic, languages).validate();
  }

  private static Rule toLanguageRule(Matcher m, int index) {
    checkArgument(m.group(5) == null, "unexpected fifth part in language rule");
    LanguageSet languages = LanguageSet.parse(m.group(4));
    return Rule.create(
            index, m.group(1), m.group(2), m.group(3), PhonemeExpr.of(Phoneme.of("")), languages)
        .validate();
  }
}
