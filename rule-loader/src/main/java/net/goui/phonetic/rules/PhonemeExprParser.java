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
import java.util.ArrayList;
import java.util.List;
import net.goui.phonetic.LanguageSet;
import net.goui.phonetic.Phoneme;
import net.goui.phonetic.PhonemeExpr;

/**
 * Parser for the phonetic part of a rule.
 *
 * <p>The syntax is either a single phoneme or a parenthesized list of alternatives separated by
 * {@code '|'}. Each phoneme is its text, optionally followed by the languages for which it is valid
 * in square brackets:
 *
 * <pre>{@code
 * "x"                   -> x[any]
 * "x[german]"           -> x[german]
 * "(o|u[polish+czech])" -> (o[any]|u[czech+polish])
 * "(|j)"                -> ([any]|j[any])
 * }</pre>
 *
 * A leading or trailing {@code '|'} in an alternation denotes an empty alternative.
 */
public final class PhonemeExprParser {
  private static final Splitter ALTERNATIVES = Splitter.on('|');

  /**
   * Parses a phoneme expression.
   *
   * @throws IllegalArgumentException if the expression is malformed or names unknown languages.
   */
  public static PhonemeExpr parse(String expression) {
    if (!expression.startsWith("(")) {
      return PhonemeExpr.of(parsePhoneme(expression));
    }
    checkArgument(
        expression.endsWith(")"), "unterminated alternation in phoneme expression: %s", expression);
    List<Phoneme> alternatives = new ArrayList<>();
    String body = expression.substring(1, expression.length() - 1);
    for (String alternative : ALTERNATIVES.split(body)) {
      alternatives.add(parsePhoneme(alternative));
    }
    return PhonemeExpr.copyOf(alternatives);
  }

  /** Parses a phoneme of the form {@code text} or {@code text[lang+lang]}. */
  static Phoneme parsePhoneme(String phoneme) {
    int start = phoneme.indexOf('[');
    if (start < 0) {
      checkArgument(
          phoneme.indexOf(']') < 0 && phoneme.indexOf('(') < 0 && phoneme.indexOf(')') < 0,
          "unexpected brackets in phoneme: %s",
          phoneme);
      return Phoneme.of(phoneme);
    }
    checkArgument(
        phoneme.endsWith("]") && phoneme.indexOf(']') == phoneme.length() - 1,
        "phoneme '%s' has a '[' but does not end with a ']'",
        phoneme);
    String languages = phoneme.substring(start + 1, phoneme.length() - 1);
    checkArgument(!languages.isEmpty(), "empty language list in phoneme: %s", phoneme);
    return Phoneme.of(phoneme.substring(0, start), LanguageSet.parse(languages));
  }

  private PhonemeExprParser() {}
}
