/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.stream.Collectors.joining;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule based phonetic encoder of names, in the style of Beider-Morse phonetic matching.
 *
 * <p>Each word of a name is encoded independently:
 *
 * <ol>
 *   <li>The languages of the word are guessed and restricted to the configured languages.
 *   <li>The word is rewritten into intermediate phonemes using the spelling rules of each of
 *       those languages (or the language-agnostic rules if the word is unrestricted).
 *   <li>The alternatives for all languages are merged and passed through the final rules of the
 *       configured precision ("approx" or "exact").
 *   <li>The result is limited to the configured maximum number of alternatives.
 * </ol>
 *
 * <p>A word with one encoding is formatted as its text, and a word with several is formatted as
 * {@code (alt1|alt2|...)}. Encoded words are joined by the word separator.
 *
 * <p>An engine holds no mutable state, and encoding is a pure function of the input, so a single
 * instance can be shared between any number of threads.
 */
public final class PhoneticEngine implements PhoneticEncoder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Splitter WORD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /**
   * Creates an engine for a rule corpus.
   *
   * @throws IllegalArgumentException if the corpus does not match the name type of the options,
   *     has no final rules for the configured precision, or does not support the configured
   *     languages.
   */
  public static PhoneticEngine create(RuleCorpus corpus, EncoderOptions options) {
    checkArgument(
        corpus.nameType() == options.nameType(),
        "corpus name type '%s' does not match options: %s",
        corpus.nameType(),
        options);
    checkArgument(
        corpus.hasFinalRules(options.ruleType()),
        "corpus has no '%s' rules: %s",
        options.ruleType().id(),
        corpus);
    PhoneticEngine engine = new PhoneticEngine(corpus, options);
    engine.checkSupported(options.languages());
    return engine;
  }

  private final RuleCorpus corpus;
  private final EncoderOptions options;
  private final RuleTable finalRules;

  private PhoneticEngine(RuleCorpus corpus, EncoderOptions options) {
    this.corpus = corpus;
    this.options = options;
    this.finalRules = corpus.getFinalRules(options.ruleType());
  }

  public EncoderOptions getOptions() {
    return options;
  }

  /**
   * Returns the phonetic encoding of a name, restricted to the configured languages.
   *
   * @throws UncoveredInputException if the name contains characters not covered by the rules.
   */
  @Override
  public String encode(String name) {
    return encode(name, options.languages());
  }

  /**
   * Returns the phonetic encoding of a name, restricted to the given languages instead of the
   * configured ones.
   *
   * @throws IllegalArgumentException if a language is not supported by the corpus.
   * @throws UncoveredInputException if the name contains characters not covered by the rules.
   */
  public String encode(String name, LanguageSet languages) {
    return encodeToPhonemes(name, languages).stream()
        .map(PhoneticEngine::format)
        .collect(joining(options.wordSeparator()));
  }

  /** Returns the alternative encodings of each word of a name, in order. */
  public ImmutableList<PhonemeExpr> encodeToPhonemes(String name) {
    return encodeToPhonemes(name, options.languages());
  }

  /**
   * Returns the alternative encodings of each word of a name, in order, restricted to the given
   * languages. An empty (or blank) name has no words.
   */
  public ImmutableList<PhonemeExpr> encodeToPhonemes(String name, LanguageSet languages) {
    checkSupported(languages);
    return WORD_SPLITTER
        .splitToStream(name.toLowerCase(Locale.ROOT))
        .map(word -> encodeWord(word, languages))
        .collect(toImmutableList());
  }

  /** Formats the alternatives of an encoded word as {@code text} or {@code (text1|text2|...)}. */
  public static String format(PhonemeExpr expr) {
    if (!expr.isAlternation()) {
      return expr.phonemes().get(0).text();
    }
    return expr.phonemes().stream()
        .map(Phoneme::text)
        .collect(joining("|", "(", ")"));
  }

  private void checkSupported(LanguageSet languages) {
    checkArgument(
        languages.isAny() || corpus.languages().containsAll(languages.languages()),
        "languages %s are not supported by: %s",
        languages,
        corpus);
  }

  private PhonemeExpr encodeWord(String word, LanguageSet restriction) {
    LanguageSet active = corpus.guesser().guess(word, restriction);
    PhonemeExpr intermediate;
    if (active.isAny()) {
      intermediate = applyRules(word, corpus.getRules(Language.ANY), LanguageSet.any());
    } else {
      List<Phoneme> perLanguage = new ArrayList<>();
      for (Language language : active.languages()) {
        RuleTable rules = corpus.getRules(language);
        perLanguage.addAll(applyRules(word, rules, LanguageSet.of(language)).phonemes());
      }
      intermediate = PhonemeExpr.copyOf(perLanguage).dedupe();
    }
    List<Phoneme> alternatives = new ArrayList<>();
    for (Phoneme phoneme : intermediate.phonemes()) {
      alternatives.addAll(applyRules(phoneme.text(), finalRules, phoneme.languages()).phonemes());
    }
    return limit(PhonemeExpr.copyOf(alternatives).dedupe(), word);
  }

  /**
   * Rewrites text using a table, starting from the empty phoneme of the given languages. At each
   * position the best rule is applied and the cursor advances past its pattern.
   */
  private PhonemeExpr applyRules(String text, RuleTable table, LanguageSet languages) {
    PhonemeExpr encoded = PhonemeExpr.empty(languages);
    int position = 0;
    while (position < text.length()) {
      Rule rule = table.match(text, position, languages).orElse(null);
      if (rule == null) {
        throw new UncoveredInputException(text, position, table.getName());
      }
      // Early truncation, so alternatives never exceed the maximum during a walk.
      encoded = limit(encoded.concat(rule.phonetic()), text);
      position += rule.pattern().length();
    }
    return encoded;
  }

  private PhonemeExpr limit(PhonemeExpr expr, String text) {
    int maxPhonemes = options.maxPhonemes();
    if (expr.size() > maxPhonemes) {
      logger.atFine().log(
          "dropping %d alternative(s) when encoding '%s'", expr.size() - maxPhonemes, text);
      return expr.truncate(maxPhonemes);
    }
    return expr;
  }

  @Override
  public String toString() {
    return String.format("PhoneticEngine{%s, options=%s}", corpus, options);
  }
}
