/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A single rewrite directive of a rule table.
 *
 * <p>A rule applies at a position in some text if its pattern occurs at that position, its left
 * context matches the text immediately before the position, and its right context matches the
 * text immediately after the pattern. Contexts are regular expressions evaluated against the
 * region before (or after) the pattern, so {@code ^} and {@code $} anchor to the start and end of
 * the word. An empty context always matches.
 *
 * <p>The index of a rule is its declaration order within a table, and is used to break ties
 * between rules with patterns of the same length.
 */
@AutoValue
public abstract class Rule {

  /**
   * Creates a rule from its parsed parts.
   *
   * @throws IllegalArgumentException if the pattern is empty or a context is not a valid regular
   *     expression.
   */
  public static Rule create(
      int index,
      String pattern,
      String leftContext,
      String rightContext,
      PhonemeExpr phonetic,
      LanguageSet languages) {
    checkArgument(!pattern.isEmpty(), "rule patterns must not be empty (rule %s)", index);
    checkArgument(index >= 0, "rule index must not be negative: %s", index);
    return new AutoValue_Rule(index, pattern, leftContext, rightContext, phonetic, languages);
  }

  /** Creates a rule, valid for any language, with the given phonetic replacement. */
  public static Rule create(
      int index, String pattern, String leftContext, String rightContext, PhonemeExpr phonetic) {
    return create(index, pattern, leftContext, rightContext, phonetic, LanguageSet.any());
  }

  public abstract int index();

  public abstract String pattern();

  public abstract String leftContext();

  public abstract String rightContext();

  public abstract PhonemeExpr phonetic();

  public abstract LanguageSet languages();

  // Compiled lazily but exactly once per rule; null means "always matches".
  @Memoized
  @Nullable
  Pattern leftPattern() {
    return compileContext(leftContext(), "(?:" + leftContext() + ")$");
  }

  @Memoized
  @Nullable
  Pattern rightPattern() {
    return compileContext(rightContext(), rightContext());
  }

  /**
   * Compiles both contexts, reporting syntax errors at load time rather than at match time.
   *
   * @throws IllegalArgumentException if either context is not a valid regular expression.
   */
  @CanIgnoreReturnValue
  public final Rule validate() {
    leftPattern();
    rightPattern();
    return this;
  }

  private @Nullable Pattern compileContext(String context, String regex) {
    if (context.isEmpty()) {
      return null;
    }
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException(
          String.format("invalid context '%s' in rule: %s", context, this), e);
    }
  }

  /** Whether this rule applies at the given position of the text. */
  public final boolean matches(CharSequence text, int position) {
    int end = position + pattern().length();
    if (end > text.length() || !startsWith(text, position)) {
      return false;
    }
    Pattern right = rightPattern();
    if (right != null && !right.matcher(text).region(end, text.length()).lookingAt()) {
      return false;
    }
    Pattern left = leftPattern();
    if (left != null) {
      Matcher m = left.matcher(text).region(0, position);
      return m.find();
    }
    return true;
  }

  private boolean startsWith(CharSequence text, int position) {
    String pattern = pattern();
    for (int n = 0; n < pattern.length(); n++) {
      if (text.charAt(position + n) != pattern.charAt(n)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public final String toString() {
    return String.format(
        "#%d \"%s\" \"%s\" \"%s\" %s %s",
        index(), pattern(), leftContext(), rightContext(), phonetic(), languages());
  }
}
