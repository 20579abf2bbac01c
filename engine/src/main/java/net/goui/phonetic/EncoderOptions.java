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

/**
 * Configuration of a {@link PhoneticEngine}, fixed when the engine is created.
 *
 * <pre>{@code
 * EncoderOptions options =
 *     EncoderOptions.builder(NameType.GENERIC)
 *         .setRuleType(RuleType.EXACT)
 *         .setLanguages(LanguageSet.of(Language.GERMAN, Language.POLISH))
 *         .build();
 * }</pre>
 */
@AutoValue
public abstract class EncoderOptions {
  /** The default maximum number of alternative encodings of a single word. */
  public static final int DEFAULT_MAX_PHONEMES = 20;

  /** The default separator between the encodings of words in a name. */
  public static final String DEFAULT_WORD_SEPARATOR = "-";

  public static Builder builder(NameType nameType) {
    return new AutoValue_EncoderOptions.Builder()
        .setNameType(nameType)
        .setRuleType(RuleType.APPROX)
        .setLanguages(LanguageSet.any())
        .setMaxPhonemes(DEFAULT_MAX_PHONEMES)
        .setWordSeparator(DEFAULT_WORD_SEPARATOR);
  }

  /** Returns the default options for a name type. */
  public static EncoderOptions of(NameType nameType) {
    return builder(nameType).build();
  }

  /** The name type, which selects the rule corpus. */
  public abstract NameType nameType();

  /** The precision mode, either {@link RuleType#APPROX} or {@link RuleType#EXACT}. */
  public abstract RuleType ruleType();

  /** Languages to which every encoding is restricted (unrestricted by default). */
  public abstract LanguageSet languages();

  /** The maximum number of alternatives kept for any word. */
  public abstract int maxPhonemes();

  /** The separator placed between the formatted encodings of words. */
  public abstract String wordSeparator();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setNameType(NameType nameType);

    public abstract Builder setRuleType(RuleType ruleType);

    public abstract Builder setLanguages(LanguageSet languages);

    public abstract Builder setMaxPhonemes(int maxPhonemes);

    public abstract Builder setWordSeparator(String separator);

    abstract EncoderOptions autoBuild();

    public EncoderOptions build() {
      EncoderOptions options = autoBuild();
      checkArgument(
          options.ruleType().isFinal(),
          "rule type must be 'approx' or 'exact': %s",
          options.ruleType());
      checkArgument(
          options.maxPhonemes() > 0,
          "maximum phonemes must be positive: %s",
          options.maxPhonemes());
      return options;
    }
  }
}
