/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import com.google.common.base.Ascii;

/**
 * Selects which rule tables govern a pass of the engine.
 *
 * <p>{@link #RULES} tables rewrite the spelling of a word into intermediate phonemes, and are
 * specific to a language. {@link #APPROX} and {@link #EXACT} tables perform the final,
 * language-agnostic, pass over those phonemes and act as the precision mode of an engine.
 */
public enum RuleType {
  /** Lossy final pass, merging similar sounds and producing more matches. */
  APPROX,
  /** Final pass which preserves finer distinctions and produces fewer matches. */
  EXACT,
  /** Language-specific spelling rules (not a valid precision mode). */
  RULES;

  /** Returns the rule type for a lower-case identifier (e.g. "approx"). */
  public static RuleType of(String id) {
    for (RuleType type : values()) {
      if (type.id().equals(id)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown rule type: '" + id + "'");
  }

  /** Returns the lower-case identifier of this rule type, as used in rule file names. */
  public String id() {
    return Ascii.toLowerCase(name());
  }

  /** Whether this rule type selects a final pass (i.e. is a valid precision mode). */
  public boolean isFinal() {
    return this != RULES;
  }
}
