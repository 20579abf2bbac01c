/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/**
 * Selects the rule corpus (onomastic tradition) used by an engine.
 *
 * <p>Each name type has its own languages, language guessing rules and rule tables, and is
 * selected once when an engine is created.
 */
public enum NameType {
  /** Ashkenazi Jewish names. */
  ASHKENAZI("ash"),
  /** General names, not specific to any tradition. */
  GENERIC("gen"),
  /** Sephardic Jewish names. */
  SEPHARDIC("sep");

  /** Returns the name type for a short identifier (e.g. "gen"). */
  public static NameType of(String id) {
    return Arrays.stream(values())
        .filter(t -> t.id.equals(id))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown name type: '" + id + "'"));
  }

  private final String id;

  NameType(String id) {
    this.id = id;
  }

  /** Returns the short identifier of this name type, which prefixes its rule file names. */
  public String id() {
    return id;
  }

  /** Returns the name of the file listing the languages of this name type. */
  public String getLanguagesFileName() {
    return id + "_languages";
  }

  /** Returns the name of the file holding the language guessing rules of this name type. */
  public String getLanguageRulesFileName() {
    return id + "_lang";
  }

  /**
   * Returns the name of a rule file of this name type (e.g. "gen_rules_english").
   *
   * @param table either a language identifier or "common" for the final rule tables.
   */
  public String getRulesFileName(RuleType ruleType, String table) {
    checkArgument(!table.isEmpty(), "table name must not be empty");
    return id + "_" + ruleType.id() + "_" + table;
  }
}
