/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

/**
 * Thrown when no rule of a table applies at some position of a word being encoded.
 *
 * <p>Rule tables are expected to cover every character they can encounter (typically via single
 * character fallback rules), so this indicates an incomplete rule corpus, or input outside the
 * alphabet for which the corpus was written. Since coverage depends on the input, this is only
 * detected when encoding.
 */
public final class UncoveredInputException extends IllegalStateException {
  private final String word;
  private final int position;
  private final String tableName;

  UncoveredInputException(String word, int position, String tableName) {
    super(
        String.format(
            "no rule in table '%s' matches '%s' at position %d of word: %s",
            tableName, word.charAt(position), position, word));
    this.word = word;
    this.position = position;
    this.tableName = tableName;
  }

  /** Returns the word (or intermediate phoneme text) being encoded. */
  public String getWord() {
    return word;
  }

  /** Returns the position in the word at which no rule applied. */
  public int getPosition() {
    return position;
  }

  /** Returns the character at which no rule applied. */
  public char getCharacter() {
    return word.charAt(position);
  }

  /** Returns the name of the rule table in which no rule applied. */
  public String getTableName() {
    return tableName;
  }
}
