/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic;

/**
 * An encoder of names into strings approximating their pronunciation.
 *
 * <p>This is the contract shared by all phonetic encoders. Names which sound alike are expected to
 * produce equal (or, for encoders producing alternatives, overlapping) encodings.
 */
public interface PhoneticEncoder {
  /** Returns the phonetic encoding of a name. The empty name encodes to the empty string. */
  String encode(String name);
}
