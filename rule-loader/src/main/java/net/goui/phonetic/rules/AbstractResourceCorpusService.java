/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import java.io.IOException;
import net.goui.phonetic.NameType;
import net.goui.phonetic.RuleCorpus;
import net.goui.phonetic.corpus.RuleCorpusService;

/**
 * Helper class to support easy loading of rule corpora from class resources. A subclass need only
 * implement the constructor to provide the name type and a resource root.
 *
 * <pre>{@code
 * public MyGenericRules() {
 *   super(NameType.GENERIC, "/com/example/rules/");
 * }
 * }</pre>
 */
public abstract class AbstractResourceCorpusService extends RuleCorpusService {
  private final String resourceRoot;

  /**
   * Constructs a {@link RuleCorpusService} for rule files held as class resources.
   *
   * @param nameType the name type of the corpus to be loaded.
   * @param resourceRoot the path of the directory holding the rule resources (with respect to
   *     this class), ending in {@code '/'}.
   */
  protected AbstractResourceCorpusService(NameType nameType, String resourceRoot) {
    super(nameType);
    this.resourceRoot = resourceRoot;
  }

  @Override
  protected final RuleCorpus load() throws IOException {
    return CorpusReader.of(RuleSource.fromResources(getClass(), resourceRoot)).read(getNameType());
  }
}
