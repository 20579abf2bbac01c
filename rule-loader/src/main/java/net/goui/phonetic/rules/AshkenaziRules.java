/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.phonetic.rules;

import com.google.auto.service.AutoService;
import net.goui.phonetic.NameType;
import net.goui.phonetic.corpus.RuleCorpusService;

/** The bundled rule corpus for Ashkenazi Jewish names. */
@AutoService(RuleCorpusService.class)
public final class AshkenaziRules extends AbstractResourceCorpusService {
  public AshkenaziRules() {
    super(NameType.ASHKENAZI, RuleSource.BUNDLED_RESOURCE_ROOT);
  }
}
