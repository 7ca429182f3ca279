// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.mustachio.template;

import java.util.HashMap;
import java.util.Map;

/**
 * A {@link PartialResolver} backed by a map of name to template source.
 */
public class MapPartialResolver implements PartialResolver {

  private final Map<String, String> partials;

  public MapPartialResolver() {
    this(new HashMap<String, String>());
  }

  public MapPartialResolver(Map<String, String> partials) {
    this.partials = partials;
  }

  public MapPartialResolver put(String name, String template) {
    partials.put(name, template);
    return this;
  }

  @Override
  public String load(String name) {
    return partials.get(name);
  }
}
