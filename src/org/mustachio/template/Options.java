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

/**
 * Settings a {@link Mustache} is compiled with.
 */
public final class Options {

  public static final int DEFAULT_MAX_DEPTH = 100;

  public static final Options DEFAULT = new Options(Delimiters.DEFAULT, DEFAULT_MAX_DEPTH);

  /** Delimiters the template, and any partials it includes, start out with. */
  public final Delimiters delimiters;

  /** How deeply partials and lambda output may nest before rendering gives up. */
  public final int maxDepth;

  private Options(Delimiters delimiters, int maxDepth) {
    if (delimiters == null)
      throw new IllegalArgumentException("delimiters");
    if (maxDepth < 1)
      throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
    this.delimiters = delimiters;
    this.maxDepth = maxDepth;
  }

  public Options withDelimiters(Delimiters delimiters) {
    return new Options(delimiters, maxDepth);
  }

  public Options withMaxDepth(int maxDepth) {
    return new Options(delimiters, maxDepth);
  }

  @Override
  public String toString() {
    return "Options{ delimiters: " + delimiters + ", maxDepth: " + maxDepth + " }";
  }
}
