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
 * The pair of markers that open and close a tag.
 */
public final class Delimiters {

  public static final Delimiters DEFAULT = new Delimiters("{{", "}}");

  public final String open;
  public final String close;

  public Delimiters(String open, String close) {
    if (open == null || open.isEmpty() || close == null || close.isEmpty())
      throw new IllegalArgumentException("Delimiters must be non-empty");
    this.open = open;
    this.close = close;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof Delimiters))
      return false;
    Delimiters other = (Delimiters) o;
    return open.equals(other.open) && close.equals(other.close);
  }

  @Override
  public int hashCode() {
    return open.hashCode() * 31 + close.hashCode();
  }

  @Override
  public String toString() {
    return open + " " + close;
  }
}
