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
 * Thrown if a template can't be split into tags: an unclosed tag, an unclosed {{{triple}}}, or a
 * malformed set-delimiters tag.
 */
public class LexException extends TemplateException {
  private static final long serialVersionUID = 1L;

  public final int line;

  public LexException(String error, String template, int offset) {
    this(error, TemplateException.lineOf(template, offset));
  }

  private LexException(String error, int line) {
    super(error + " (line " + line + ")");
    this.line = line;
  }
}
