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

package org.mustachio.data;

import java.util.Iterator;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A {@link Value} view of parsed JSON text.
 *
 * @author kalman
 *
 */
public class JSONObjectValue extends ValueImpl {

  static class JSONArrayValue extends ValueImpl {
    private final JSONArray array;

    JSONArrayValue(JSONArray array) {
      this.array = array;
    }

    @Override
    public Type getType() {
      return Type.LIST;
    }

    @Override
    public int asListSize() {
      return array.length();
    }

    @Override
    public void asListForeach(ListVisitor visitor) {
      for (int i = 0, length = array.length(); i < length; i++)
        visitor.visit(Values.wrap(array.opt(i)), i);
    }

    @Override
    public Value asListGet(int index) {
      if (index < 0 || index >= array.length())
        return null;
      return Values.wrap(array.opt(index));
    }
  }

  private final JSONObject json;

  public JSONObjectValue(JSONObject json) {
    this.json = json;
  }

  /**
   * Parses |json| as a JSON object.
   */
  public static JSONObjectValue parse(String json) {
    return new JSONObjectValue(new JSONObject(json));
  }

  @Override
  public Type getType() {
    return Type.MAP;
  }

  @Override
  public boolean asMapIsEmpty() {
    return json.isEmpty();
  }

  @Override
  public void asMapForeach(MapVisitor visitor) {
    Iterator<String> keys = json.keys();
    while (keys.hasNext()) {
      String key = keys.next();
      visitor.visit(key, asMapGet(key));
    }
  }

  @Override
  public Value asMapGet(String key) {
    if (!json.has(key))
      return null;
    return Values.wrap(json.opt(key));
  }

}
