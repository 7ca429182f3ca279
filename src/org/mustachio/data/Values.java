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

import java.math.BigDecimal;
import java.math.BigInteger;

import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONStringer;
import org.mustachio.data.JSONObjectValue.JSONArrayValue;
import org.mustachio.data.Value.ListVisitor;
import org.mustachio.data.Value.MapVisitor;

/**
 * Entry point for turning host objects into {@link Value}s, and for the generic value-to-text
 * conversion.
 */
public final class Values {

  public static final Value NULL = new PojoValue(null);

  private Values() {}

  /**
   * Adapts |object| into a {@link Value}. {@link Value}s are returned as-is, org.json trees are
   * viewed through {@link JSONObjectValue}, and everything else through {@link PojoValue}.
   */
  public static Value wrap(Object object) {
    if (object == null || object == JSONObject.NULL)
      return NULL;
    if (object instanceof Value)
      return (Value) object;
    if (object instanceof JSONObject)
      return new JSONObjectValue((JSONObject) object);
    if (object instanceof JSONArray)
      return new JSONArrayValue((JSONArray) object);
    return new PojoValue(object);
  }

  /**
   * Whether |value| is absent, null, false, the empty string or the empty list. Empty maps are
   * not falsey.
   */
  public static boolean isFalsey(Value value) {
    if (value == null)
      return true;
    switch (value.getType()) {
      case NULL:
        return true;
      case BOOLEAN:
        return !value.asBoolean();
      case STRING:
        return value.asString().isEmpty();
      case LIST:
        return value.asListSize() == 0;
      default:
        return false;
    }
  }

  /**
   * Converts |value| to the text it interpolates as. Lists and maps become JSON, lambdas and
   * nulls become the empty string.
   */
  public static String toText(Value value) {
    switch (value.getType()) {
      case NULL:
      case LAMBDA:
        return "";
      case BOOLEAN:
        return String.valueOf(value.asBoolean());
      case NUMBER:
        return toText(value.asNumber());
      case STRING:
        return value.asString();
      case LIST:
      case MAP:
        return toJson(value);
    }
    throw new AssertionError(value.getType());
  }

  /**
   * Canonical text of a number: integers as-is, decimals without trailing zeros or exponents.
   */
  public static String toText(Number number) {
    if (number instanceof Integer ||
        number instanceof Long ||
        number instanceof Short ||
        number instanceof Byte ||
        number instanceof BigInteger) {
      return number.toString();
    }
    if (number instanceof BigDecimal)
      return plain((BigDecimal) number);
    if (number instanceof Float) {
      float f = number.floatValue();
      if (Float.isNaN(f) || Float.isInfinite(f))
        return Float.toString(f);
      return plain(new BigDecimal(Float.toString(f)));
    }
    if (number instanceof Double) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d))
        return Double.toString(d);
      return plain(BigDecimal.valueOf(d));
    }
    return number.toString();
  }

  // JSON has no NaN or infinities.
  private static boolean isFinite(Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      return !Double.isNaN(d) && !Double.isInfinite(d);
    }
    return true;
  }

  private static String plain(BigDecimal decimal) {
    if (decimal.signum() == 0)
      return "0";
    return decimal.stripTrailingZeros().toPlainString();
  }

  /**
   * Serializes |value|, which must be a list or map, as JSON text.
   */
  public static String toJson(Value value) {
    if (value.getType() != Value.Type.LIST && value.getType() != Value.Type.MAP)
      throw new IllegalArgumentException("Only lists and maps are JSON text, not " + value.getType());
    JSONStringer out = new JSONStringer();
    writeJson(value, out);
    return out.toString();
  }

  private static void writeJson(Value value, final JSONStringer out) {
    switch (value.getType()) {
      case NULL:
      case LAMBDA:
        out.value(null);
        break;

      case BOOLEAN:
        out.value(value.asBoolean());
        break;

      case NUMBER:
        Number number = value.asNumber();
        if (isFinite(number))
          out.value(number);
        else
          out.value(toText(number));
        break;

      case STRING:
        out.value(value.asString());
        break;

      case LIST:
        out.array();
        value.asListForeach(new ListVisitor() {
          @Override
          public void visit(Value item, int index) {
            writeJson(item, out);
          }
        });
        out.endArray();
        break;

      case MAP:
        out.object();
        value.asMapForeach(new MapVisitor() {
          @Override
          public void visit(String key, Value item) {
            out.key(key);
            writeJson(item, out);
          }
        });
        out.endObject();
        break;
    }
  }
}
