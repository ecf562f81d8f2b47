package com.rudderstack.sdk;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * JSON-like value carried in message properties, traits and context. Values are immutable and
 * compare by their JSON form.
 *
 * <p>Only values with a valid JSON form can be built: {@code null} strings, instants and dates
 * become {@link #NULL_VALUE}, and non-finite numbers are rejected.
 */
public abstract class Value {

  public static final Value NULL_VALUE = new NullValue();

  private Value() {}

  public boolean isNull() {
    return false;
  }

  public boolean isStruct() {
    return false;
  }

  public Struct asStruct() {
    throw new IllegalStateException("Not a struct: " + this);
  }

  public String asString() {
    throw new IllegalStateException("Not a string: " + this);
  }

  public long asInteger() {
    throw new IllegalStateException("Not an integer: " + this);
  }

  public double asDouble() {
    throw new IllegalStateException("Not a number: " + this);
  }

  public boolean asBoolean() {
    throw new IllegalStateException("Not a boolean: " + this);
  }

  public List<Value> asList() {
    throw new IllegalStateException("Not a list: " + this);
  }

  public static Value of(long value) {
    return new IntegerValue(value);
  }

  /**
   * @throws IllegalArgumentException if {@code value} is NaN or infinite, which JSON cannot carry
   */
  public static Value of(double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("Non-finite number has no JSON form: " + value);
    }
    return new NumberValue(value);
  }

  public static Value of(@Nullable Instant value) {
    return value == null ? NULL_VALUE : new TextValue(value.toString());
  }

  public static Value of(@Nullable LocalDate date) {
    return date == null ? NULL_VALUE : new TextValue(date.toString());
  }

  public static Value of(@Nullable String value) {
    return value == null ? NULL_VALUE : new TextValue(value);
  }

  public static Value of(boolean value) {
    return new BooleanValue(value);
  }

  public static Value of(List<Value> values) {
    return new ListValue(values);
  }

  public static Struct of(Map<String, Value> values) {
    return new Struct(values);
  }

  /**
   * Converts a plain Java object into a value. Maps become structs (keys through {@link
   * String#valueOf}), collections become lists, and {@code null} becomes {@link #NULL_VALUE}.
   *
   * @throws IllegalArgumentException for objects with no JSON counterpart, including non-finite
   *     numbers
   */
  public static Value fromObject(@Nullable Object object) {
    if (object == null) {
      return NULL_VALUE;
    }
    if (object instanceof Value) {
      return (Value) object;
    }
    if (object instanceof String) {
      return of((String) object);
    }
    if (object instanceof Boolean) {
      return of((Boolean) object);
    }
    if (object instanceof Integer
        || object instanceof Long
        || object instanceof Short
        || object instanceof Byte) {
      return of(((Number) object).longValue());
    }
    if (object instanceof Number) {
      return of(((Number) object).doubleValue());
    }
    if (object instanceof Instant) {
      return of((Instant) object);
    }
    if (object instanceof LocalDate) {
      return of((LocalDate) object);
    }
    if (object instanceof Map) {
      return Struct.fromMap((Map<?, ?>) object);
    }
    if (object instanceof Collection) {
      return new ListValue(
          ((Collection<?>) object).stream().map(Value::fromObject).collect(Collectors.toList()));
    }
    throw new IllegalArgumentException("Illegal value type: " + object.getClass());
  }

  public abstract JsonElement toJson();

  private static final class NullValue extends Value {

    @Override
    public boolean isNull() {
      return true;
    }

    @Override
    public JsonElement toJson() {
      return JsonNull.INSTANCE;
    }

    @Override
    public String toString() {
      return "null";
    }
  }

  // strings, and instants and dates in their ISO-8601 form
  private static final class TextValue extends Value {
    private final String value;

    private TextValue(String value) {
      this.value = value;
    }

    @Override
    public String asString() {
      return value;
    }

    @Override
    public JsonElement toJson() {
      return new JsonPrimitive(value);
    }

    @Override
    public String toString() {
      return value;
    }
  }

  private static final class BooleanValue extends Value {
    private final boolean value;

    private BooleanValue(boolean value) {
      this.value = value;
    }

    @Override
    public boolean asBoolean() {
      return value;
    }

    @Override
    public JsonElement toJson() {
      return new JsonPrimitive(value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  private static final class IntegerValue extends Value {
    private final long value;

    private IntegerValue(long value) {
      this.value = value;
    }

    @Override
    public long asInteger() {
      return value;
    }

    @Override
    public double asDouble() {
      return value;
    }

    @Override
    public JsonElement toJson() {
      return new JsonPrimitive(value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  private static final class NumberValue extends Value {
    private final double value;

    private NumberValue(double value) {
      this.value = value;
    }

    @Override
    public double asDouble() {
      return value;
    }

    @Override
    public JsonElement toJson() {
      return new JsonPrimitive(value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  private static final class ListValue extends Value {
    private final ImmutableList<Value> values;

    private ListValue(List<Value> values) {
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public List<Value> asList() {
      return values;
    }

    @Override
    public JsonElement toJson() {
      final JsonArray array = new JsonArray(values.size());
      values.forEach(value -> array.add(value.toJson()));
      return array;
    }

    @Override
    public String toString() {
      return values.toString();
    }
  }

  /** String-keyed map of values; the form of properties, traits and context. */
  public static final class Struct extends Value {
    public static final Struct EMPTY = new Struct(ImmutableMap.of());
    private final ImmutableMap<String, Value> values;

    private Struct(Map<String, Value> values) {
      this.values = ImmutableMap.copyOf(values);
    }

    @Override
    public boolean isStruct() {
      return true;
    }

    @Override
    public Struct asStruct() {
      return this;
    }

    public boolean isEmpty() {
      return values.isEmpty();
    }

    /** Looks up a nested value; missing keys and non-struct steps yield {@link #NULL_VALUE}. */
    public Value get(String... path) {
      Value value = this;
      for (String key : path) {
        if (!value.isStruct()) {
          return NULL_VALUE;
        }
        value = ((Struct) value).values.getOrDefault(key, NULL_VALUE);
      }
      return value;
    }

    public Map<String, Value> asMap() {
      return values;
    }

    public static Builder builder() {
      return new Builder();
    }

    @Override
    public JsonObject toJson() {
      final JsonObject object = new JsonObject();
      values.forEach((key, value) -> object.add(key, value.toJson()));
      return object;
    }

    @Override
    public String toString() {
      return values.toString();
    }

    static Struct fromMap(Map<?, ?> map) {
      final ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
      map.forEach((key, value) -> builder.put(String.valueOf(key), fromObject(value)));
      return new Struct(builder.buildKeepingLast());
    }

    /** Entries set to a null value are left out. */
    public static final class Builder {

      private final ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();

      private Builder() {}

      public Builder set(String key, Value value) {
        if (!value.isNull()) builder.put(key, value);
        return this;
      }

      public Builder set(String key, long value) {
        return set(key, Value.of(value));
      }

      public Builder set(String key, double value) {
        return set(key, Value.of(value));
      }

      public Builder set(String key, @Nullable Instant value) {
        return set(key, Value.of(value));
      }

      public Builder set(String key, @Nullable LocalDate value) {
        return set(key, Value.of(value));
      }

      public Builder set(String key, @Nullable String value) {
        return set(key, Value.of(value));
      }

      public Builder set(String key, boolean value) {
        return set(key, Value.of(value));
      }

      public Builder set(String key, Builder value) {
        return set(key, value.build());
      }

      public Struct build() {
        return new Struct(builder.buildKeepingLast());
      }
    }
  }

  @Override
  public int hashCode() {
    return toJson().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == null) {
      return false;
    }
    if (obj.getClass() != this.getClass()) {
      return false;
    }
    return toJson().equals(((Value) obj).toJson());
  }
}
