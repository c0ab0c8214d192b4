package fsmgen.ir;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Sparse mapping from {@link Attr} keys to 64-bit values, plus an optional source position used in diagnostics.
 */
public class Attributes {
  private final EnumMap<Attr, Long> values = new EnumMap<>(Attr.class);
  private Optional<String> pos = Optional.empty();

  public Attributes() {}

  public Attributes(Attributes other) {
    values.putAll(other.values);
    pos = other.pos;
  }

  public OptionalLong get(Attr key) {
    Long val = values.get(key);
    return val == null ? OptionalLong.empty() : OptionalLong.of(val);
  }

  /**
   * Gets an attribute that is required to be present.
   * @throws IllegalStateException if the attribute is missing
   */
  public long getRequired(Attr key) {
    Long val = values.get(key);
    if (val == null)
      throw new IllegalStateException("Internal error: missing attribute @" + key.getSerialName());
    return val;
  }

  public boolean has(Attr key) { return values.containsKey(key); }

  public Attributes insert(Attr key, long value) {
    values.put(key, value);
    return this;
  }

  public void remove(Attr key) { values.remove(key); }

  public boolean isEmpty() { return values.isEmpty(); }

  public Map<Attr, Long> asMap() { return Collections.unmodifiableMap(values); }

  public Optional<String> getPos() { return pos; }
  public void setPos(String pos) { this.pos = Optional.ofNullable(pos); }

  /** Renders the attributes in the {@code @name(value)} form used by {@link Printer}. */
  @Override
  public String toString() {
    return values.entrySet()
        .stream()
        .map(entry -> "@" + entry.getKey().getSerialName() + "(" + entry.getValue() + ")")
        .collect(Collectors.joining(" "));
  }

  @Override
  public int hashCode() {
    return Objects.hash(values);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Attributes other = (Attributes)obj;
    return Objects.equals(values, other.values);
  }
}
