package dev.aahmedlab.taskengine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable positional and keyword arguments passed to a {@link TaskFunction}.
 *
 * <p>Positional values may be {@code null}. Keyword names may not. Instances are snapshots: later
 * changes to the arrays or maps used to build them are not visible.
 *
 * @since 1.0.0
 */
public final class TaskArguments {
  private static final TaskArguments EMPTY =
      new TaskArguments(Collections.emptyList(), Collections.emptyMap());

  private final List<Object> positional;
  private final Map<String, Object> keywords;

  private TaskArguments(List<Object> positional, Map<String, Object> keywords) {
    this.positional = positional;
    this.keywords = keywords;
  }

  /**
   * Returns an instance with no arguments.
   *
   * @return the empty arguments
   * @since 1.0.0
   */
  public static TaskArguments empty() {
    return EMPTY;
  }

  /**
   * Creates arguments from positional values.
   *
   * @param values the positional values, in call order
   * @return the arguments
   * @since 1.0.0
   */
  public static TaskArguments of(Object... values) {
    if (values == null || values.length == 0) {
      return EMPTY;
    }
    return new TaskArguments(
        Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))),
        Collections.emptyMap());
  }

  /**
   * Creates arguments from positional and keyword values.
   *
   * @param positional the positional values, in call order
   * @param keywords the keyword values
   * @return the arguments
   * @throws NullPointerException if either collection or a keyword name is null
   * @since 1.0.0
   */
  public static TaskArguments of(List<?> positional, Map<String, ?> keywords) {
    Objects.requireNonNull(positional, "positional");
    Objects.requireNonNull(keywords, "keywords");
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : keywords.entrySet()) {
      copy.put(Objects.requireNonNull(entry.getKey(), "keyword name"), entry.getValue());
    }
    return new TaskArguments(
        Collections.unmodifiableList(new ArrayList<>(positional)),
        Collections.unmodifiableMap(copy));
  }

  /**
   * Returns a copy of these arguments with one more keyword value.
   *
   * @param name the keyword name
   * @param value the value, may be null
   * @return new arguments
   * @since 1.0.0
   */
  public TaskArguments withKeyword(String name, Object value) {
    Objects.requireNonNull(name, "name");
    Map<String, Object> copy = new LinkedHashMap<>(keywords);
    copy.put(name, value);
    return new TaskArguments(positional, Collections.unmodifiableMap(copy));
  }

  public int size() {
    return positional.size();
  }

  public Object get(int index) {
    return positional.get(index);
  }

  /**
   * Returns the positional value at {@code index} cast to {@code type}.
   *
   * @throws IndexOutOfBoundsException if there is no such position
   * @throws ClassCastException if the value is not a {@code type}
   */
  public <T> T get(int index, Class<T> type) {
    return type.cast(positional.get(index));
  }

  public boolean hasKeyword(String name) {
    return keywords.containsKey(name);
  }

  public Object keyword(String name) {
    return keywords.get(name);
  }

  /**
   * Returns the keyword value cast to {@code type}, or {@code null} when it is absent.
   *
   * @throws ClassCastException if the value is not a {@code type}
   */
  public <T> T keyword(String name, Class<T> type) {
    return type.cast(keywords.get(name));
  }

  public List<Object> positional() {
    return positional;
  }

  public Map<String, Object> keywords() {
    return keywords;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TaskArguments)) return false;
    TaskArguments that = (TaskArguments) o;
    return positional.equals(that.positional) && keywords.equals(that.keywords);
  }

  @Override
  public int hashCode() {
    return Objects.hash(positional, keywords);
  }

  @Override
  public String toString() {
    return "TaskArguments{positional=" + positional + ", keywords=" + keywords + "}";
  }
}
