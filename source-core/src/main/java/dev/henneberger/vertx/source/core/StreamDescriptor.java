package dev.henneberger.vertx.source.core;

import java.util.Objects;

/**
 * Identity of a replicated table: an optional namespace (schema) and a name.
 */
public final class StreamDescriptor implements Comparable<StreamDescriptor> {

  private final String namespace;
  private final String name;

  public StreamDescriptor(String namespace, String name) {
    OptionValidation.require("name", name);
    this.namespace = namespace == null || namespace.isBlank() ? null : namespace;
    this.name = name;
  }

  public static StreamDescriptor of(String namespace, String name) {
    return new StreamDescriptor(namespace, name);
  }

  /**
   * Parses {@code namespace.name}. A value without a dot has no namespace.
   */
  public static StreamDescriptor parse(String qualifiedName) {
    OptionValidation.require("qualifiedName", qualifiedName);
    int dot = qualifiedName.indexOf('.');
    if (dot < 0) {
      return new StreamDescriptor(null, qualifiedName);
    }
    return new StreamDescriptor(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1));
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  public String qualifiedName() {
    return namespace == null ? name : namespace + '.' + name;
  }

  @Override
  public int compareTo(StreamDescriptor other) {
    return qualifiedName().compareTo(other.qualifiedName());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StreamDescriptor)) {
      return false;
    }
    StreamDescriptor that = (StreamDescriptor) o;
    return Objects.equals(namespace, that.namespace) && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name);
  }

  @Override
  public String toString() {
    return qualifiedName();
  }
}
