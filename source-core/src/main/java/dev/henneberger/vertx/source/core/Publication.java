package dev.henneberger.vertx.source.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public final class Publication {

  private final String name;
  private final boolean allTables;
  private final Set<StreamDescriptor> tables;

  public Publication(String name, boolean allTables, Set<StreamDescriptor> tables) {
    this.name = Objects.requireNonNull(name, "name");
    this.allTables = allTables;
    this.tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
  }

  public String name() {
    return name;
  }

  public boolean allTables() {
    return allTables;
  }

  public Set<StreamDescriptor> tables() {
    return tables;
  }

  public boolean covers(StreamDescriptor table) {
    return allTables || tables.contains(table);
  }
}
