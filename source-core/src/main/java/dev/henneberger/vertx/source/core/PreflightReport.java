package dev.henneberger.vertx.source.core;

import java.util.List;

public final class PreflightReport {

  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    this.issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public static PreflightReport ok() {
    return new PreflightReport(List.of());
  }

  public boolean isOk() {
    for (PreflightIssue issue : issues) {
      if (issue.severity() == PreflightIssue.Severity.ERROR) {
        return false;
      }
    }
    return true;
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  /**
   * Raises a {@link ConfigException} carrying this report when it has an error-level issue.
   */
  public PreflightReport throwIfFailed() {
    if (!isOk()) {
      throw new ConfigException(this);
    }
    return this;
  }
}
