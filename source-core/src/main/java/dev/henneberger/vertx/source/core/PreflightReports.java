package dev.henneberger.vertx.source.core;

import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReports {

  private PreflightReports() {
  }

  public static String describeFailure(PreflightReport report) {
    Objects.requireNonNull(report, "report");
    if (report.isOk()) {
      return "Preflight passed";
    }
    return "Preflight failed: " + report.issues().stream()
      .filter(issue -> issue.severity() == PreflightIssue.Severity.ERROR)
      .map(PreflightReports::formatIssue)
      .collect(Collectors.joining("; "));
  }

  public static String describeWarnings(PreflightReport report) {
    Objects.requireNonNull(report, "report");
    return report.issues().stream()
      .filter(issue -> issue.severity() == PreflightIssue.Severity.WARNING)
      .map(PreflightReports::formatIssue)
      .collect(Collectors.joining("; "));
  }

  static String formatIssue(PreflightIssue issue) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(issue.code()).append("] ").append(issue.message());
    if (issue.remediation() != null && !issue.remediation().isBlank()) {
      sb.append(" Remediation: ").append(issue.remediation());
    }
    return sb.toString();
  }
}
