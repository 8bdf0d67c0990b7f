package dev.henneberger.vertx.subscription.core;

import java.util.stream.Collectors;

public final class PreflightReports {

  private PreflightReports() {
  }

  public static String describeFailure(PreflightReport report) {
    if (report == null || report.ok()) {
      return "Preflight passed";
    }
    return "Preflight failed: " + report.errors().stream()
      .map(PreflightReports::formatIssue)
      .collect(Collectors.joining("; "));
  }

  public static String describe(PreflightReport report) {
    if (report == null || report.issues().isEmpty()) {
      return "no issues";
    }
    return report.issues().stream()
      .map(issue -> issue.severity() + " " + formatIssue(issue))
      .collect(Collectors.joining("; "));
  }

  private static String formatIssue(PreflightIssue issue) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(issue.code()).append("] ").append(issue.message());
    if (issue.remediation() != null && !issue.remediation().isBlank()) {
      sb.append(" Remediation: ").append(issue.remediation());
    }
    return sb.toString();
  }
}
