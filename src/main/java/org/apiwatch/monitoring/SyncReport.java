package org.apiwatch.monitoring;

public record SyncReport(int adopted, int dropped, int retired) {
}
