package com.gentoro.contextmcp.audit;

import java.util.List;

public record AuditPage(List<AuditEntry> logs, long total, int limit, int offset) {}
