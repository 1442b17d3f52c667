package io.paramsetconfig.core.changelog;

import java.util.List;

/**
 * Result of {@link ConfigChangeLog#getEntries}.
 *
 * @param entries matching entries, newest first, truncated to the requested
 *                limit
 * @param total   number of matching entries before truncation
 */
public record ChangeLogPage(List<ChangeLogEntry> entries, int total) {

    public ChangeLogPage {
        entries = List.copyOf(entries);
    }
}
