package com.ofacwatch.screening.dto;

import com.ofacwatch.screening.scheduler.SourceStatus;
import com.ofacwatch.screening.sync.SnapshotStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Snapshot, sources and alert counters for the monitor page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorStatusResponse {

    private SnapshotStatus snapshot;
    private List<SourceStatus> sources;
    private boolean schedulerRunning;
    private long alertsPublished;
    private long alertsRecorded;
    private int feedCapacity;
    private Duration defaultFetchInterval;
    private Duration snapshotRefreshInterval;
}
