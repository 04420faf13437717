package com.nectarstudio.realtime.detection;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.model.domain.JobCursor;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.polling.PollingJobKey;
import com.nectarstudio.realtime.repository.JobCursorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Owns the watermark of every job: the starting point when a job is created and the
 * monotonic advance after a batch has been delivered. Cursors are persisted so a restart
 * neither replays nor skips changes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CursorTracker {

    private final JobCursorRepository jobCursorRepository;
    private final RealtimeProperties properties;
    private final Clock clock;

    /**
     * Last delivered watermark for {@code key}, or {@code now - initialLookback} for a job never seen before.
     */
    @Transactional(readOnly = true)
    public Instant initialCursor(PollingJobKey key) {
        return jobCursorRepository.findById(key.canonical())
                .map(JobCursor::getCursorValue)
                .orElseGet(() -> clock.instant().minus(properties.getInitialLookback()));
    }

    /**
     * Moves the job's cursor to {@code candidate} unless that would move it backwards.
     *
     * @return the cursor after the call
     */
    @Transactional
    public Instant advance(PollingJob job, Instant candidate) {
        Instant current = job.getCursor();
        if (candidate == null || (current != null && !candidate.isAfter(current))) {
            return current;
        }
        TableDescriptor table = job.getTable();
        PollingJobKey key = job.getKey();
        JobCursor cursor = jobCursorRepository.findById(key.canonical())
                .orElseGet(() -> new JobCursor(key.canonical(), key.serviceName(), key.entityName(), table.watermarkColumn()));
        cursor.setCursorValue(candidate);
        cursor.setUpdatedAt(clock.instant());
        jobCursorRepository.save(cursor);
        job.setCursor(candidate);
        log.debug("Cursor for {} advanced {} -> {}", key, current, candidate);
        return candidate;
    }
}
