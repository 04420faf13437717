package com.nectarstudio.realtime.polling;

import com.nectarstudio.realtime.model.domain.ChangeEvent;

import java.util.List;

/**
 * Receives what the scheduler produces for a job. Calls for one job never overlap and
 * arrive in production order.
 */
public interface ChangeBatchListener {

    /**
     * A poll found changes. Returning normally counts as delivered and lets the cursor advance;
     * throwing keeps the cursor where it was.
     */
    void onChangeBatch(PollingJobKey jobKey, List<ChangeEvent> events);

    /**
     * A poll found nothing past the cursor. Deletes and edits that leave the watermark alone
     * only show up in the job's view, so the listener compares it with the last one pushed.
     *
     * @return true when the view had changed and a refresh was pushed
     */
    boolean onQuietPoll(PollingJobKey jobKey);

    /**
     * A poll failed and will be retried on the next scheduled tick.
     */
    void onPollingError(PollingJobKey jobKey, String error);
}
