package com.acme.render.monitor;

import com.acme.render.config.TimeoutConfig;
import com.acme.render.core.Jsons;
import com.acme.render.spi.JobStore.RunRow;
import jakarta.inject.Singleton;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tells preview jobs from final ones by the {@code duration} marker of the request.
 * Only the configured final marker (24) makes a job final; any other or missing duration
 * gets the preview deadline.
 */
@Singleton
public class RunClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(RunClassifier.class);

    private final TimeoutConfig config;

    public RunClassifier(TimeoutConfig config) {
        this.config = config;
    }

    public boolean isFinal(String requestJson) {
        Integer duration = durationOf(requestJson);
        return duration != null && duration == config.getFinalDurationMarker();
    }

    public Duration thresholdFor(RunRow run) {
        return thresholdFor(run.requestJson());
    }

    public Duration thresholdFor(String requestJson) {
        return isFinal(requestJson) ? config.getFinalTimeout() : config.getPreviewTimeout();
    }

    Integer durationOf(String requestJson) {
        Object raw;
        try {
            raw = Jsons.toMap(requestJson).get("duration");
        } catch (RuntimeException e) {
            LOG.warn("Unreadable run request payload, treating as preview: {}", e.getMessage());
            return null;
        }
        if (raw instanceof Number n) {
            return n.intValue();
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Integer.valueOf(s.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Non-numeric duration marker '{}', treating as preview", s);
            }
        }
        return null;
    }
}
