package com.qualitysentinel.service;

import com.qualitysentinel.core.alerting.RegressionListener;
import com.qualitysentinel.core.model.RegressionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes every alerted regression as one JSON line to the
 * {@value #ALERT_LOGGER} logger, so log shippers can forward alerts without
 * parsing the human-readable detection log.
 *
 * <p>
 * An event that cannot be serialized is logged and skipped.
 * </p>
 */
public class JsonAlertListener implements RegressionListener {

    static final String ALERT_LOGGER = "com.qualitysentinel.alerts";

    private static final Logger LOG = LoggerFactory.getLogger(JsonAlertListener.class);

    private final Logger alerts;
    private final JsonCodec codec;

    public JsonAlertListener(JsonCodec codec) {
        this(codec, LoggerFactory.getLogger(ALERT_LOGGER));
    }

    JsonAlertListener(JsonCodec codec, Logger alerts) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
    }

    @Override
    public void onRegression(RegressionEvent event) {
        String json;
        try {
            json = new String(codec.write(event), StandardCharsets.UTF_8);
        } catch (IllegalStateException e) {
            LOG.error("Failed to serialize regression {}: {}", event.getId(), e.getMessage(), e);
            return;
        }
        alerts.warn(json);
    }
}
