package io.rollcron.core;

import java.net.URI;
import java.util.Objects;

public record WebhookConfig(URI url) {
    public WebhookConfig {
        Objects.requireNonNull(url, "webhook url must not be null");
    }
}
