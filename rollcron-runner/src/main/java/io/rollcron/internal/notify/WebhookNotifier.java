package io.rollcron.internal.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rollcron.JobEventListener;
import io.rollcron.core.Job;
import io.rollcron.core.JobEvent;
import io.rollcron.core.RunnerConfig;
import io.rollcron.core.WebhookConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Posts failure notifications to the runner-wide and per-job webhooks.
 * Only {@code FAILED} and {@code RETRIES_EXHAUSTED} are delivered. Delivery is asynchronous and
 * delivery errors are logged only.
 */
public class WebhookNotifier implements JobEventListener {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookNotifier() {
        this(HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), new ObjectMapper());
    }

    public WebhookNotifier(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void onEvent(JobEvent event, Job job, RunnerConfig runnerConfig) {
        deliver(event, job, runnerConfig);
    }

    /**
     * @return one future per delivery; empty when the event is not notifiable or no webhook is configured
     */
    public List<CompletableFuture<Void>> deliver(JobEvent event, Job job, RunnerConfig runnerConfig) {
        if (event.type() != JobEvent.Type.FAILED && event.type() != JobEvent.Type.RETRIES_EXHAUSTED) {
            return List.of();
        }

        Set<URI> targets = new LinkedHashSet<>();
        if (runnerConfig != null) {
            runnerConfig.webhooks().stream().map(WebhookConfig::url).forEach(targets::add);
        }
        job.webhooks().stream().map(WebhookConfig::url).forEach(targets::add);
        if (targets.isEmpty()) {
            return List.of();
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(payload(event));
        } catch (JsonProcessingException e) {
            log.error("[job:{}] Failed to encode webhook payload msg={}", event.jobId(), e.getMessage(), e);
            return List.of();
        }

        List<CompletableFuture<Void>> deliveries = new ArrayList<>();
        for (URI url : targets) {
            deliveries.add(send(url, body, event));
        }
        return deliveries;
    }

    static Map<String, Object> payload(JobEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", summary(event));
        payload.put("event", event.type().name().toLowerCase(Locale.ROOT));
        payload.put("job_id", event.jobId());
        payload.put("job_name", event.jobName());
        payload.put("attempt", event.attempt());
        payload.put("message", event.message());
        payload.put("at", event.at().toString());
        return payload;
    }

    static String summary(JobEvent event) {
        String label = event.jobName().equals(event.jobId())
                ? event.jobId()
                : event.jobName() + " (" + event.jobId() + ")";
        String detail = event.message() == null ? "" : ": " + event.message();
        if (event.type() == JobEvent.Type.RETRIES_EXHAUSTED) {
            return "[rollcron] " + label + " gave up after " + event.attempt() + " attempts" + detail;
        }
        return "[rollcron] " + label + " failed (attempt " + event.attempt() + ")" + detail;
    }

    private CompletableFuture<Void> send(URI url, String body, JobEvent event) {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        log.warn("[job:{}] Webhook delivery failed url={} msg={}", event.jobId(), url, error.getMessage());
                    } else if (response.statusCode() >= 300) {
                        log.warn("[job:{}] Webhook rejected url={} status={}", event.jobId(), url, response.statusCode());
                    } else {
                        log.debug("[job:{}] Webhook delivered url={} event={}", event.jobId(), url, event.type());
                    }
                    return null;
                });
    }
}
