package com.tenacy.labpulse.store;

import com.tenacy.labpulse.domain.AnomalyAlert;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 감지된 알림을 게이트웨이 웹훅으로 전송한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertWebhookClient {

    private final RestTemplate alertRestTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${labpulse.alert.webhook.enabled:false}")
    private boolean webhookEnabled;

    @Value("${labpulse.alert.webhook.url:}")
    private String webhookUrl;

    public boolean isEnabled() {
        return webhookEnabled && StringUtils.hasText(webhookUrl);
    }

    @Async("alertForwardingExecutor")
    public void forward(AnomalyAlert alert) {
        if (!isEnabled()) {
            return;
        }

        String endpoint = webhookUrl.replaceAll("/+$", "") + "/api/alerts";
        try {
            alertRestTemplate.postForEntity(endpoint, alert, Void.class);
            log.debug("Alert {} forwarded to {}", alert.getId(), endpoint);
        } catch (RestClientException e) {
            log.error("Failed to forward alert {} to {}: {}", alert.getId(), endpoint, e.getMessage(), e);
            meterRegistry.counter("labpulse.alert.forward.errors").increment();
        }
    }
}
