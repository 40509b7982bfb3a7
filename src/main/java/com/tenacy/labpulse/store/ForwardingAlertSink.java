package com.tenacy.labpulse.store;

import com.tenacy.labpulse.domain.AnomalyAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 최근 알림을 메모리에 보관하고 웹훅 전송을 위임한다.
 */
@Component
@Slf4j
public class ForwardingAlertSink implements AlertSink {

    private final AlertWebhookClient webhookClient;
    private final int maxStoredAlerts;

    private final Deque<AnomalyAlert> alerts = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger(0);

    public ForwardingAlertSink(AlertWebhookClient webhookClient,
                               @Value("${labpulse.alert.max-stored:1000}") int maxStoredAlerts) {
        this.webhookClient = webhookClient;
        this.maxStoredAlerts = maxStoredAlerts;
    }

    @Override
    public void accept(AnomalyAlert alert) {
        alerts.addFirst(alert);
        if (size.incrementAndGet() > maxStoredAlerts && alerts.pollLast() != null) {
            size.decrementAndGet();
        }

        log.info("Anomaly alert stored: [{}] {} - {}", alert.getSeverity(), alert.getInstrumentId(), alert.getDescription());

        try {
            webhookClient.forward(alert);
        } catch (Exception e) {
            log.error("Failed to dispatch alert {} for forwarding: {}", alert.getId(), e.getMessage(), e);
        }
    }

    @Override
    public List<AnomalyAlert> recentAlerts(int limit) {
        List<AnomalyAlert> result = new ArrayList<>();
        Iterator<AnomalyAlert> iterator = alerts.iterator();
        while (iterator.hasNext() && result.size() < limit) {
            result.add(iterator.next());
        }
        return result;
    }
}
