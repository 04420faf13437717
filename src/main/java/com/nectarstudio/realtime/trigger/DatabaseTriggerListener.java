package com.nectarstudio.realtime.trigger;

import com.nectarstudio.realtime.model.dto.TriggerNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.annotation.RetryableTopic;
import org.springframework.retry.annotation.Backoff;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class DatabaseTriggerListener {
    private final TriggerEventProcessor processor;

    @RetryableTopic(attempts = "3", backoff = @Backoff(delay = 1000, multiplier = 2))
    @KafkaListener(topics = "${app.kafka.topics.table-triggers}", groupId = "${spring.kafka.consumer.group-id}")
    public void consumeTableTrigger(TriggerNotification notification) {
        log.info("Received trigger notification: {} on {}/{}", notification.getOperation(),
                notification.getServiceName(), notification.getEntityName());
        try {
            processor.process(notification);
        } catch (Exception e) {
            log.error("Fatal error processing trigger for {}/{}: ", notification.getServiceName(),
                    notification.getEntityName(), e);
            throw e; // Let Spring Kafka handle retry/DLT
        }
    }
}
