package com.videopipe.orchestrator.service.progress;

import com.videopipe.orchestrator.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 진행 이벤트 발행/구독 (비영속, 푸시 전용).
 * publish 는 구독자 큐에 넣기만 하고 반환하므로 스케줄러를 막지 않는다.
 */
@Slf4j
@Component
public class ProgressBroadcaster {

    private final int queueCapacity;
    private final AtomicLong sequence = new AtomicLong();
    private final Set<ProgressSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    public ProgressBroadcaster(PipelineProperties properties) {
        this.queueCapacity = properties.getProgress().getSubscriberQueueSize();
    }

    public ProgressEvent publish(ProgressEvent event) {
        ProgressEvent stamped = event.toBuilder()
                .sequence(sequence.incrementAndGet())
                .occurredAt(event.getOccurredAt() != null ? event.getOccurredAt() : LocalDateTime.now())
                .build();

        for (ProgressSubscription subscription : subscriptions) {
            if (subscription.accepts(stamped.getPipelineJobId()) && !subscription.offer(stamped)) {
                log.debug("[Progress] Subscriber {} queue full, event #{} dropped",
                        subscription.getSubscriptionId(), stamped.getSequence());
            }
        }
        return stamped;
    }

    /**
     * 특정 작업 구독
     */
    public ProgressSubscription subscribe(String jobId) {
        ProgressSubscription subscription = new ProgressSubscription(jobId, queueCapacity);
        subscriptions.add(subscription);
        log.debug("[Progress] Subscribed {} to job {}", subscription.getSubscriptionId(), jobId);
        return subscription;
    }

    /**
     * 전체 작업 구독 (모니터링용)
     */
    public ProgressSubscription subscribeAll() {
        return subscribe(null);
    }

    public void unsubscribe(ProgressSubscription subscription) {
        if (subscriptions.remove(subscription)) {
            subscription.close();
            log.debug("[Progress] Unsubscribed {}", subscription.getSubscriptionId());
        }
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }
}
