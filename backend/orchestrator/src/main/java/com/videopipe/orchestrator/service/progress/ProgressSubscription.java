package com.videopipe.orchestrator.service.progress;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 구독자 하나의 유한 이벤트 큐.
 * 큐가 가득 차면 이벤트를 버리고, 공간이 생기면 PROGRESS_GAP 표식을 먼저 넣는다.
 */
public class ProgressSubscription {

    @Getter
    private final String subscriptionId = UUID.randomUUID().toString();
    @Getter
    private final String jobId;   // null 이면 전체 작업 구독
    private final int capacity;

    private final Deque<ProgressEvent> queue = new ArrayDeque<>();
    private boolean gapPending;
    private long droppedSinceGap;
    private long totalDropped;
    private volatile boolean closed;

    ProgressSubscription(String jobId, int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Subscriber queue capacity must be at least 2");
        }
        this.jobId = jobId;
        this.capacity = capacity;
    }

    /**
     * 이벤트 적재. 절대 대기하지 않는다.
     *
     * @return 적재되었으면 true, 버려졌으면 false
     */
    synchronized boolean offer(ProgressEvent event) {
        if (closed) {
            return false;
        }
        if (gapPending) {
            // 표식 + 이번 이벤트가 모두 들어갈 자리가 있어야 누락 구간을 닫는다
            if (queue.size() + 2 > capacity) {
                drop();
                return false;
            }
            flushGap();
        }
        if (queue.size() >= capacity) {
            gapPending = true;
            drop();
            return false;
        }
        queue.addLast(event);
        notifyAll();
        return true;
    }

    /**
     * 다음 이벤트를 최대 timeout 동안 기다려 꺼낸다. 없으면 null
     */
    public synchronized ProgressEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (queue.isEmpty() && !gapPending && !closed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        if (queue.isEmpty() && gapPending) {
            flushGap();
        }
        return queue.pollFirst();
    }

    /**
     * 쌓인 이벤트 전부 꺼내기 (누락 표식 포함)
     */
    public synchronized List<ProgressEvent> drain() {
        List<ProgressEvent> events = new ArrayList<>(queue);
        queue.clear();
        if (gapPending) {
            events.add(ProgressEvent.gap(jobId, droppedSinceGap));
            gapPending = false;
            droppedSinceGap = 0;
        }
        return events;
    }

    public synchronized long getTotalDropped() {
        return totalDropped;
    }

    public boolean isClosed() {
        return closed;
    }

    synchronized void close() {
        closed = true;
        notifyAll();
    }

    boolean accepts(String eventJobId) {
        return jobId == null || jobId.equals(eventJobId);
    }

    private void drop() {
        droppedSinceGap++;
        totalDropped++;
    }

    private void flushGap() {
        queue.addLast(ProgressEvent.gap(jobId, droppedSinceGap));
        gapPending = false;
        droppedSinceGap = 0;
    }
}
