package com.videopipe.orchestrator.service.scheduler;

import com.videopipe.common.enums.StageType;
import lombok.Getter;

import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단계 하나의 대기열과 동시 실행 슬롯
 */
class StageLane {

    @Getter
    private final StageType stage;
    @Getter
    private final int limit;
    private final PriorityBlockingQueue<DispatchTicket> queue = new PriorityBlockingQueue<>(64, DispatchTicket.ORDER);
    private final AtomicInteger inFlight = new AtomicInteger();

    StageLane(StageType stage, int limit) {
        this.stage = stage;
        this.limit = limit;
    }

    void enqueue(DispatchTicket ticket) {
        queue.add(ticket);
    }

    DispatchTicket poll() {
        return queue.poll();
    }

    boolean hasQueued() {
        return !queue.isEmpty();
    }

    boolean tryAcquireSlot() {
        while (true) {
            int current = inFlight.get();
            if (current >= limit) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void releaseSlot() {
        inFlight.updateAndGet(value -> Math.max(0, value - 1));
    }

    int getInFlight() {
        return inFlight.get();
    }

    int getQueued() {
        return queue.size();
    }
}
