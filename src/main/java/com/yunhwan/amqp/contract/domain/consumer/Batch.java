package com.yunhwan.amqp.contract.domain.consumer;

import java.time.Instant;
import java.util.List;

/**
 * 도착 순서가 보존된 배치. flush 이후에는 불변이다.
 */
public record Batch<E>(List<E> items, Instant deadline, FlushTrigger trigger) {

    public Batch {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
