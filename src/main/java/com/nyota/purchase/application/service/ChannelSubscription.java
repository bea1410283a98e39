package com.nyota.purchase.application.service;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 채널 구독 핸들. close() 는 여러 번 호출해도 안전하다.
 */
public class ChannelSubscription implements AutoCloseable {

    @Getter
    private final String channelId;
    private final PurchaseEventListener listener;
    private final PurchaseEventBroadcaster broadcaster;
    private final AtomicBoolean active = new AtomicBoolean(true);

    ChannelSubscription(String channelId, PurchaseEventListener listener, PurchaseEventBroadcaster broadcaster) {
        this.channelId = channelId;
        this.listener = listener;
        this.broadcaster = broadcaster;
    }

    public boolean isActive() {
        return active.get();
    }

    PurchaseEventListener listener() {
        return listener;
    }

    @Override
    public void close() {
        if (active.compareAndSet(true, false)) {
            broadcaster.unsubscribe(this);
        }
    }
}
