package com.nyota.purchase.application.service;

import com.nyota.purchase.application.dto.PurchaseStatusEvent;
import com.nyota.purchase.config.BroadcastProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 채널 ID 단위 프로세스 내 발행/구독.
 * <p>
 * 채널은 최종 이벤트를 한 번만 발행하며, 발행 이후 구독자는 즉시 같은 이벤트를 재생받는다.
 * 채널 상태 변경은 모두 {@link ConcurrentHashMap#compute} 안에서 이루어지므로 같은 채널에 대한
 * 구독과 발행이 겹쳐도 구독자는 이벤트를 정확히 한 번 받는다.
 * 전달은 별도 풀에서 수행되며 발행자는 구독자를 기다리지 않는다.
 */
@Component
@Slf4j
public class PurchaseEventBroadcaster {

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final Executor deliveryExecutor;
    private final BroadcastProperties broadcastProperties;
    private final Clock clock;

    public PurchaseEventBroadcaster(@Qualifier("broadcastExecutor") Executor deliveryExecutor,
                                    BroadcastProperties broadcastProperties,
                                    Clock clock) {
        this.deliveryExecutor = deliveryExecutor;
        this.broadcastProperties = broadcastProperties;
        this.clock = clock;
    }

    public ChannelSubscription subscribe(String channelId, PurchaseEventListener listener) {
        ChannelSubscription subscription = new ChannelSubscription(channelId, listener, this);
        Channel channel = channels.compute(channelId, (id, existing) -> {
            Channel target = existing != null ? existing : new Channel();
            if (!target.isTerminated()) {
                target.subscribers.add(subscription);
            }
            return target;
        });

        if (channel.isTerminated()) {
            log.debug("종료된 채널 구독 - channelId: {}, replay: {}", channelId, channel.terminalEvent != null);
            if (channel.terminalEvent != null) {
                dispatch(subscription, channel.terminalEvent);
            } else {
                dispatchClose(subscription);
            }
        }
        return subscription;
    }

    /**
     * 최종 이벤트 발행. 채널당 첫 발행만 전달되고 이후 발행은 무시된다.
     *
     * @return 전달 대상이 된 구독자 수, 무시된 경우 -1
     */
    public int publish(String channelId, PurchaseStatusEvent event) {
        Delivery delivery = new Delivery();
        channels.compute(channelId, (id, existing) -> {
            Channel target = existing != null ? existing : new Channel();
            if (target.isTerminated()) {
                delivery.suppressed = true;
                return target;
            }
            target.terminate(event, LocalDateTime.now(clock));
            delivery.recipients = List.copyOf(target.subscribers);
            return target;
        });

        if (delivery.suppressed) {
            log.info("이미 종료된 채널 - 이벤트 무시 - channelId: {}, status: {}", channelId, event.status());
            return -1;
        }

        log.info("구매 상태 브로드캐스트 - channelId: {}, status: {}, subscribers: {}",
                channelId, event.status(), delivery.recipients.size());
        delivery.recipients.forEach(subscription -> dispatch(subscription, event));
        return delivery.recipients.size();
    }

    /**
     * 이벤트 없이 채널 종료 (구매자 취소). 이후 발행은 무시된다.
     */
    public void close(String channelId) {
        Delivery delivery = new Delivery();
        channels.compute(channelId, (id, existing) -> {
            Channel target = existing != null ? existing : new Channel();
            if (target.isTerminated()) {
                delivery.suppressed = true;
                return target;
            }
            target.terminate(null, LocalDateTime.now(clock));
            delivery.recipients = List.copyOf(target.subscribers);
            target.subscribers.clear();
            return target;
        });

        if (delivery.suppressed) {
            return;
        }
        log.info("채널 종료 - channelId: {}, subscribers: {}", channelId, delivery.recipients.size());
        delivery.recipients.forEach(this::dispatchClose);
    }

    void unsubscribe(ChannelSubscription subscription) {
        channels.computeIfPresent(subscription.getChannelId(), (id, channel) -> {
            channel.subscribers.remove(subscription);
            // 마지막 구독자가 떠나면 채널 해제 (종료 여부와 무관, 이후 연결은 원장 상태로 복구)
            return channel.subscribers.isEmpty() ? null : channel;
        });
    }

    /**
     * 구독자가 없는 종료 채널을 보관 기간이 지나면 정리한다.
     */
    @Scheduled(fixedDelayString = "${nyota.broadcast.eviction-interval:PT1M}")
    public void evictTerminatedChannels() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(broadcastProperties.channelRetention());
        int before = channels.size();
        for (String channelId : channels.keySet()) {
            channels.computeIfPresent(channelId, (id, channel) -> channel.isEvictable(cutoff) ? null : channel);
        }
        int evicted = before - channels.size();
        if (evicted > 0) {
            log.info("종료 채널 정리 - evicted: {}, remaining: {}", evicted, channels.size());
        }
    }

    private void dispatch(ChannelSubscription subscription, PurchaseStatusEvent event) {
        try {
            deliveryExecutor.execute(() -> deliver(subscription, event));
        } catch (RejectedExecutionException e) {
            // 폴링으로 복구 가능
            log.warn("브로드캐스트 전달 큐 포화 - 이벤트 폐기 - channelId: {}, status: {}",
                    subscription.getChannelId(), event.status());
        }
    }

    private void dispatchClose(ChannelSubscription subscription) {
        try {
            deliveryExecutor.execute(() -> {
                if (subscription.isActive()) {
                    subscription.listener().onClose();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("브로드캐스트 전달 큐 포화 - 종료 알림 폐기 - channelId: {}", subscription.getChannelId());
        }
    }

    private void deliver(ChannelSubscription subscription, PurchaseStatusEvent event) {
        if (!subscription.isActive()) {
            return;
        }
        try {
            subscription.listener().onEvent(event);
        } catch (RuntimeException e) {
            log.warn("구독자 전달 실패 - 구독 해제 - channelId: {}, error: {}",
                    subscription.getChannelId(), e.getMessage());
            subscription.close();
        }
    }

    private static final class Channel {
        private final Set<ChannelSubscription> subscribers = new CopyOnWriteArraySet<>();
        private volatile boolean terminated;
        // close() 로 종료된 경우 null
        private volatile PurchaseStatusEvent terminalEvent;
        private volatile LocalDateTime terminatedAt;

        boolean isTerminated() {
            return terminated;
        }

        void terminate(PurchaseStatusEvent event, LocalDateTime now) {
            this.terminated = true;
            this.terminalEvent = event;
            this.terminatedAt = now;
        }

        boolean isEvictable(LocalDateTime cutoff) {
            return terminated && subscribers.isEmpty() && terminatedAt.isBefore(cutoff);
        }
    }

    private static final class Delivery {
        private boolean suppressed;
        private List<ChannelSubscription> recipients = List.of();
    }
}
