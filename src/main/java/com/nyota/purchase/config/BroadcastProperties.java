package com.nyota.purchase.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "nyota.broadcast")
public record BroadcastProperties(
        // 구독자 없는 종료 채널 보관 시간
        @DefaultValue("10m") Duration channelRetention,
        @DefaultValue("4") int deliveryPoolSize,
        @DefaultValue("1000") int deliveryQueueCapacity
) {
}
