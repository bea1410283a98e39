package com.nyota.common.config;

import com.nyota.common.util.generator.PrimaryKeyGenerator;
import com.nyota.common.util.generator.Snowflake;
import com.nyota.purchase.config.BroadcastProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class CustomConfig {
	
	// 인스턴스별 node id, 미지정(-1) 시 랜덤
	@Bean
	public PrimaryKeyGenerator primaryKeyGenerator(@Value("${nyota.id.node-id:-1}") long nodeId) {
		return nodeId < 0 ? new Snowflake() : new Snowflake(nodeId);
	}
	
	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}
	
	/**
	 * 브로드캐스트 전달 전용 풀. 큐가 가득 차면 이벤트를 버린다 (폴링이 최종 안전망).
	 */
	@Bean(name = "broadcastExecutor")
	public ThreadPoolTaskExecutor broadcastExecutor(BroadcastProperties broadcastProperties) {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(broadcastProperties.deliveryPoolSize());
		executor.setMaxPoolSize(broadcastProperties.deliveryPoolSize());
		executor.setQueueCapacity(broadcastProperties.deliveryQueueCapacity());
		executor.setThreadNamePrefix("broadcast-");
		executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
		executor.initialize();
		return executor;
	}
}
