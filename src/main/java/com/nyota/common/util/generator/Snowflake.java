package com.nyota.common.util.generator;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Snowflake ID Generator - Time-ordered 64-bit unique ID - Custom epoch - Supports multiple nodes
 */
public class Snowflake implements PrimaryKeyGenerator {
	
	// ===== Bit Allocation =====
	private static final int NODE_ID_BITS = 10;
	private static final int SEQUENCE_BITS = 12;
	
	private static final long MAX_NODE_ID = (1L << NODE_ID_BITS) - 1;
	private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;
	
	private static final int NODE_ID_SHIFT = SEQUENCE_BITS;
	private static final int TIMESTAMP_SHIFT = NODE_ID_BITS + SEQUENCE_BITS;
	
	// ===== Custom Epoch: 2025-01-01T00:00:00Z =====
	private static final long CUSTOM_EPOCH = 1735689600000L;
	
	private final long nodeId;
	private long lastTimestamp = -1L;
	private long sequence = 0L;
	
	public Snowflake() {
		this(ThreadLocalRandom.current().nextLong(MAX_NODE_ID + 1));
	}
	
	public Snowflake(long nodeId) {
		if (nodeId < 0 || nodeId > MAX_NODE_ID) {
			throw new IllegalArgumentException("Node ID must be between 0 and " + MAX_NODE_ID + ": " + nodeId);
		}
		this.nodeId = nodeId;
	}
	
	public synchronized long nextId() {
		long currentTimestamp = currentTime();
		
		// Clock rollback: wait for time to catch up
		if (currentTimestamp < lastTimestamp) {
			currentTimestamp = waitNextMillis(lastTimestamp);
		}
		
		if (currentTimestamp == lastTimestamp) {
			sequence = (sequence + 1) & MAX_SEQUENCE;
			if (sequence == 0) {
				currentTimestamp = waitNextMillis(currentTimestamp);
			}
		} else {
			sequence = 0;
		}
		
		lastTimestamp = currentTimestamp;
		
		return ((currentTimestamp - CUSTOM_EPOCH) << TIMESTAMP_SHIFT)
				| (nodeId << NODE_ID_SHIFT)
				| sequence;
	}
	
	private long waitNextMillis(long lastTimestamp) {
		long timestamp = currentTime();
		while (timestamp <= lastTimestamp) {
			Thread.yield();
			timestamp = currentTime();
		}
		return timestamp;
	}
	
	private long currentTime() {
		return System.currentTimeMillis();
	}
	
	@Override
	public Long generateLongKey() {
		return nextId();
	}
}
