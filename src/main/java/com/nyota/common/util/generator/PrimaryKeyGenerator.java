package com.nyota.common.util.generator;

public interface PrimaryKeyGenerator {
	
	/**
	 * Generate unique Long ID
	 * 감사 기록(AccessAttempt) 등 append-only 테이블의 Long 타입 ID 생성
	 *
	 * @return 64-bit Long ID
	 */
	Long generateLongKey();
}
