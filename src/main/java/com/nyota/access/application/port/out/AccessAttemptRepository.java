package com.nyota.access.application.port.out;

import com.nyota.access.domain.AccessAttempt;

import java.time.LocalDateTime;
import java.util.List;

public interface AccessAttemptRepository {

    // 시도 기록 저장 (감사 로그, 갱신 없음)
    AccessAttempt save(AccessAttempt attempt);

    // since 이후 잠금 판단에 포함되는 시도 시각 목록 (오래된 순)
    List<LocalDateTime> findCountedAttemptTimesSince(String phoneNumber, String originAddress, LocalDateTime since);

    // (번호, 출발지) 잠금 행이 없으면 만든다. 트랜잭션 밖에서 호출한다.
    void registerKey(String phoneNumber, String originAddress, LocalDateTime now);

    // (번호, 출발지) 잠금 행을 트랜잭션 종료까지 잡는다. registerKey 이후에만 호출한다.
    void lockKey(String phoneNumber, String originAddress);
}
