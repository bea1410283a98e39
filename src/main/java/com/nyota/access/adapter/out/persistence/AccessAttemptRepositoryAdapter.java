package com.nyota.access.adapter.out.persistence;

import com.nyota.access.application.port.out.AccessAttemptRepository;
import com.nyota.access.domain.AccessAttempt;
import com.nyota.access.domain.AccessOutcome;
import com.nyota.access.domain.AccessRateKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AccessAttemptRepositoryAdapter implements AccessAttemptRepository {

    private static final Set<AccessOutcome> COUNTED_OUTCOMES = Arrays.stream(AccessOutcome.values())
            .filter(AccessOutcome::countsTowardLimit)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(AccessOutcome.class)));

    private final AccessAttemptJpaRepository accessAttemptJpaRepository;
    private final AccessRateKeyJpaRepository accessRateKeyJpaRepository;

    @Override
    public AccessAttempt save(AccessAttempt attempt) {
        return accessAttemptJpaRepository.save(attempt);
    }

    @Override
    public List<LocalDateTime> findCountedAttemptTimesSince(String phoneNumber, String originAddress,
                                                            LocalDateTime since) {
        return accessAttemptJpaRepository.findAttemptTimes(phoneNumber, originAddress, since, COUNTED_OUTCOMES);
    }

    @Override
    public void registerKey(String phoneNumber, String originAddress, LocalDateTime now) {
        String keyId = AccessRateKey.keyOf(phoneNumber, originAddress);
        if (accessRateKeyJpaRepository.existsById(keyId)) {
            return;
        }
        try {
            accessRateKeyJpaRepository.saveAndFlush(AccessRateKey.create(phoneNumber, originAddress, now));
        } catch (DataIntegrityViolationException e) {
            // 동시 요청이 먼저 만든 경우
            log.debug("잠금 행 이미 존재 - keyId: {}", keyId);
        }
    }

    @Override
    public void lockKey(String phoneNumber, String originAddress) {
        String keyId = AccessRateKey.keyOf(phoneNumber, originAddress);
        accessRateKeyJpaRepository.findByIdForUpdate(keyId)
                .orElseThrow(() -> new IllegalStateException("잠금 행이 없습니다: " + keyId));
    }
}
