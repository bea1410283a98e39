package com.nyota.access.adapter.out.persistence;

import com.nyota.access.domain.AccessRateKey;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AccessRateKeyJpaRepository extends JpaRepository<AccessRateKey, String> {

    // 잠금 판단 직렬화용 (SELECT ... FOR UPDATE)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT k FROM AccessRateKey k WHERE k.keyId = :keyId")
    Optional<AccessRateKey> findByIdForUpdate(@Param("keyId") String keyId);
}
