package com.nyota.purchase.adapter.out.persistence;

import com.nyota.purchase.domain.Purchase;
import com.nyota.purchase.domain.PurchaseStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PurchaseJpaRepository extends JpaRepository<Purchase, String> {

    // 상태 전이용 행 잠금 조회 (SELECT ... FOR UPDATE)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Purchase p WHERE p.purchaseId = :purchaseId")
    Optional<Purchase> findByIdForUpdate(@Param("purchaseId") String purchaseId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Purchase p WHERE p.gatewayReference = :gatewayReference")
    Optional<Purchase> findByGatewayReferenceForUpdate(@Param("gatewayReference") String gatewayReference);

    Optional<Purchase> findByChannelId(String channelId);

    List<Purchase> findByPhoneNumberValueAndStatus(String phoneNumber, PurchaseStatus status);

    @Query("SELECT p.purchaseId FROM Purchase p WHERE p.status = :status AND p.updatedAt < :cutoff ORDER BY p.updatedAt ASC")
    List<String> findIdsByStatusAndUpdatedAtBefore(@Param("status") PurchaseStatus status,
                                                   @Param("cutoff") LocalDateTime cutoff,
                                                   Pageable pageable);
}
