package com.nyota.purchase.adapter.out.persistence;

import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.domain.PhoneNumber;
import com.nyota.purchase.domain.Purchase;
import com.nyota.purchase.domain.PurchaseStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PurchaseRepositoryAdapter implements PurchaseRepository {

    private final PurchaseJpaRepository jpaRepository;

    @Override
    public Purchase save(Purchase purchase) {
        return jpaRepository.save(purchase);
    }

    @Override
    public Optional<Purchase> findById(String purchaseId) {
        return jpaRepository.findById(purchaseId);
    }

    @Override
    public Optional<Purchase> findByIdForUpdate(String purchaseId) {
        return jpaRepository.findByIdForUpdate(purchaseId);
    }

    @Override
    public Optional<Purchase> findByGatewayReferenceForUpdate(String gatewayReference) {
        return jpaRepository.findByGatewayReferenceForUpdate(gatewayReference);
    }

    @Override
    public Optional<Purchase> findByChannelId(String channelId) {
        return jpaRepository.findByChannelId(channelId);
    }

    @Override
    public List<Purchase> findCompletedByPhoneNumber(PhoneNumber phoneNumber) {
        return jpaRepository.findByPhoneNumberValueAndStatus(phoneNumber.getValue(), PurchaseStatus.COMPLETED);
    }

    @Override
    public List<String> findPendingIdsUpdatedBefore(LocalDateTime cutoff, int limit) {
        return jpaRepository.findIdsByStatusAndUpdatedAtBefore(
                PurchaseStatus.PENDING,
                cutoff,
                PageRequest.of(0, limit)
        );
    }
}
