package com.nyota.access.application.service;

import com.nyota.access.application.port.out.AccessAttemptRepository;
import com.nyota.access.common.exception.AccessRateLimitedException;
import com.nyota.access.common.exception.AccessRecoveryException;
import com.nyota.access.config.AccessRecoveryProperties;
import com.nyota.access.domain.AccessAttempt;
import com.nyota.access.domain.AccessGrant;
import com.nyota.access.domain.AccessOutcome;
import com.nyota.common.exceptions.application.InvalidRequestException;
import com.nyota.common.exceptions.application.UnauthorizedException;
import com.nyota.common.util.generator.PrimaryKeyGenerator;
import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.domain.PhoneNumber;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 휴대폰 번호 + 구매 날짜로 라이브러리 접근을 복구한다.
 * 잠금 판단, 원장 조회, 시도 기록은 (번호, 출발지) 잠금 행을 잡은 하나의 트랜잭션에서 수행되고,
 * 예외는 커밋 이후에 던져 실패한 시도도 기록이 남는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessRecoveryService {

    private static final int SUBMITTED_PHONE_MAX_LENGTH = 40;
    private static final int PHONE_NUMBER_MAX_LENGTH = 20;
    private static final String BLANK_PHONE_PLACEHOLDER = "-";

    private final AccessRateLimiter accessRateLimiter;
    private final AccessAttemptRepository accessAttemptRepository;
    private final PurchaseRepository purchaseRepository;
    private final PrimaryKeyGenerator primaryKeyGenerator;
    private final AccessRecoveryProperties accessRecoveryProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AccessGrant recover(String submittedPhone, LocalDate purchaseDate, String originAddress) {
        PhoneNumber phoneNumber;
        try {
            phoneNumber = PhoneNumber.of(submittedPhone);
        } catch (InvalidRequestException e) {
            recordInvalidAttempt(submittedPhone, originAddress, purchaseDate);
            throw e;
        }
        log.info("접근 복구 시도 - phone: {}, purchaseDate: {}, origin: {}",
                phoneNumber.masked(), purchaseDate, originAddress);

        accessAttemptRepository.registerKey(phoneNumber.getValue(), originAddress, LocalDateTime.now(clock));

        Decision decision = transactionTemplate.execute(status -> {
            accessAttemptRepository.lockKey(phoneNumber.getValue(), originAddress);
            LocalDateTime now = LocalDateTime.now(clock);

            // 잠금 중이면 원장을 조회하지 않는다
            Optional<Duration> lockout = accessRateLimiter.checkLockout(phoneNumber.getValue(), originAddress, now);
            if (lockout.isPresent()) {
                recordAttempt(submittedPhone, phoneNumber.getValue(), originAddress, purchaseDate,
                        AccessOutcome.RATE_LIMITED, null, now);
                return Decision.lockedOut(lockout.get());
            }

            List<Purchase> completed = purchaseRepository.findCompletedByPhoneNumber(phoneNumber);
            Optional<Purchase> matched = completed.stream()
                    .filter(purchase -> purchase.wasPurchasedOn(purchaseDate))
                    .min(Comparator.comparing(Purchase::getCreatedAt));

            if (matched.isEmpty()) {
                recordAttempt(submittedPhone, phoneNumber.getValue(), originAddress, purchaseDate,
                        AccessOutcome.NOT_FOUND, null, now);
                return Decision.notFound();
            }

            recordAttempt(submittedPhone, phoneNumber.getValue(), originAddress, purchaseDate,
                    AccessOutcome.SUCCESS, matched.get().getPurchaseId(), now);
            return Decision.matched(matched.get().getPurchaseId(), completed, now);
        });

        switch (decision.outcome()) {
            case RATE_LIMITED -> {
                log.warn("접근 복구 잠금 - phone: {}, origin: {}, retryAfter: {}",
                        phoneNumber.masked(), originAddress, decision.retryAfter());
                throw AccessRateLimitedException.lockedOut(decision.retryAfter());
            }
            case NOT_FOUND -> {
                log.info("접근 복구 실패 - 일치하는 구매 없음 - phone: {}", phoneNumber.masked());
                throw AccessRecoveryException.noMatchingPurchase();
            }
            default -> {
                log.info("접근 복구 성공 - phone: {}, matchedPurchaseId: {}, purchases: {}",
                        phoneNumber.masked(), decision.matchedPurchaseId(), decision.completed().size());
                return grant(phoneNumber, decision.completed(), decision.decidedAt());
            }
        }
    }

    /**
     * 결제 완료 직후 세션 발급 (복구 절차 없이).
     * 요청의 휴대폰 번호와 게이트웨이 참조가 완료된 시도와 일치해야 한다.
     */
    public AccessGrant grantForCompletedPurchase(String purchaseId, String gatewayReference, String rawPhoneNumber) {
        PhoneNumber phoneNumber = PhoneNumber.of(rawPhoneNumber);
        Purchase purchase = purchaseRepository.findById(purchaseId)
                .orElseThrow(() -> PurchaseException.notFound(purchaseId));

        if (!purchase.isOwnedBy(phoneNumber) || !purchase.getGatewayReference().equals(gatewayReference)) {
            log.warn("결제 완료 세션 요청 정보 불일치 - purchaseId: {}, phone: {}", purchaseId, phoneNumber.masked());
            throw PurchaseException.ownershipMismatch(purchaseId);
        }
        if (!purchase.isCompleted()) {
            throw PurchaseException.invalidState(purchaseId, purchase.getStatus(), "grant access for");
        }

        log.info("결제 완료 세션 발급 - purchaseId: {}", purchaseId);
        return grant(phoneNumber, purchaseRepository.findCompletedByPhoneNumber(phoneNumber), LocalDateTime.now(clock));
    }

    /**
     * 세션에 묶인 번호의 현재 접근 권한
     */
    public AccessGrant currentAccess(String boundPhoneNumber) {
        if (boundPhoneNumber == null) {
            throw UnauthorizedException.noLibrarySession();
        }
        PhoneNumber phoneNumber = PhoneNumber.of(boundPhoneNumber);
        return grant(phoneNumber, purchaseRepository.findCompletedByPhoneNumber(phoneNumber), LocalDateTime.now(clock));
    }

    private AccessGrant grant(PhoneNumber phoneNumber, List<Purchase> completed, LocalDateTime now) {
        return new AccessGrant(
                phoneNumber.getValue(),
                completed.stream().map(Purchase::getPurchaseId).toList(),
                now.plus(accessRecoveryProperties.sessionLifetime())
        );
    }

    // 형식 오류 번호는 잠금 키가 될 수 없으므로 입력값 그대로 기록만 남긴다
    private void recordInvalidAttempt(String submittedPhone, String originAddress, LocalDate purchaseDate) {
        String raw = submittedPhone == null ? "" : submittedPhone.trim();
        String keyValue = raw.isEmpty() ? BLANK_PHONE_PLACEHOLDER : truncate(raw, PHONE_NUMBER_MAX_LENGTH);
        recordAttempt(truncate(raw, SUBMITTED_PHONE_MAX_LENGTH), keyValue, originAddress, purchaseDate,
                AccessOutcome.INVALID, null, LocalDateTime.now(clock));
        log.info("접근 복구 거절 - 번호 형식 오류 - origin: {}", originAddress);
    }

    private void recordAttempt(String submittedPhone, String phoneNumber, String originAddress,
                               LocalDate purchaseDate, AccessOutcome outcome, String matchedPurchaseId,
                               LocalDateTime now) {
        accessAttemptRepository.save(AccessAttempt.record(
                primaryKeyGenerator.generateLongKey(),
                submittedPhone,
                phoneNumber,
                originAddress,
                purchaseDate,
                outcome,
                matchedPurchaseId,
                now
        ));
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private record Decision(AccessOutcome outcome, Duration retryAfter, String matchedPurchaseId,
                            List<Purchase> completed, LocalDateTime decidedAt) {

        static Decision lockedOut(Duration retryAfter) {
            return new Decision(AccessOutcome.RATE_LIMITED, retryAfter, null, List.of(), null);
        }

        static Decision notFound() {
            return new Decision(AccessOutcome.NOT_FOUND, null, null, List.of(), null);
        }

        static Decision matched(String purchaseId, List<Purchase> completed, LocalDateTime decidedAt) {
            return new Decision(AccessOutcome.SUCCESS, null, purchaseId, completed, decidedAt);
        }
    }
}
