package com.nyota.purchase.application.service;

import com.nyota.purchase.application.dto.PurchaseChannelClosedEvent;
import com.nyota.purchase.application.dto.PurchaseResolvedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 원장 커밋 이후에만 브로드캐스트한다. 롤백된 상태 전이는 구독자에게 전달되지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PurchaseBroadcastRelay {

    private final PurchaseEventBroadcaster broadcaster;
    private final PurchaseStatusPresenter presenter;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPurchaseResolved(PurchaseResolvedEvent event) {
        log.debug("커밋 후 브로드캐스트 - purchaseId: {}, status: {}", event.purchaseId(), event.status());
        broadcaster.publish(
                event.channelId(),
                presenter.present(event.purchaseId(), event.channelId(), event.status())
        );
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onChannelClosed(PurchaseChannelClosedEvent event) {
        log.debug("커밋 후 채널 종료 - purchaseId: {}", event.purchaseId());
        broadcaster.close(event.channelId());
    }
}
