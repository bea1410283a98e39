package com.nyota.purchase.application.service;

import com.nyota.purchase.application.dto.PurchaseStatusEvent;
import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.config.CheckoutProperties;
import com.nyota.purchase.domain.Purchase;
import com.nyota.purchase.domain.PurchaseStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 채널 단위 SSE 스트림. 최종 상태 하나를 보내고 연결을 닫는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseStreamService {

    public static final String EVENT_NAME = "purchase-status";

    private final PurchaseEventBroadcaster broadcaster;
    private final PurchaseRepository purchaseRepository;
    private final PurchaseStatusPresenter presenter;
    private final CheckoutProperties checkoutProperties;

    public SseEmitter open(String channelId) {
        SseEmitter emitter = new SseEmitter(checkoutProperties.clientWait().toMillis());
        StreamListener listener = new StreamListener(channelId, emitter);

        // 구독 먼저, 원장 확인은 그 다음 (구독 전에 발행된 결과를 놓치지 않도록)
        ChannelSubscription subscription = broadcaster.subscribe(channelId, listener);
        emitter.onCompletion(subscription::close);
        emitter.onError(e -> subscription.close());
        emitter.onTimeout(() -> {
            log.debug("스트림 대기 시간 초과 - channelId: {}", channelId);
            subscription.close();
            emitter.complete();
        });

        Optional<Purchase> purchase = purchaseRepository.findByChannelId(channelId);
        purchase.filter(Purchase::isResolved)
                .ifPresent(resolved -> listener.onEvent(presenter.present(resolved)));
        purchase.filter(p -> p.getStatus() == PurchaseStatus.CANCELLED)
                .ifPresent(cancelled -> listener.onClose());

        log.debug("스트림 연결 - channelId: {}, ledgerStatus: {}",
                channelId, purchase.map(Purchase::getStatus).orElse(null));
        return emitter;
    }

    /**
     * 브로드캐스트와 원장 재확인이 겹쳐도 이벤트는 한 번만 보낸다.
     */
    static final class StreamListener implements PurchaseEventListener {

        private final String channelId;
        private final SseEmitter emitter;
        private final AtomicBoolean finished = new AtomicBoolean(false);

        StreamListener(String channelId, SseEmitter emitter) {
            this.channelId = channelId;
            this.emitter = emitter;
        }

        @Override
        public void onEvent(PurchaseStatusEvent event) {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                        .name(EVENT_NAME)
                        .id(event.purchaseId())
                        .data(event));
                emitter.complete();
                log.debug("스트림 이벤트 전송 - channelId: {}, status: {}", channelId, event.status());
            } catch (IOException e) {
                log.info("스트림 클라이언트 연결 끊김 - channelId: {}", channelId);
                emitter.completeWithError(e);
            }
        }

        @Override
        public void onClose() {
            if (finished.compareAndSet(false, true)) {
                emitter.complete();
            }
        }
    }
}
