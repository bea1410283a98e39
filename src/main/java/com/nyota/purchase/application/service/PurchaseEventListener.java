package com.nyota.purchase.application.service;

import com.nyota.purchase.application.dto.PurchaseStatusEvent;

/**
 * 채널 구독자. 호출은 브로드캐스트 전달 스레드에서 이루어진다.
 */
public interface PurchaseEventListener {

    void onEvent(PurchaseStatusEvent event);

    // 채널이 이벤트 없이 닫힘 (구매자 취소)
    default void onClose() {
    }
}
