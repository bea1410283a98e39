package com.nyota.purchase.adapter.out.gateway;

import com.nyota.purchase.adapter.out.gateway.dto.GatewayPushRequest;
import com.nyota.purchase.adapter.out.gateway.dto.GatewayPushResponse;
import com.nyota.purchase.application.port.out.MobilePaymentGateway;
import com.nyota.purchase.common.exception.PaymentGatewayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
@RequiredArgsConstructor
@Slf4j
public class HttpMobilePaymentGatewayAdapter implements MobilePaymentGateway {

	private final WebClient.Builder webClientBuilder;

	@Value("${nyota.gateway.base-url}")
	private String baseUrl;

	@Value("${nyota.gateway.api-key}")
	private String apiKey;

	@Value("${nyota.gateway.request-timeout:10s}")
	private Duration requestTimeout;

	@Override
	public GatewayPushResponse pushPayment(GatewayPushRequest request) {
		log.info("게이트웨이 결제 푸시 요청 - reference: {}, amount: {}", request.reference(), request.amount());

		try {
			GatewayPushResponse response = webClientBuilder.build()
					.post()
					.uri(baseUrl + "/v1/push-payments")
					.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
					.header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
					.bodyValue(request)
					.retrieve()
					.bodyToMono(GatewayPushResponse.class)
					.block(requestTimeout);

			if (response == null) {
				throw new IllegalStateException("Empty response from payment gateway");
			}

			log.info("게이트웨이 결제 푸시 접수 - reference: {}, requestId: {}, status: {}",
					response.reference(), response.requestId(), response.status());

			return response;

		} catch (Exception e) {
			log.error("게이트웨이 결제 푸시 실패 - reference: {}, error: {}",
					request.reference(), e.getMessage(), e);
			throw new PaymentGatewayException("Payment gateway push failed: " + e.getMessage(), e);
		}
	}
}
