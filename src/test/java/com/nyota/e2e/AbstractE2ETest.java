package com.nyota.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.nyota.purchase.adapter.in.web.GatewayWebhookController;
import com.nyota.purchase.application.service.WebhookSignatureVerifier;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * E2E 테스트를 위한 베이스 클래스
 * - 인메모리 H2 (MariaDB 모드) 사용
 * - WireMock으로 모바일 결제 게이트웨이 모킹
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureMockMvc
public abstract class AbstractE2ETest {

	protected static final String BUYER_PHONE = "0711000000";
	protected static final long AMOUNT = 500L;

	protected static WireMockServer gatewayServer;

	@Autowired
	protected MockMvc mockMvc;
	@Autowired
	protected JdbcTemplate jdbcTemplate;
	@Autowired
	protected ObjectMapper objectMapper;
	@Autowired
	protected WebhookSignatureVerifier signatureVerifier;

	@BeforeAll
	static void beforeAll() {
		gatewayServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
		gatewayServer.start();
	}

	@AfterAll
	static void afterAll() {
		if (gatewayServer != null && gatewayServer.isRunning()) {
			gatewayServer.stop();
		}
	}

	@DynamicPropertySource
	static void overrideProperties(DynamicPropertyRegistry registry) {
		registry.add("nyota.gateway.base-url", () -> "http://localhost:" + gatewayServer.port());
	}

	@BeforeEach
	void setUp() {
		gatewayServer.resetAll();
		stubGatewayAccepts();
		cleanDatabase();
	}

	private void cleanDatabase() {
		jdbcTemplate.execute("DELETE FROM access_attempts");
		jdbcTemplate.execute("DELETE FROM access_rate_keys");
		jdbcTemplate.execute("DELETE FROM purchases");
	}

	protected void stubGatewayAccepts() {
		gatewayServer.stubFor(WireMock.post(urlPathEqualTo("/v1/push-payments"))
				.willReturn(aResponse()
						.withStatus(200)
						.withHeader("Content-Type", "application/json")
						.withBody("""
								{
								    "requestId": "REQ-E2E",
								    "status": "ACCEPTED"
								}
								""")));
	}

	protected String newChannelId() {
		return "channel-" + UUID.randomUUID();
	}

	/**
	 * 체크아웃 요청 후 응답 본문 반환
	 */
	protected JsonNode checkout(String phone, String channelId) throws Exception {
		String body = String.format("""
				{
				    "phoneNumber": "%s",
				    "assetReference": "album-sunrise",
				    "amount": %d,
				    "channelId": "%s"
				}
				""", phone, AMOUNT, channelId);

		String response = mockMvc.perform(post("/api/v1/purchases")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isCreated())
				.andReturn()
				.getResponse()
				.getContentAsString();
		return objectMapper.readTree(response);
	}

	/**
	 * 서명 헤더를 붙여 게이트웨이 웹훅 전송
	 */
	protected ResultActions sendWebhook(String gatewayReference, String outcome, long amount) throws Exception {
		String payload = String.format("""
				{
				    "gatewayReference": "%s",
				    "outcome": "%s",
				    "amount": %d,
				    "transactionId": "TXN-%s",
				    "resultDescription": "processed"
				}
				""", gatewayReference, outcome, amount, UUID.randomUUID().toString().substring(0, 8));

		return mockMvc.perform(post("/api/v1/webhooks/gateway")
				.contentType(MediaType.APPLICATION_JSON)
				.header(GatewayWebhookController.SIGNATURE_HEADER, signatureVerifier.sign(payload))
				.content(payload));
	}

	protected String purchaseStatus(String purchaseId) {
		return jdbcTemplate.queryForObject(
				"SELECT status FROM purchases WHERE purchase_id = ?", String.class, purchaseId);
	}
}
