package com.nyota.access.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;

import java.time.LocalDate;

public record AccessRecoveryRequest(
        @NotBlank(message = "휴대폰 번호는 필수입니다")
        String phoneNumber,

        // 구매 날짜 (결제일 기준)
        @NotNull(message = "구매 날짜는 필수입니다")
        @PastOrPresent(message = "구매 날짜는 미래일 수 없습니다")
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate purchaseDate
) {
}
