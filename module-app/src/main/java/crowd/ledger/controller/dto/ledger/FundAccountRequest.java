package crowd.ledger.controller.dto.ledger;

import jakarta.validation.constraints.NotBlank;

/**
 * 샌드박스 원장 입금/토큰 발행 요청
 *
 * @param account 대상 계정
 * @param amount 금액 (subunit)
 */
public record FundAccountRequest(@NotBlank String account, long amount) {}
