package crowd.ledger.controller;

import crowd.ledger.domain.model.account.Address;

/** 호출자 식별 헤더. 인증 계층이 없으므로 헤더 값을 그대로 호출자 주소로 사용합니다. */
public final class CallerHeaders {

  public static final String CALLER = "X-Caller-Address";

  private CallerHeaders() {}

  public static Address caller(String headerValue) {
    return Address.requireActor(Address.of(headerValue), "caller");
  }
}
