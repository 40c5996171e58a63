package crowd.ledger.domain.model.account;

import crowd.ledger.error.exception.InvalidIdentityException;

/**
 * 플랫폼 식별자 (후원자, 관리자, 재무 계정, 프로젝트 인스턴스 공통)
 *
 * <p>순수 도메인 - 값의 형식은 해석하지 않고 불투명 문자열로 취급합니다. {@link #ZERO}는 "주소 없음"을 나타내며 어떤 행위자로도 사용할 수
 * 없습니다.
 */
public record Address(String value) {

  public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

  public Address {
    if (value == null || value.isBlank()) {
      throw new InvalidIdentityException("blank address");
    }
    value = value.trim();
  }

  public static Address of(String value) {
    return new Address(value);
  }

  public boolean isZero() {
    return ZERO.value.equals(value);
  }

  /**
   * 행위자로 사용할 수 있는 주소인지 검증합니다.
   *
   * @param address 검증 대상 (null 허용)
   * @param role 에러 메시지에 표시할 역할 이름
   * @return 검증된 주소
   */
  public static Address requireActor(Address address, String role) {
    if (address == null || address.isZero()) {
      throw new InvalidIdentityException(role + " must be a non-zero address");
    }
    return address;
  }

  @Override
  public String toString() {
    return value;
  }
}
