package crowd.ledger.core.event;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

/**
 * 레지스트리 설정 변경 알림 (수수료, 재무 계정, 일시 중지, 허용 자산, 역할, 템플릿)
 *
 * @param setting 변경된 설정 이름
 * @param value 변경 후 값의 문자열 표현
 */
public record RegistrySettingChangedEvent(
    String setting, String value, Address changedBy, Instant occurredAt)
    implements FundingEvent {}
