package crowd.ledger.error;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
  String getCode();

  String getMessage();

  HttpStatus getStatus();

  default int getStatusCode() {
    return getStatus().value();
  }
}
