package crowd.ledger.error;

import static org.assertj.core.api.Assertions.assertThat;

import crowd.ledger.error.dto.ErrorResponse;
import crowd.ledger.error.exception.FeeExceedsCeilingException;
import crowd.ledger.error.exception.InternalSystemException;
import crowd.ledger.error.exception.PlatformPausedException;
import crowd.ledger.error.exception.TransferFailureException;
import crowd.ledger.error.exception.base.ClientBaseException;
import crowd.ledger.error.exception.base.ServerBaseException;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class FundingErrorCodeTest {

  @Test
  void codesAreUnique() {
    Set<String> codes =
        Arrays.stream(FundingErrorCode.values())
            .map(FundingErrorCode::getCode)
            .collect(Collectors.toSet());

    assertThat(codes).hasSize(FundingErrorCode.values().length);
  }

  @Test
  void clientCodesAre4xxAndServerCodesAre5xx() {
    for (FundingErrorCode code : FundingErrorCode.values()) {
      if (code.getCode().startsWith("C")) {
        assertThat(code.getStatus().is4xxClientError()).as(code.name()).isTrue();
      } else {
        assertThat(code.getStatus().is5xxServerError()).as(code.name()).isTrue();
      }
    }
  }

  @Test
  void messageIsFormattedWithArguments() {
    FeeExceedsCeilingException e = new FeeExceedsCeilingException(6_000, 5_000);

    assertThat(e).isInstanceOf(ClientBaseException.class);
    assertThat(e.getMessage()).contains("6000").contains("5000");
    assertThat(e.getErrorCode()).isEqualTo(FundingErrorCode.FEE_EXCEEDS_CEILING);
  }

  @Test
  void serverExceptionKeepsCause() {
    IllegalStateException cause = new IllegalStateException("ledger offline");
    TransferFailureException e = new TransferFailureException("release", cause);

    assertThat(e).isInstanceOf(ServerBaseException.class);
    assertThat(e.getCause()).isSameAs(cause);
    assertThat(e.getErrorCode().getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
  }

  @Test
  void internalSystemExceptionRemembersTask() {
    InternalSystemException e = new InternalSystemException("Funding:donate", new Exception("x"));

    assertThat(e.getTaskName()).isEqualTo("Funding:donate");
    assertThat(e.getErrorCode()).isEqualTo(FundingErrorCode.INTERNAL_SERVER_ERROR);
  }

  @Test
  void errorResponseCarriesStatusAndCode() {
    ErrorResponse response = ErrorResponse.from(new PlatformPausedException());

    assertThat(response.status()).isEqualTo(423);
    assertThat(response.code()).isEqualTo("C015");
    assertThat(response.timestamp()).isNotNull();
  }
}
