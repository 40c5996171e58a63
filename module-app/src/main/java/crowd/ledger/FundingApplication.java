package crowd.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundingApplication {

  public static void main(String[] args) {
    SpringApplication.run(FundingApplication.class, args);
  }
}
