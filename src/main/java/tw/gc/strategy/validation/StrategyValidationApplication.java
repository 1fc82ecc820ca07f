package tw.gc.strategy.validation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrategyValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyValidationApplication.class, args);
    }
}
