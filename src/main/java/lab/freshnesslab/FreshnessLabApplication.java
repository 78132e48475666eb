package lab.freshnesslab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FreshnessLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(FreshnessLabApplication.class, args);
    }

}
