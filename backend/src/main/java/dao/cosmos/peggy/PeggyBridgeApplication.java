package dao.cosmos.peggy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PeggyBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeggyBridgeApplication.class, args);
    }
}
