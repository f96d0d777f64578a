package dao.metatx.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RelayLayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayLayerApplication.class, args);
    }
}
