package de.htwsaar.datalinker.datalink;

import de.htwsaar.datalinker.common.auth.SecurityConfig;
import de.htwsaar.datalinker.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@Import({LoggingConfig.class, SecurityConfig.class})
public class DatalinkApp {
    public static void main(String[] args) {
        SpringApplication.run(DatalinkApp.class, args);
    }
}
