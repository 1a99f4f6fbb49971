package com.ads.guardian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProfitGuardianApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProfitGuardianApplication.class, args);
    }
}
