package com.flagship.card_autopay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CardAutopayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardAutopayApplication.class, args);
    }
}
