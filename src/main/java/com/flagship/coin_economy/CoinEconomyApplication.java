package com.flagship.coin_economy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CoinEconomyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoinEconomyApplication.class, args);
    }
}
