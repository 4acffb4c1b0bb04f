package com.poc.tradedata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeDataApplication.class, args);
    }
}
