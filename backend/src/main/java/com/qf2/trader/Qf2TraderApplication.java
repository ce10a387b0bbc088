package com.qf2.trader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class Qf2TraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(Qf2TraderApplication.class, args);
    }
}
