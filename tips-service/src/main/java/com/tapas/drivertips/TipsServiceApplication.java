package com.tapas.drivertips;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;


@EnableKafka
@SpringBootApplication
public class TipsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TipsServiceApplication.class, args);
    }
}
