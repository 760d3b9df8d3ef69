package com.community.kolokwa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // nightly reconciliation and daily challenge jobs
public class KolokwaBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(KolokwaBackendApplication.class, args);
    }

}
