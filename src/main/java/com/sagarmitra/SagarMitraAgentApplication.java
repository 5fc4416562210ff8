package com.sagarmitra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class SagarMitraAgentApplication {

    public static void main(String[] args) {
        log.info("Starting SagarMitra agent");
        SpringApplication.run(SagarMitraAgentApplication.class, args);
        log.info("SagarMitra agent started");
    }

}
