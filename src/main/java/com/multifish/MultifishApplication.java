package com.multifish;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MultifishApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultifishApplication.class, args);
    }
}
