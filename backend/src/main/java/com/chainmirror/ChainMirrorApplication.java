package com.chainmirror;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainMirrorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainMirrorApplication.class, args);
    }
}
