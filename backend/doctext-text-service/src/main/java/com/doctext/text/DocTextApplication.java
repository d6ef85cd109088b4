package com.doctext.text;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocTextApplication {
    public static void main(String[] args) {
        SpringApplication.run(DocTextApplication.class, args);
    }
}
