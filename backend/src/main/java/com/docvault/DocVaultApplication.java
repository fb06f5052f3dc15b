package com.docvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocVaultApplication.class, args);
    }
}
