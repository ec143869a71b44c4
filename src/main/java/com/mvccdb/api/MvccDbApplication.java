package com.mvccdb.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.mvccdb")
public class MvccDbApplication {

    public static void main(String[] args) {
        SpringApplication.run(MvccDbApplication.class, args);
    }
}
