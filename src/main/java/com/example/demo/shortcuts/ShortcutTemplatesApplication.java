package com.example.demo.shortcuts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShortcutTemplatesApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShortcutTemplatesApplication.class, args);
    }
}
