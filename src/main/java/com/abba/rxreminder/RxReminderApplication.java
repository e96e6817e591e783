package com.abba.rxreminder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RxReminderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RxReminderApplication.class, args);
    }
}
