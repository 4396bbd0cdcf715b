package me.go_gradually.phonedesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhoneDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(PhoneDeskApplication.class, args);
    }
}
