package org.learningjava.ees.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.ees")
public class EesApplication {
    public static void main(String[] args) {
        SpringApplication.run(EesApplication.class, args);
    }
}
