package org.learningjava.blockprog.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.blockprog")
public class BlockProgApplication {
    public static void main(String[] args) {
        SpringApplication.run(BlockProgApplication.class, args);
    }
}
