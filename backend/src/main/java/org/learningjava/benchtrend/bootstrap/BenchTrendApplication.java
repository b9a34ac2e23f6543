package org.learningjava.benchtrend.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.benchtrend")
public class BenchTrendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BenchTrendApplication.class, args);
    }
}
