package com.pricetracker.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ScraperApplication {

    public static void main(String[] args) {
        // Basic auth is disabled for HTTPS proxy tunnels by default; authenticated proxies need it.
        if (System.getProperty("jdk.http.auth.tunneling.disabledSchemes") == null) {
            System.setProperty("jdk.http.auth.tunneling.disabledSchemes", "");
        }
        SpringApplication.run(ScraperApplication.class, args);
    }
}
