package dev.receiptly.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the receipt assistant service.
 */
@SpringBootApplication(scanBasePackages = "dev.receiptly")
public class ReceiptAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptAssistantApplication.class, args);
    }
}
