package com.sneaklink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@ConfigurationPropertiesScan({"com.sneaklink.shared.config", "com.sneaklink.payment.config", "com.sneaklink.notification.config"})
@EnableAsync
public class SneakLinkEntitlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(SneakLinkEntitlementApplication.class, args);
    }
}
