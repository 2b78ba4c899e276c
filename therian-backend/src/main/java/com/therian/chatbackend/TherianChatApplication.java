package com.therian.chatbackend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableAsync;

@Slf4j
@EnableAsync
@SpringBootApplication(scanBasePackages = "com.therian")
public class TherianChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(TherianChatApplication.class, args);
    }

    // Check the datasource once on startup
    @Bean
    public CommandLineRunner checkDatabase(JdbcTemplate jdbcTemplate) {
        return args -> {
            try {
                jdbcTemplate.queryForObject("SELECT 1", Integer.class);
                log.info("✅ Database reachable");
            } catch (Exception e) {
                log.error("❌ Database not reachable: {}", e.getMessage());
            }
        };
    }
}
