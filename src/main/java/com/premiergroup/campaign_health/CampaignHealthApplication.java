package com.premiergroup.campaign_health;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories
public class CampaignHealthApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignHealthApplication.class, args);
    }
}
