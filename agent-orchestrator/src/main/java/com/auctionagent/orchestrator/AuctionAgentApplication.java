package com.auctionagent.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuctionAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuctionAgentApplication.class, args);
    }
}
