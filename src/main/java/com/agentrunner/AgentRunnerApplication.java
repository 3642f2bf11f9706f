package com.agentrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRunnerApplication.class, args);
    }
}
