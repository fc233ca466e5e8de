package com.example.mcp_bridge;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@Import(TimeConfig.class)
public class McpBridgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(McpBridgeApplication.class, args);
  }
}
