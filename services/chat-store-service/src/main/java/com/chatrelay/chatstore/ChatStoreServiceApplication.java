package com.chatrelay.chatstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// The local backend builds and migrates its own DataSource; the remote one needs none.
@SpringBootApplication(
    exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@ConfigurationPropertiesScan
public class ChatStoreServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatStoreServiceApplication.class, args);
  }
}
