package com.dealhunt.aggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DealAggregatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(DealAggregatorApplication.class, args);
  }
}
