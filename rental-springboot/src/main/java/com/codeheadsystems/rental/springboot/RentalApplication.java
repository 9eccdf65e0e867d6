package com.codeheadsystems.rental.springboot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Standalone rental service. The document store client is built by
 * {@code RentalAutoConfiguration} from {@code rental.mongo-uri}, so Spring Boot's own MongoDB
 * client is excluded.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class RentalApplication {

  public static void main(String[] args) {
    SpringApplication.run(RentalApplication.class, args);
  }
}
