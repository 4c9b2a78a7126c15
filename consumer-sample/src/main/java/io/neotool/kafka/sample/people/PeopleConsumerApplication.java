package io.neotool.kafka.sample.people;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeopleConsumerApplication {

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(PeopleConsumerApplication.class);
    app.run(args);
  }
}
