package io.intellixity.paging.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class PagingExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(PagingExamplesApplication.class, args);
  }
}
