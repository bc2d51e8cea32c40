package com.blogflow.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlogflowApplication {

  public static void main(String[] args) {
    SpringApplication.run(BlogflowApplication.class, args);
  }
}
