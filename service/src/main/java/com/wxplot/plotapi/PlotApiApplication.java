package com.wxplot.plotapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlotApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(PlotApiApplication.class, args);
  }
}
