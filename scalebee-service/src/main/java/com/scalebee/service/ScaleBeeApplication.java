package com.scalebee.service;

import com.scalebee.service.scheduling.EvaluationLoop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@EnableScheduling
@SpringBootApplication
public class ScaleBeeApplication {
    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ScaleBeeApplication.class, args);
        if (context.getBean(EvaluationLoop.class).isSingleCycle()) {
            log.info("Loop disabled, shutting down after a single evaluation cycle");
            System.exit(SpringApplication.exit(context));
        }
    }
}
