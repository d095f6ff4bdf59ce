package com.so2flux;

import com.so2flux.config.FluxProperties;
import com.so2flux.service.FluxService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(FluxProperties.class)
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    // Runs one daily analysis when started with --flux.analysis-date=yyyy-MM-dd
    @Bean
    CommandLineRunner runDailyAnalysis(FluxService fluxService, FluxProperties properties) {
        return args -> {
            if (properties.getAnalysisDate() != null) {
                fluxService.runDailyAnalysis(properties.getAnalysisDate(), properties.isReanalysis());
            }
        };
    }
}
