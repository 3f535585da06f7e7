package com.forecastbench.config;

import com.forecastbench.dataset.M4CacheBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "benchmark.dataset.build-cache-on-startup", havingValue = "true")
public class CacheBuildRunner implements ApplicationRunner {

    private final M4CacheBuilder cacheBuilder;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (cacheBuilder.isCached()) {
            log.info("skip: M4 value stores already exist");
            return;
        }
        cacheBuilder.buildAll();
    }
}
