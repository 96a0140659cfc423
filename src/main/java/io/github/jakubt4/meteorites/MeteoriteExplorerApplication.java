package io.github.jakubt4.meteorites;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Meteorite Explorer — query service over the NASA Meteorite Landings dataset.
 *
 * <p>Fetches the dataset from the NASA open data portal, caches it locally as CSV,
 * classifies every landing into a coarse meteorite group and serves paginated,
 * searchable views and aggregate count tables to the presentation layer.
 *
 * @see io.github.jakubt4.meteorites.service.DatasetRefreshService
 * @see io.github.jakubt4.meteorites.service.MeteoriteQueryService
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class MeteoriteExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeteoriteExplorerApplication.class, args);
    }
}
