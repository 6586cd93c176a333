package tech.andrefsramos.offering_watcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OfferingWatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfferingWatcherApplication.class, args);
    }
}
