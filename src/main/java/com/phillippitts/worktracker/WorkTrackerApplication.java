package com.phillippitts.worktracker;

import com.phillippitts.worktracker.config.properties.ThreadPoolProperties;
import com.phillippitts.worktracker.config.properties.TrackingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TrackingProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class WorkTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkTrackerApplication.class, args);
    }

}
