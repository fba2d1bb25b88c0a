package com.phillippitts.sermonflow;

import com.phillippitts.sermonflow.config.properties.AuthProperties;
import com.phillippitts.sermonflow.config.properties.ImportProperties;
import com.phillippitts.sermonflow.config.properties.ObjectStoreProperties;
import com.phillippitts.sermonflow.config.properties.ProcessingProperties;
import com.phillippitts.sermonflow.config.properties.RecordingProperties;
import com.phillippitts.sermonflow.config.properties.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RecordingProperties.class,
        ImportProperties.class,
        ProcessingProperties.class,
        StorageProperties.class,
        ObjectStoreProperties.class,
        AuthProperties.class
})
@EnableScheduling
public class SermonFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(SermonFlowApplication.class, args);
    }

}
