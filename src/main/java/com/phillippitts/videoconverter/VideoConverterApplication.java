package com.phillippitts.videoconverter;

import com.phillippitts.videoconverter.config.properties.ConversionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ConversionProperties.class
})
public class VideoConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoConverterApplication.class, args);
    }

}
