package com.phillippitts.transcribe;

import com.phillippitts.transcribe.config.properties.ApiKeyProperties;
import com.phillippitts.transcribe.config.properties.ThreadPoolProperties;
import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.config.properties.UploadProperties;
import com.phillippitts.transcribe.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        TranscriptionProperties.class,
        UploadProperties.class,
        ApiKeyProperties.class,
        ThreadPoolProperties.class
})
public class TranscribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranscribeApplication.class, args);
    }

}
