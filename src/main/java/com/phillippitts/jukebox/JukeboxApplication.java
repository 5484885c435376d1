package com.phillippitts.jukebox;

import com.phillippitts.jukebox.config.properties.AnnouncerProperties;
import com.phillippitts.jukebox.config.properties.ButtonProperties;
import com.phillippitts.jukebox.config.properties.PlayerProcessProperties;
import com.phillippitts.jukebox.config.properties.SequencerProperties;
import com.phillippitts.jukebox.config.properties.SourceProperties;
import com.phillippitts.jukebox.config.properties.StateProperties;
import com.phillippitts.jukebox.config.properties.VideoProperties;
import com.phillippitts.jukebox.config.properties.VolumeProperties;
import com.phillippitts.jukebox.config.properties.WorkerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WorkerProperties.class,
        SequencerProperties.class,
        VideoProperties.class,
        AnnouncerProperties.class,
        PlayerProcessProperties.class,
        SourceProperties.class,
        StateProperties.class,
        ButtonProperties.class,
        VolumeProperties.class
})
public class JukeboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(JukeboxApplication.class, args);
    }

}
