package github.sarthakdev143.scene_composer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SceneComposerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SceneComposerApplication.class, args);
	}

}
