package tdsc.blog.engagement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BlogEngagementApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlogEngagementApplication.class, args);
    }
}
