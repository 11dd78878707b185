package axios.mail.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;
import org.springframework.scheduling.annotation.EnableScheduling;

// OAuth client secret and API keys stay out of application.properties
@EnableScheduling
@PropertySource(value = "file:./secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication
public class MailSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailSyncApplication.class, args);
    }

}
