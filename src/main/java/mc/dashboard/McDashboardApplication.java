package mc.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class McDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(McDashboardApplication.class, args);
    }

}
