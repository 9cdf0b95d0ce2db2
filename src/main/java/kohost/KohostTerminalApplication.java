package kohost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KohostTerminalApplication {

    public static void main(String[] args) {
        SpringApplication.run(KohostTerminalApplication.class, args);
    }
}
