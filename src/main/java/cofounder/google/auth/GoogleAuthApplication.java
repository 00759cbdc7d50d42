package cofounder.google.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoogleAuthApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GoogleAuthApplication.class, args)));
    }

}
