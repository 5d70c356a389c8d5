package gap.detector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GapDetectorApplication {
    public static void main(String[] args) {
        SpringApplication.run(GapDetectorApplication.class, args);
    }
}
