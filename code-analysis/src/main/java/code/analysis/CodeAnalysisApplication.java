package code.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeAnalysisApplication {
    public static void main(String[] args) {
        SpringApplication.run(CodeAnalysisApplication.class, args);
    }
}
