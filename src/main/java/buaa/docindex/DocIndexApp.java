package buaa.docindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class DocIndexApp {

    public static void main(String[] args) {
         SpringApplication.run(DocIndexApp.class, args);
    }
}
