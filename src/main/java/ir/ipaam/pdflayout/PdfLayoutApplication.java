package ir.ipaam.pdflayout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfLayoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfLayoutApplication.class, args);
    }
}
