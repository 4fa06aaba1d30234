package de.conciso.circulargraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CircularGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CircularGraphApplication.class, args);
    }
}
