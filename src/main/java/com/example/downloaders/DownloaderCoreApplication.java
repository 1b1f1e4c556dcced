package com.example.downloaders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DownloaderCoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(DownloaderCoreApplication.class, args);
    }
}
