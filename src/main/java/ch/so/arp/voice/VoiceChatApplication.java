package ch.so.arp.voice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoiceChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceChatApplication.class, args);
    }
}
