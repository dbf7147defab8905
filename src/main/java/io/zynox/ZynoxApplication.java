package io.zynox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * Zynox Cloud Memory: an encrypted, owner-scoped memory store over HTTP.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class ZynoxApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZynoxApplication.class, args);
    }
}
