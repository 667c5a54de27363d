package ch.netplay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the netplay backend.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for the room reaper</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class NetplayBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetplayBackendApplication.class, args);
    }

}
