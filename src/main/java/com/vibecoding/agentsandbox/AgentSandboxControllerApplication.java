package com.vibecoding.agentsandbox;

import com.vibecoding.agentsandbox.config.SandboxRoles;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;


@SpringBootApplication
public class AgentSandboxControllerApplication {

    private static final Logger log = LoggerFactory.getLogger(AgentSandboxControllerApplication.class);

    public static void main(String[] args) {
        log.info("==============================================");
        log.info("  Agent Sandbox Controller");
        log.info("==============================================");

        // Load .env file and set as system properties
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

            dotenv.entries().forEach(entry -> {
                System.setProperty(entry.getKey(), entry.getValue());
                log.debug("Loaded environment variable: {}", entry.getKey());
            });

            log.info("Environment variables loaded from .env file");
        } catch (Exception e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
            log.info("Continuing with system environment variables...");
        }

        ConfigurableApplicationContext context = SpringApplication.run(AgentSandboxControllerApplication.class, args);

        String role = context.getEnvironment().getProperty(SandboxRoles.PROPERTY, SandboxRoles.CONTROLLER);
        if (SandboxRoles.HYDRATE.equals(role)) {
            // init container: hydration ran in a CommandLineRunner, exit so the main container can start
            System.exit(SpringApplication.exit(context));
        }

        log.info("Application started successfully in role '{}'", role);
    }
}
