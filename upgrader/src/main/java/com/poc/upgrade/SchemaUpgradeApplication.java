package com.poc.upgrade;

import com.poc.upgrade.cli.UpgradeExitCode;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Main application class for the schema upgrade engine.
 * Exits after running when started with {@code --upgrade.command=upgrade|status}.
 */
@SpringBootApplication
public class SchemaUpgradeApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context;
        try {
            context = SpringApplication.run(SchemaUpgradeApplication.class, args);
        } catch (RuntimeException e) {
            UpgradeExitCode code = UpgradeExitCode.of(e);
            System.err.println("Schema upgrade engine failed to start (" + code + "): " + rootMessage(e));
            System.exit(code.getCode());
            return;
        }
        
        if (context.getEnvironment().getProperty("upgrade.command") != null) {
            System.exit(SpringApplication.exit(context));
        }
    }
    
    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
