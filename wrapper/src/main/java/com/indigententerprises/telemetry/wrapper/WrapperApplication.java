package com.indigententerprises.telemetry.wrapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class WrapperApplication {

    public static void main(final String[] args) {
        final SpringApplication application = new SpringApplication(WrapperApplication.class);
        // the arguments belong to the child, never to spring
        application.setAddCommandLineProperties(false);

        try {
            final ConfigurableApplicationContext context = application.run(args);
            System.exit(SpringApplication.exit(context));
        } catch (RuntimeException e) {
            // spring has already reported the failure
            System.exit(1);
        }
    }
}
