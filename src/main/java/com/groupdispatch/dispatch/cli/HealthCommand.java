package com.groupdispatch.dispatch.cli;

import com.groupdispatch.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: groupdispatch health
 * <p>
 * Exit code 1 when any component is not UP. Outside {@code serve} the dispatch loop is not
 * running, so that component always reports DOWN here.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check store and sandbox provider health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all components operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}
