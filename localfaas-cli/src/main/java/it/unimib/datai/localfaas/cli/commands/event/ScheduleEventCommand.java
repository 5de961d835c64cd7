package it.unimib.datai.localfaas.cli.commands.event;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "schedule", description = "Scheduled rule trigger.")
public class ScheduleEventCommand implements Runnable {

    @Option(names = {"--region"}, defaultValue = "us-east-1", description = "Region (default: ${DEFAULT-VALUE}).")
    String region;

    @Override
    public void run() {
        System.out.println(EventTemplates.renderPretty("schedule", Map.of("region", region)));
    }
}
