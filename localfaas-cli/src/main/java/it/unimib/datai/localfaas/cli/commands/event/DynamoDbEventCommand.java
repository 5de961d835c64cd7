package it.unimib.datai.localfaas.cli.commands.event;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "dynamodb", description = "Table stream with an insert, a modify and a remove record.")
public class DynamoDbEventCommand implements Runnable {

    @Option(names = {"--region"}, defaultValue = "us-east-1", description = "Region (default: ${DEFAULT-VALUE}).")
    String region;

    @Override
    public void run() {
        System.out.println(EventTemplates.renderPretty("dynamodb", Map.of("region", region)));
    }
}
