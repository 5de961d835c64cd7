package it.unimib.datai.localfaas.cli.commands.event;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

@Command(name = "kinesis", description = "Stream record; the data is base64-encoded for you.")
public class KinesisEventCommand implements Runnable {

    @Option(names = {"--region"}, defaultValue = "us-east-1", description = "Region (default: ${DEFAULT-VALUE}).")
    String region;

    @Option(names = {"--partition"}, defaultValue = "partitionKey-03", description = "Partition key (default: ${DEFAULT-VALUE}).")
    String partition;

    @Option(names = {"--sequence"}, defaultValue = "49545115243490985018280067714973144582180062593244200961",
            description = "Sequence number (default: ${DEFAULT-VALUE}).")
    String sequence;

    @Option(names = {"--data"}, defaultValue = "Hello, this is a test 123.", description = "Record data, as plain text (default: ${DEFAULT-VALUE}).")
    String data;

    @Override
    public void run() {
        String encoded = Base64.getEncoder().encodeToString(data.getBytes(StandardCharsets.UTF_8));
        System.out.println(EventTemplates.renderPretty("kinesis",
                Map.of("region", region, "partition", partition, "sequence", sequence, "data", encoded)));
    }
}
