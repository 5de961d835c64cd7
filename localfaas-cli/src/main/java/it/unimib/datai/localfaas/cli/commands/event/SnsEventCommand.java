package it.unimib.datai.localfaas.cli.commands.event;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "sns", description = "Topic notification.")
public class SnsEventCommand implements Runnable {

    @Option(names = {"--message"}, defaultValue = "example message", description = "Message body (default: ${DEFAULT-VALUE}).")
    String message;

    @Option(names = {"--topic"}, defaultValue = "arn:aws:sns:us-east-1:111122223333:ExampleTopic",
            description = "Topic ARN (default: ${DEFAULT-VALUE}).")
    String topic;

    @Option(names = {"--subject"}, defaultValue = "example subject", description = "Subject (default: ${DEFAULT-VALUE}).")
    String subject;

    @Override
    public void run() {
        System.out.println(EventTemplates.renderPretty("sns",
                Map.of("message", message, "topic", topic, "subject", subject)));
    }
}
