package it.unimib.datai.localfaas.cli.commands.event;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "s3", description = "Object created notification.")
public class S3EventCommand implements Runnable {

    @Option(names = {"--region"}, defaultValue = "us-east-1", description = "Region (default: ${DEFAULT-VALUE}).")
    String region;

    @Option(names = {"--bucket"}, defaultValue = "example-bucket", description = "Bucket name (default: ${DEFAULT-VALUE}).")
    String bucket;

    @Option(names = {"--key"}, defaultValue = "test/key", description = "Object key (default: ${DEFAULT-VALUE}).")
    String key;

    @Override
    public void run() {
        System.out.println(EventTemplates.renderPretty("s3", Map.of("region", region, "bucket", bucket, "key", key)));
    }
}
