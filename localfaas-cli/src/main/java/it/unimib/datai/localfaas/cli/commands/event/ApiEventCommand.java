package it.unimib.datai.localfaas.cli.commands.event;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "api", description = "HTTP API proxy request.")
public class ApiEventCommand implements Runnable {

    @Option(names = {"--method"}, defaultValue = "POST", description = "HTTP method (default: ${DEFAULT-VALUE}).")
    String method;

    @Option(names = {"--body"}, defaultValue = "{ \"test\": \"body\"}", description = "Request body (default: ${DEFAULT-VALUE}).")
    String body;

    @Option(names = {"--resource"}, defaultValue = "/{proxy+}", description = "Resource path template (default: ${DEFAULT-VALUE}).")
    String resource;

    @Option(names = {"--path"}, defaultValue = "/examplepath", description = "Request path (default: ${DEFAULT-VALUE}).")
    String path;

    @Override
    public void run() {
        System.out.println(EventTemplates.renderPretty("api",
                Map.of("method", method, "body", body, "resource", resource, "path", path)));
    }
}
